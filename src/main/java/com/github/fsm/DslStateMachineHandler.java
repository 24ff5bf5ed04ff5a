package com.github.fsm;

/**
 * Top level of the nested configuration DSL. Every call delegates to the underlying
 * {@link StateMachineBuilder} and is subject to the same rules.
 *
 * <pre>
 * StateMachineBuilder.&lt;State, Event, Turnstile&gt;newBuilder().stateMachine(fsm -&gt; {
 *   fsm.initial(ts -&gt; ts.isLocked() ? LOCKED : UNLOCKED);
 *   fsm.state(LOCKED, state -&gt; state.transition(COIN, UNLOCKED, (ts, args) -&gt; ts.unlock()));
 * }).build();
 * </pre>
 */
public final class DslStateMachineHandler<S, E, C> {
  private final StateMachineBuilder<S, E, C> builder;

  DslStateMachineHandler(final StateMachineBuilder<S, E, C> builder) {
    this.builder = builder;
  }

  public DslStateMachineHandler<S, E, C> initial(final StateQuery<C, S> init)
      throws StateMachineException {
    builder.initial(init);
    return this;
  }

  public DslStateMachineHandler<S, E, C> defaultAction(final DefaultStateAction<C, S, E> action)
      throws StateMachineException {
    builder.defaultAction(action);
    return this;
  }

  public DslStateMachineHandler<S, E, C> defaultEntry(final StateChangeAction<C, S> action)
      throws StateMachineException {
    builder.defaultEntry(action);
    return this;
  }

  public DslStateMachineHandler<S, E, C> defaultExit(final StateChangeAction<C, S> action)
      throws StateMachineException {
    builder.defaultExit(action);
    return this;
  }

  public DslStateMachineHandler<S, E, C> defaultTransition(final E event,
      final StateAction<C> action) throws StateMachineException {
    builder.defaultTransition(event, action);
    return this;
  }

  public DslStateMachineHandler<S, E, C> defaultTransition(final E event, final S targetState,
      final StateAction<C> action) throws StateMachineException {
    builder.defaultTransition(event, targetState, action);
    return this;
  }

  /**
   * Opens a block in which transitions and hooks are declared for currentState.
   */
  public DslStateMachineHandler<S, E, C> state(final S currentState,
      final DslConfigurer<DslStateHandler<S, E, C>> configurer) throws StateMachineException {
    if (currentState == null) {
      throw new StateMachineException(StateMachineException.Code.INVALID_STATE);
    }
    configurer.configure(new DslStateHandler<>(currentState, builder));
    return this;
  }

  public StateMachineDefinition<S, E, C> build() throws StateMachineException {
    return builder.complete();
  }
}
