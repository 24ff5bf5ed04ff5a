package com.github.fsm;

/**
 * State scoped block of the configuration DSL; every declaration uses the enclosing state as its
 * start state.
 */
public final class DslStateHandler<S, E, C> {
  private final S currentState;
  private final StateMachineBuilder<S, E, C> builder;

  DslStateHandler(final S currentState, final StateMachineBuilder<S, E, C> builder) {
    this.currentState = currentState;
    this.builder = builder;
  }

  public S getState() {
    return currentState;
  }

  public DslStateHandler<S, E, C> transition(final E event, final StateAction<C> action)
      throws StateMachineException {
    builder.transition(currentState, event, action);
    return this;
  }

  public DslStateHandler<S, E, C> transition(final E event, final S targetState,
      final StateAction<C> action) throws StateMachineException {
    builder.transition(currentState, event, targetState, action);
    return this;
  }

  public DslStateHandler<S, E, C> transition(final E event, final StateGuard<C> guard,
      final StateAction<C> action) throws StateMachineException {
    builder.transition(currentState, event, guard, action);
    return this;
  }

  public DslStateHandler<S, E, C> transition(final E event, final S targetState,
      final StateGuard<C> guard, final StateAction<C> action) throws StateMachineException {
    builder.transition(currentState, event, targetState, guard, action);
    return this;
  }

  public DslStateHandler<S, E, C> entry(final StateChangeAction<C, S> action)
      throws StateMachineException {
    builder.entry(currentState, action);
    return this;
  }

  public DslStateHandler<S, E, C> exit(final StateChangeAction<C, S> action)
      throws StateMachineException {
    builder.exit(currentState, action);
    return this;
  }

  public DslStateHandler<S, E, C> defaultAction(final DefaultStateAction<C, S, E> action)
      throws StateMachineException {
    builder.defaultAction(currentState, action);
    return this;
  }
}
