package com.github.fsm;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.fsm.StateMachineException.Code;

/**
 * Mutable accumulator of transition rules and hooks. Use {@link #newBuilder()}, configure it via
 * chained calls or via {@link #stateMachine(DslConfigurer)}, and finalize it exactly once with
 * {@link #complete()}. Every call made after completion fails with {@link Code#MACHINE_COMPLETED}.
 *
 * @param <S> states of the machine
 * @param <E> events the machine reacts to
 * @param <C> context the actions and guards are invoked on
 */
public final class StateMachineBuilder<S, E, C> {
  private boolean completed;
  private StateQuery<C, S> deriveInitialState;
  private final Map<TransitionKey<S, E>, TransitionRules<S, E, C>> transitionRules =
      new LinkedHashMap<>();
  private final Map<E, DefaultTransition<S, E, C>> defaultTransitions = new LinkedHashMap<>();
  private final Map<S, StateChangeAction<C, S>> entryActions = new LinkedHashMap<>();
  private final Map<S, StateChangeAction<C, S>> exitActions = new LinkedHashMap<>();
  private final Map<S, DefaultStateAction<C, S, E>> defaultActions = new LinkedHashMap<>();
  // every event named by a rule, in order of first appearance
  private final Set<E> knownEvents = new LinkedHashSet<>();
  private DefaultStateAction<C, S, E> globalDefault;
  private StateChangeAction<C, S> defaultEntryAction;
  private StateChangeAction<C, S> defaultExitAction;

  public static <S, E, C> StateMachineBuilder<S, E, C> newBuilder() {
    return new StateMachineBuilder<>();
  }

  /**
   * Simple internal transition: runs the action and stays in startState.
   */
  public StateMachineBuilder<S, E, C> transition(final S startState, final E event,
      final StateAction<C> action) throws StateMachineException {
    return addTransition(startState, event, Optional.empty(), action);
  }

  /**
   * Simple external transition from startState to targetState. Exit and entry actions run around
   * the action.
   */
  public StateMachineBuilder<S, E, C> transition(final S startState, final E event,
      final S targetState, final StateAction<C> action) throws StateMachineException {
    return addTransition(startState, event, requireTarget(targetState), action);
  }

  /**
   * Guarded internal transition.
   */
  public StateMachineBuilder<S, E, C> transition(final S startState, final E event,
      final StateGuard<C> guard, final StateAction<C> action) throws StateMachineException {
    return addGuarded(startState, event, Optional.empty(), guard, action);
  }

  /**
   * Guarded external transition. Guards for the same state and event are evaluated in the order
   * they were declared and the first one passing wins, so overlapping guards must be declared from
   * most to least specific.
   */
  public StateMachineBuilder<S, E, C> transition(final S startState, final E event,
      final S targetState, final StateGuard<C> guard, final StateAction<C> action)
      throws StateMachineException {
    return addGuarded(startState, event, requireTarget(targetState), guard, action);
  }

  /**
   * Internal transition applied for event in any state that has no matching transition.
   */
  public StateMachineBuilder<S, E, C> defaultTransition(final E event, final StateAction<C> action)
      throws StateMachineException {
    return addDefaultTransition(event, Optional.empty(), action);
  }

  /**
   * External transition to targetState applied for event in any state that has no matching
   * transition.
   */
  public StateMachineBuilder<S, E, C> defaultTransition(final E event, final S targetState,
      final StateAction<C> action) throws StateMachineException {
    return addDefaultTransition(event, requireTarget(targetState), action);
  }

  /**
   * Global last-resort action invoked when nothing else matches the current state and event.
   */
  public StateMachineBuilder<S, E, C> defaultAction(final DefaultStateAction<C, S, E> action)
      throws StateMachineException {
    ensureNotCompleted();
    requireAction(action);
    if (globalDefault != null) {
      throw new StateMachineException(Code.DUPLICATE_DEFAULT_ACTION,
          "Global default action already defined");
    }
    globalDefault = action;
    return this;
  }

  /**
   * Last-resort action for currentState, tried before the global default action.
   */
  public StateMachineBuilder<S, E, C> defaultAction(final S currentState,
      final DefaultStateAction<C, S, E> action) throws StateMachineException {
    ensureNotCompleted();
    requireState(currentState);
    requireAction(action);
    if (defaultActions.containsKey(currentState)) {
      throw new StateMachineException(Code.DUPLICATE_DEFAULT_ACTION,
          "Default action already defined for " + currentState);
    }
    defaultActions.put(currentState, action);
    return this;
  }

  public StateMachineBuilder<S, E, C> entry(final S currentState,
      final StateChangeAction<C, S> action) throws StateMachineException {
    ensureNotCompleted();
    requireState(currentState);
    requireAction(action);
    if (entryActions.containsKey(currentState)) {
      throw new StateMachineException(Code.DUPLICATE_ENTRY_ACTION,
          "Entry action already defined for " + currentState);
    }
    entryActions.put(currentState, action);
    return this;
  }

  public StateMachineBuilder<S, E, C> exit(final S currentState,
      final StateChangeAction<C, S> action) throws StateMachineException {
    ensureNotCompleted();
    requireState(currentState);
    requireAction(action);
    if (exitActions.containsKey(currentState)) {
      throw new StateMachineException(Code.DUPLICATE_EXIT_ACTION,
          "Exit action already defined for " + currentState);
    }
    exitActions.put(currentState, action);
    return this;
  }

  /**
   * Entry action run for every target state, after the state specific entry action.
   */
  public StateMachineBuilder<S, E, C> defaultEntry(final StateChangeAction<C, S> action)
      throws StateMachineException {
    ensureNotCompleted();
    requireAction(action);
    if (defaultEntryAction != null) {
      throw new StateMachineException(Code.DUPLICATE_ENTRY_ACTION,
          "Default entry action already defined");
    }
    defaultEntryAction = action;
    return this;
  }

  /**
   * Exit action run for every source state, after the state specific exit action.
   */
  public StateMachineBuilder<S, E, C> defaultExit(final StateChangeAction<C, S> action)
      throws StateMachineException {
    ensureNotCompleted();
    requireAction(action);
    if (defaultExitAction != null) {
      throw new StateMachineException(Code.DUPLICATE_EXIT_ACTION,
          "Default exit action already defined");
    }
    defaultExitAction = action;
    return this;
  }

  /**
   * Function deriving the initial state of an instance from its context. The latest assignment
   * made before completion is kept.
   */
  public StateMachineBuilder<S, E, C> initial(final StateQuery<C, S> init)
      throws StateMachineException {
    ensureNotCompleted();
    if (init == null) {
      throw new StateMachineException(Code.INVALID_ACTION, "Initial state function is null");
    }
    deriveInitialState = init;
    return this;
  }

  /**
   * Configures this builder through the nested DSL and returns the handler, whose
   * {@link DslStateMachineHandler#build()} completes the definition.
   */
  public DslStateMachineHandler<S, E, C> stateMachine(
      final DslConfigurer<DslStateMachineHandler<S, E, C>> configurer)
      throws StateMachineException {
    ensureNotCompleted();
    final DslStateMachineHandler<S, E, C> handler = new DslStateMachineHandler<>(this);
    configurer.configure(handler);
    return handler;
  }

  /**
   * Freezes this builder and returns the immutable definition. The builder is inert afterwards.
   */
  public StateMachineDefinition<S, E, C> complete() throws StateMachineException {
    ensureNotCompleted();
    completed = true;
    final Map<TransitionKey<S, E>, TransitionRules<S, E, C>> frozenRules = new LinkedHashMap<>();
    for (final Map.Entry<TransitionKey<S, E>, TransitionRules<S, E, C>> entry : transitionRules
        .entrySet()) {
      frozenRules.put(entry.getKey(), entry.getValue().freeze());
    }
    return new StateMachineDefinition<>(deriveInitialState, frozenRules, defaultTransitions,
        entryActions, exitActions, defaultActions, knownEvents, globalDefault,
        defaultEntryAction, defaultExitAction);
  }

  public StateMachineDefinition<S, E, C> build() throws StateMachineException {
    return complete();
  }

  public boolean isCompleted() {
    return completed;
  }

  private StateMachineBuilder<S, E, C> addTransition(final S startState, final E event,
      final Optional<S> targetState, final StateAction<C> action) throws StateMachineException {
    ensureNotCompleted();
    final SimpleTransition<S, E, C> transition =
        new SimpleTransition<>(startState, event, targetState, action);
    final TransitionRules<S, E, C> rules = rulesFor(startState, event);
    if (rules.hasTransition()) {
      throw new StateMachineException(Code.DUPLICATE_TRANSITION,
          "Unguarded transition for " + startState + " on " + event + " already defined");
    }
    rules.setTransition(transition);
    knownEvents.add(event);
    return this;
  }

  private StateMachineBuilder<S, E, C> addGuarded(final S startState, final E event,
      final Optional<S> targetState, final StateGuard<C> guard, final StateAction<C> action)
      throws StateMachineException {
    ensureNotCompleted();
    final GuardedTransition<S, E, C> transition =
        new GuardedTransition<>(startState, event, targetState, guard, action);
    rulesFor(startState, event).addGuarded(transition);
    knownEvents.add(event);
    return this;
  }

  private StateMachineBuilder<S, E, C> addDefaultTransition(final E event,
      final Optional<S> targetState, final StateAction<C> action) throws StateMachineException {
    ensureNotCompleted();
    final DefaultTransition<S, E, C> transition =
        new DefaultTransition<>(event, targetState, action);
    if (defaultTransitions.containsKey(event)) {
      throw new StateMachineException(Code.DUPLICATE_DEFAULT_TRANSITION,
          "Default transition for " + event + " already defined");
    }
    defaultTransitions.put(event, transition);
    knownEvents.add(event);
    return this;
  }

  private TransitionRules<S, E, C> rulesFor(final S startState, final E event) {
    return transitionRules.computeIfAbsent(TransitionKey.of(startState, event),
        key -> new TransitionRules<>());
  }

  private void ensureNotCompleted() throws StateMachineException {
    if (completed) {
      throw new StateMachineException(Code.MACHINE_COMPLETED);
    }
  }

  private Optional<S> requireTarget(final S targetState) throws StateMachineException {
    requireState(targetState);
    return Optional.of(targetState);
  }

  private static void requireState(final Object state) throws StateMachineException {
    if (state == null) {
      throw new StateMachineException(Code.INVALID_STATE);
    }
  }

  private static void requireAction(final Object action) throws StateMachineException {
    if (action == null) {
      throw new StateMachineException(Code.INVALID_ACTION);
    }
  }

  private StateMachineBuilder() {}
}
