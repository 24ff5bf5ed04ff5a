package com.github.fsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsm.StateMachineException.Code;

/**
 * Immutable transition table produced by {@link StateMachineBuilder#complete()}. A definition is
 * never mutated after construction, so one definition can back any number of instances across
 * threads without synchronization.
 *
 * Resolution of an event in a state stops at the first match of:<br>
 * 1. guarded transitions for (state, event), guards evaluated in declaration order<br>
 * 2. the unguarded transition for (state, event)<br>
 * 3. the default transition for the event<br>
 * 4. the default action for the state<br>
 * 5. the global default action<br>
 * and fails with {@link Code#EVENT_NOT_ALLOWED} when none of these exist.
 */
public final class StateMachineDefinition<S, E, C> {
  private static final Logger logger =
      LogManager.getLogger(StateMachineDefinition.class.getSimpleName());

  private final StateQuery<C, S> deriveInitialState;
  private final Map<TransitionKey<S, E>, TransitionRules<S, E, C>> transitionRules;
  private final Map<E, DefaultTransition<S, E, C>> defaultTransitions;
  private final Map<S, StateChangeAction<C, S>> entryActions;
  private final Map<S, StateChangeAction<C, S>> exitActions;
  private final Map<S, DefaultStateAction<C, S, E>> defaultActions;
  private final Set<E> eventDomain;
  private final DefaultStateAction<C, S, E> globalDefault;
  private final StateChangeAction<C, S> defaultEntryAction;
  private final StateChangeAction<C, S> defaultExitAction;

  StateMachineDefinition(final StateQuery<C, S> deriveInitialState,
      final Map<TransitionKey<S, E>, TransitionRules<S, E, C>> transitionRules,
      final Map<E, DefaultTransition<S, E, C>> defaultTransitions,
      final Map<S, StateChangeAction<C, S>> entryActions,
      final Map<S, StateChangeAction<C, S>> exitActions,
      final Map<S, DefaultStateAction<C, S, E>> defaultActions, final Set<E> knownEvents,
      final DefaultStateAction<C, S, E> globalDefault,
      final StateChangeAction<C, S> defaultEntryAction,
      final StateChangeAction<C, S> defaultExitAction) {
    this.deriveInitialState = deriveInitialState;
    this.transitionRules = Collections.unmodifiableMap(new LinkedHashMap<>(transitionRules));
    this.defaultTransitions = Collections.unmodifiableMap(new LinkedHashMap<>(defaultTransitions));
    this.entryActions = Collections.unmodifiableMap(new LinkedHashMap<>(entryActions));
    this.exitActions = Collections.unmodifiableMap(new LinkedHashMap<>(exitActions));
    this.defaultActions = Collections.unmodifiableMap(new LinkedHashMap<>(defaultActions));
    this.eventDomain = Collections.unmodifiableSet(eventDomain(knownEvents));
    this.globalDefault = globalDefault;
    this.defaultEntryAction = defaultEntryAction;
    this.defaultExitAction = defaultExitAction;
    logger.info("Completed state machine definition with " + this.transitionRules.size()
        + " transition keys and " + this.defaultTransitions.size() + " default transitions");
  }

  /**
   * Picks the single rule that applies to event in state. Guards are evaluated against the live
   * context, nothing else is invoked.
   */
  public TransitionResolution<S, E, C> resolve(final S state, final E event, final C context,
      final Object... args) throws StateMachineException {
    final TransitionRules<S, E, C> rules = transitionRules.get(TransitionKey.of(state, event));
    if (rules != null) {
      final Optional<GuardedTransition<S, E, C>> guarded = rules.findGuarded(context, args);
      if (guarded.isPresent()) {
        return TransitionResolution.ofTransition(guarded.get());
      }
      final Optional<SimpleTransition<S, E, C>> transition = rules.getTransition();
      if (transition.isPresent()) {
        return TransitionResolution.ofTransition(transition.get());
      }
    }
    final DefaultTransition<S, E, C> defaultTransition = defaultTransitions.get(event);
    if (defaultTransition != null) {
      return TransitionResolution.ofTransition(defaultTransition);
    }
    final DefaultStateAction<C, S, E> stateDefault = defaultActions.get(state);
    if (stateDefault != null) {
      return TransitionResolution.ofStateDefault(stateDefault);
    }
    if (globalDefault != null) {
      return TransitionResolution.ofGlobalDefault(globalDefault);
    }
    throw new StateMachineException(Code.EVENT_NOT_ALLOWED,
        "Event " + event + " is not allowed in state " + state);
  }

  /**
   * Events that have at least one rule from state. Guards are not evaluated, so a guarded event is
   * reported even though dispatching it may still be rejected. With includeDefaults, events covered
   * by a default transition are added, and when a state or global default action exists the whole
   * event domain is added: every constant of the event enum, or every event named by a rule when
   * events are not enums.
   */
  public Set<E> allowed(final S state, final boolean includeDefaults) {
    final Set<E> events = new LinkedHashSet<>();
    for (final Map.Entry<TransitionKey<S, E>, TransitionRules<S, E, C>> entry : transitionRules
        .entrySet()) {
      if (entry.getKey().getState().equals(state) && !entry.getValue().isEmpty()) {
        events.add(entry.getKey().getEvent());
      }
    }
    if (includeDefaults) {
      events.addAll(defaultTransitions.keySet());
      if (hasDefaultAction(state)) {
        events.addAll(eventDomain);
      }
    }
    return Collections.unmodifiableSet(events);
  }

  /**
   * Single event form of {@link #allowed(Object, boolean)}; the two always agree.
   */
  public boolean eventAllowed(final E event, final S state, final boolean includeDefault) {
    final TransitionRules<S, E, C> rules = transitionRules.get(TransitionKey.of(state, event));
    if (rules != null && !rules.isEmpty()) {
      return true;
    }
    return includeDefault && (defaultTransitions.containsKey(event)
        || (hasDefaultAction(state) && eventDomain.contains(event)));
  }

  private boolean hasDefaultAction(final S state) {
    return globalDefault != null || defaultActions.containsKey(state);
  }

  /**
   * Events are a finite set: for enums that is every constant of the enum, otherwise only the
   * events named by rules can be enumerated.
   */
  private static <E> Set<E> eventDomain(final Set<E> knownEvents) {
    final Set<E> domain = new LinkedHashSet<>();
    for (final E event : knownEvents) {
      if (event instanceof Enum) {
        for (final Object constant : ((Enum<?>) event).getDeclaringClass().getEnumConstants()) {
          @SuppressWarnings("unchecked")
          final E member = (E) constant;
          domain.add(member);
        }
      }
      domain.add(event);
    }
    return domain;
  }

  /**
   * Creates an instance whose initial state is derived from the context.
   */
  public StateMachine<S, E, C> create(final C context) throws StateMachineException {
    return create(context, Optional.empty());
  }

  /**
   * Creates an instance, an explicit initial state overriding the initial state function.
   */
  public StateMachine<S, E, C> create(final C context, final Optional<S> initialState)
      throws StateMachineException {
    return create(context, initialState,
        StateMachineConfiguration.StateMachineConfigurationBuilder.newBuilder().build());
  }

  public StateMachine<S, E, C> create(final C context, final Optional<S> initialState,
      final StateMachineConfiguration config) throws StateMachineException {
    if (context == null) {
      throw new StateMachineException(Code.INVALID_CONTEXT);
    }
    if (config == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG, "Configuration cannot be null");
    }
    final S startState = initialState(context, initialState);
    final StateMachine<S, E, C> machine = new StateMachineImpl<>(this, context, startState);
    if (config.isSynchronizedDispatch()) {
      return new SynchronizedStateMachine<>(machine, config);
    }
    return machine;
  }

  private S initialState(final C context, final Optional<S> initialState)
      throws StateMachineException {
    if (initialState != null && initialState.isPresent()) {
      return initialState.get();
    }
    if (deriveInitialState == null) {
      throw new StateMachineException(Code.MISSING_INITIAL_STATE);
    }
    final S derived = deriveInitialState.resolve(context);
    if (derived == null) {
      throw new StateMachineException(Code.INVALID_STATE,
          "Initial state function returned null for " + context);
    }
    return derived;
  }

  Optional<StateChangeAction<C, S>> entryAction(final S state) {
    return Optional.ofNullable(entryActions.get(state));
  }

  Optional<StateChangeAction<C, S>> exitAction(final S state) {
    return Optional.ofNullable(exitActions.get(state));
  }

  Optional<StateChangeAction<C, S>> defaultEntryAction() {
    return Optional.ofNullable(defaultEntryAction);
  }

  Optional<StateChangeAction<C, S>> defaultExitAction() {
    return Optional.ofNullable(defaultExitAction);
  }

  public Optional<TransitionRules<S, E, C>> transitionRules(final S state, final E event) {
    return Optional.ofNullable(transitionRules.get(TransitionKey.of(state, event)));
  }

  public boolean hasInitialStateFunction() {
    return deriveInitialState != null;
  }

  @Override
  public String toString() {
    return "StateMachineDefinition [transitionRules=" + transitionRules.keySet()
        + ", defaultTransitions=" + defaultTransitions.keySet() + ", entryActions="
        + entryActions.keySet() + ", exitActions=" + exitActions.keySet() + ", defaultActions="
        + defaultActions.keySet() + ", globalDefault=" + (globalDefault != null) + "]";
  }
}
