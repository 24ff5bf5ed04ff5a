package com.github.fsm;

import java.util.Set;

/**
 * A live instance of a finite state machine: one {@link StateMachineDefinition} bound to one
 * context, tracking the current state.
 *
 * Notes for users:<br>
 * 0. dispatch is deterministic as long as guards are: the same state, event, context and
 * arguments always select the same rule<br>
 *
 * 1. the definition is immutable and shared; create as many instances from it as needed, there is
 * no need to rebuild the definition per context<br>
 *
 * 2. an instance is not thread-safe. Either confine it to one thread or create it with a
 * {@link StateMachineConfiguration} that enables synchronized dispatch<br>
 *
 * 3. the context is owned by the caller. The machine never constructs, copies or inspects it, it
 * only hands it to the caller's actions and guards<br>
 *
 * 4. exceptions raised by actions and guards reach the caller unmodified. The machine does not
 * roll back whatever already happened before the failing step<br>
 *
 * @param <S> states of the machine
 * @param <E> events the machine reacts to
 * @param <C> context the actions and guards are invoked on
 */
public interface StateMachine<S, E, C> {

  /**
   * Resolve the rule for event in the current state and execute it. External transitions run, in
   * order: exit action of the source state, default exit action, the transition action, the state
   * change, entry action of the target state, default entry action. Internal transitions and
   * default actions only run their action.
   *
   * Throws a {@link StateMachineException} with code EVENT_NOT_ALLOWED when no rule matches; the
   * current state is left unchanged.
   */
  void sendEvent(final E event, final Object... args) throws StateMachineException;

  /**
   * Read/report the current state of the state machine.
   */
  S getCurrentState() throws StateMachineException;

  /**
   * Events allowed from the current state, guards not evaluated.
   */
  Set<E> allowed(final boolean includeDefaults) throws StateMachineException;

  boolean eventAllowed(final E event, final boolean includeDefault) throws StateMachineException;

  C getContext();

  StateMachineDefinition<S, E, C> getDefinition();

  /**
   * Reports the id of this instance.
   */
  String getId();

  StateMachineStatistics getStatistics();

}
