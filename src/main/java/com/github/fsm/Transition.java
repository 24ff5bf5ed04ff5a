package com.github.fsm;

import java.util.Optional;

import com.github.fsm.StateMachineException.Code;

/**
 * Base of all transition variants. A transition with a target state is external and runs the exit
 * and entry hooks around its action, even when the target is the start state. A transition without
 * a target state is internal and only runs its action.
 */
public abstract class Transition<S, E, C> {
  private final Optional<S> startState;
  private final E event;
  private final Optional<S> targetState;
  private final StateAction<C> action;

  Transition(final Optional<S> startState, final E event, final Optional<S> targetState,
      final StateAction<C> action) throws StateMachineException {
    if (event == null) {
      throw new StateMachineException(Code.INVALID_EVENT);
    }
    if (startState == null || targetState == null) {
      throw new StateMachineException(Code.INVALID_STATE);
    }
    this.startState = startState;
    this.event = event;
    this.targetState = targetState;
    this.action = action;
  }

  public abstract TransitionType getType();

  /**
   * Empty for default transitions, which apply from any state.
   */
  public Optional<S> getStartState() {
    return startState;
  }

  public E getEvent() {
    return event;
  }

  public Optional<S> getTargetState() {
    return targetState;
  }

  public boolean isExternal() {
    return targetState.isPresent();
  }

  /**
   * Runs the action, if any. A missing action makes the transition a plain state change.
   */
  void execute(final C context, final Object... args) {
    if (action != null) {
      action.execute(context, args);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " [startState=" + startState.orElse(null) + ", event="
        + event + ", targetState=" + targetState.orElse(null) + ", external=" + isExternal() + "]";
  }
}
