package com.github.fsm;

import java.util.Optional;

/**
 * Fallback for an event regardless of the current state.
 */
public final class DefaultTransition<S, E, C> extends Transition<S, E, C> {

  DefaultTransition(final E event, final Optional<S> targetState, final StateAction<C> action)
      throws StateMachineException {
    super(Optional.empty(), event, targetState, action);
  }

  @Override
  public TransitionType getType() {
    return TransitionType.DEFAULT;
  }
}
