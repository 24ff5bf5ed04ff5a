package com.github.fsm;

import java.util.Optional;

import com.github.fsm.StateMachineException.Code;

public final class SimpleTransition<S, E, C> extends Transition<S, E, C> {

  SimpleTransition(final S startState, final E event, final Optional<S> targetState,
      final StateAction<C> action) throws StateMachineException {
    super(Optional.ofNullable(startState), event, targetState, action);
    if (startState == null) {
      throw new StateMachineException(Code.INVALID_STATE);
    }
  }

  @Override
  public TransitionType getType() {
    return TransitionType.SIMPLE;
  }
}
