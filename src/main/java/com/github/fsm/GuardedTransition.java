package com.github.fsm;

import java.util.Optional;

import com.github.fsm.StateMachineException.Code;

public final class GuardedTransition<S, E, C> extends Transition<S, E, C> {
  private final StateGuard<C> guard;

  GuardedTransition(final S startState, final E event, final Optional<S> targetState,
      final StateGuard<C> guard, final StateAction<C> action) throws StateMachineException {
    super(Optional.ofNullable(startState), event, targetState, action);
    if (startState == null) {
      throw new StateMachineException(Code.INVALID_STATE);
    }
    if (guard == null) {
      throw new StateMachineException(Code.INVALID_GUARD);
    }
    this.guard = guard;
  }

  @Override
  public TransitionType getType() {
    return TransitionType.GUARDED;
  }

  boolean guardPasses(final C context, final Object... args) {
    return guard.test(context, args);
  }
}
