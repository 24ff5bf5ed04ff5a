package com.github.fsm;

/**
 * Action invoked against the context when a transition fires. The arguments are the ones handed to
 * {@link StateMachine#sendEvent(Object, Object...)}, unchecked and in order.
 */
@FunctionalInterface
public interface StateAction<C> {
  void execute(C context, Object... args);
}
