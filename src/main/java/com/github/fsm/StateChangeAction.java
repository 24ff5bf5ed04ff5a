package com.github.fsm;

/**
 * Entry or exit hook, invoked around external transitions with the source and target states.
 */
@FunctionalInterface
public interface StateChangeAction<C, S> {
  void execute(C context, S sourceState, S targetState, Object... args);
}
