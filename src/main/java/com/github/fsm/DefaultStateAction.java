package com.github.fsm;

/**
 * Last-resort handler invoked when no transition matches. It never changes state.
 */
@FunctionalInterface
public interface DefaultStateAction<C, S, E> {
  void execute(C context, S currentState, E event, Object... args);
}
