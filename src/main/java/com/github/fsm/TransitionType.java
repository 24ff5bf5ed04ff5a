package com.github.fsm;

/**
 * Tags the variant of a {@link Transition}. The variant decides where the transition sits in the
 * resolution order of a {@link StateMachineDefinition}.
 */
public enum TransitionType {
  // selected when its guard passes, tried first and in declaration order
  GUARDED,
  // at most one per state and event, tried after all guarded transitions failed
  SIMPLE,
  // keyed by event only, tried when no state specific transition matched
  DEFAULT;
}
