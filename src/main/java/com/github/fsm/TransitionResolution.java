package com.github.fsm;

import java.util.Optional;

/**
 * The single rule picked by {@link StateMachineDefinition#resolve} for a state and event. It holds
 * either a transition or a default action, never both. Default actions always execute as internal
 * transitions.
 */
public final class TransitionResolution<S, E, C> {
  public static enum Kind {
    TRANSITION, STATE_DEFAULT, GLOBAL_DEFAULT;
  }

  private final Kind kind;
  private final Transition<S, E, C> transition;
  private final DefaultStateAction<C, S, E> defaultAction;

  private TransitionResolution(final Kind kind, final Transition<S, E, C> transition,
      final DefaultStateAction<C, S, E> defaultAction) {
    this.kind = kind;
    this.transition = transition;
    this.defaultAction = defaultAction;
  }

  static <S, E, C> TransitionResolution<S, E, C> ofTransition(
      final Transition<S, E, C> transition) {
    return new TransitionResolution<>(Kind.TRANSITION, transition, null);
  }

  static <S, E, C> TransitionResolution<S, E, C> ofStateDefault(
      final DefaultStateAction<C, S, E> defaultAction) {
    return new TransitionResolution<>(Kind.STATE_DEFAULT, null, defaultAction);
  }

  static <S, E, C> TransitionResolution<S, E, C> ofGlobalDefault(
      final DefaultStateAction<C, S, E> defaultAction) {
    return new TransitionResolution<>(Kind.GLOBAL_DEFAULT, null, defaultAction);
  }

  public Kind getKind() {
    return kind;
  }

  public Optional<Transition<S, E, C>> getTransition() {
    return Optional.ofNullable(transition);
  }

  public Optional<DefaultStateAction<C, S, E>> getDefaultAction() {
    return Optional.ofNullable(defaultAction);
  }

  public boolean isExternal() {
    return transition != null && transition.isExternal();
  }

  @Override
  public String toString() {
    return "TransitionResolution [kind=" + kind + ", transition=" + transition + "]";
  }
}
