package com.github.fsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * All transitions declared for one (state, event) key: guarded transitions in declaration order and
 * at most one unguarded transition that is tried after all guards have failed.
 */
public final class TransitionRules<S, E, C> {
  private final List<GuardedTransition<S, E, C>> guardedTransitions;
  private SimpleTransition<S, E, C> transition;

  TransitionRules() {
    this.guardedTransitions = new ArrayList<>();
  }

  private TransitionRules(final List<GuardedTransition<S, E, C>> guardedTransitions,
      final SimpleTransition<S, E, C> transition) {
    this.guardedTransitions = Collections.unmodifiableList(new ArrayList<>(guardedTransitions));
    this.transition = transition;
  }

  void addGuarded(final GuardedTransition<S, E, C> guardedTransition) {
    guardedTransitions.add(guardedTransition);
  }

  boolean hasTransition() {
    return transition != null;
  }

  void setTransition(final SimpleTransition<S, E, C> transition) {
    this.transition = transition;
  }

  /**
   * Evaluates guards in declaration order and returns the first transition whose guard passes.
   * Guards after the first match are not evaluated.
   */
  Optional<GuardedTransition<S, E, C>> findGuarded(final C context, final Object... args) {
    for (final GuardedTransition<S, E, C> guardedTransition : guardedTransitions) {
      if (guardedTransition.guardPasses(context, args)) {
        return Optional.of(guardedTransition);
      }
    }
    return Optional.empty();
  }

  public List<GuardedTransition<S, E, C>> getGuardedTransitions() {
    return guardedTransitions;
  }

  public Optional<SimpleTransition<S, E, C>> getTransition() {
    return Optional.ofNullable(transition);
  }

  boolean isEmpty() {
    return guardedTransitions.isEmpty() && transition == null;
  }

  /**
   * Read-only snapshot, detached from this accumulator.
   */
  TransitionRules<S, E, C> freeze() {
    return new TransitionRules<>(guardedTransitions, transition);
  }

  @Override
  public String toString() {
    return "TransitionRules [guardedTransitions=" + guardedTransitions + ", transition="
        + transition + "]";
  }
}
