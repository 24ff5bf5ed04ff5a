package com.github.fsm;

import java.util.Objects;

/**
 * Composite (state, event) key of the transition table.
 */
public final class TransitionKey<S, E> {
  private final S state;
  private final E event;

  private TransitionKey(final S state, final E event) {
    this.state = state;
    this.event = event;
  }

  public S getState() {
    return state;
  }

  public E getEvent() {
    return event;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransitionKey)) {
      return false;
    }
    TransitionKey<?, ?> key = (TransitionKey<?, ?>) o;
    return Objects.equals(state, key.state) && Objects.equals(event, key.event);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, event);
  }

  @Override
  public String toString() {
    return state + ":" + event;
  }

  public static <S, E> TransitionKey<S, E> of(final S state, final E event) {
    return new TransitionKey<>(state, event);
  }
}
