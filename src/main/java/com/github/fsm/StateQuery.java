package com.github.fsm;

/**
 * Derives the state a context is in, used once when an instance is created.
 */
@FunctionalInterface
public interface StateQuery<C, S> {
  S resolve(C context);
}
