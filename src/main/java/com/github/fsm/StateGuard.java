package com.github.fsm;

/**
 * Predicate deciding whether a guarded transition applies. Guards should not mutate the context;
 * resolution relies on them being deterministic for a given context and arguments.
 */
@FunctionalInterface
public interface StateGuard<C> {
  boolean test(C context, Object... args);
}
