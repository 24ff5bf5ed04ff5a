package com.github.fsm;

/**
 * Block of configuration calls applied to a DSL handler.
 */
@FunctionalInterface
public interface DslConfigurer<T> {
  void configure(T handler) throws StateMachineException;
}
