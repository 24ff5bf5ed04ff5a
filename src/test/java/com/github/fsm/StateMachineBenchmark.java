package com.github.fsm;

import static com.github.fsm.Turnstile.TurnstileEvent.COIN;
import static com.github.fsm.Turnstile.TurnstileEvent.PASS;
import static com.github.fsm.Turnstile.TurnstileState.LOCKED;
import static com.github.fsm.Turnstile.TurnstileState.UNLOCKED;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

import com.github.fsm.Turnstile.TurnstileEvent;
import com.github.fsm.Turnstile.TurnstileState;

/**
 * Micro-benchmark of dispatch through a shared definition. Not a unit test; run it via JMH or
 * {@link #main(String[])}.
 */
@State(Scope.Thread)
public class StateMachineBenchmark {
  private StateMachineDefinition<TurnstileState, TurnstileEvent, Turnstile> definition;

  @Setup
  public void setUp() throws StateMachineException {
    final StateMachineBuilder<TurnstileState, TurnstileEvent, Turnstile> builder =
        StateMachineBuilder.newBuilder();
    definition = builder.initial(ts -> ts.isLocked() ? LOCKED : UNLOCKED)
        .transition(LOCKED, COIN, UNLOCKED, (ts, args) -> ts.unlock())
        .transition(UNLOCKED, PASS, LOCKED, (ts, args) -> ts.lock())
        .transition(UNLOCKED, COIN, (ts, args) -> ts.thankYou())
        .defaultAction((ts, state, event, args) -> ts.alarm()).complete();
  }

  @Benchmark
  public TurnstileState testTurnstileFlow() throws StateMachineException {
    final StateMachine<TurnstileState, TurnstileEvent, Turnstile> machine =
        definition.create(new Turnstile());
    // LOCKED->UNLOCKED
    machine.sendEvent(COIN);
    // internal
    machine.sendEvent(COIN);
    // UNLOCKED->LOCKED
    machine.sendEvent(PASS);
    // global default
    machine.sendEvent(PASS);
    return machine.getCurrentState();
  }

  public static void main(String args[]) throws StateMachineException {
    StateMachineBenchmark benchmark = new StateMachineBenchmark();
    benchmark.setUp();
    benchmark.testTurnstileFlow();
  }

}
