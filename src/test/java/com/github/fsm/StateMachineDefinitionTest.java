package com.github.fsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.github.fsm.StateMachineException.Code;
import com.github.fsm.TransitionResolution.Kind;

/**
 * Tests for transition resolution and the read-only queries of a definition.
 */
public class StateMachineDefinitionTest {
  enum States {
    IDLE, RUNNING, PAUSED, DONE;
  }

  enum Events {
    START, PAUSE, RESUME, FINISH, RESET;
  }

  private static StateMachineBuilder<States, Events, RecordingContext> newBuilder() {
    return StateMachineBuilder.newBuilder();
  }

  @Test
  public void testFirstPassingGuardWins() throws StateMachineException {
    final AtomicInteger evaluations = new AtomicInteger();
    final StateMachineDefinition<States, Events, RecordingContext> definition = newBuilder()
        .transition(States.IDLE, Events.START, States.DONE, (ctx, args) -> {
          evaluations.incrementAndGet();
          return false;
        }, null).transition(States.IDLE, Events.START, States.RUNNING, (ctx, args) -> {
          evaluations.incrementAndGet();
          return true;
        }, null).transition(States.IDLE, Events.START, States.PAUSED, (ctx, args) -> {
          evaluations.incrementAndGet();
          return true;
        }, null).complete();

    final TransitionResolution<States, Events, RecordingContext> resolution =
        definition.resolve(States.IDLE, Events.START, new RecordingContext());
    assertEquals(Kind.TRANSITION, resolution.getKind());
    assertEquals(TransitionType.GUARDED, resolution.getTransition().get().getType());
    assertEquals(Optional.of(States.RUNNING), resolution.getTransition().get().getTargetState());
    // the third guard is never consulted
    assertEquals(2, evaluations.get());
  }

  @Test
  public void testGuardsSeeCallArguments() throws StateMachineException {
    final StateMachineDefinition<States, Events, RecordingContext> definition = newBuilder()
        .transition(States.IDLE, Events.START, States.RUNNING,
            (ctx, args) -> args.length == 2 && "fast".equals(args[0]), null)
        .transition(States.IDLE, Events.START, States.PAUSED, null).complete();

    assertEquals(Optional.of(States.RUNNING), definition
        .resolve(States.IDLE, Events.START, new RecordingContext(), "fast", 1).getTransition()
        .get().getTargetState());
    assertEquals(Optional.of(States.PAUSED), definition
        .resolve(States.IDLE, Events.START, new RecordingContext(), "slow", 1).getTransition()
        .get().getTargetState());
  }

  @Test
  public void testGuardedTriedBeforeSimpleRegardlessOfDeclarationOrder()
      throws StateMachineException {
    final StateMachineDefinition<States, Events, RecordingContext> definition = newBuilder()
        .transition(States.IDLE, Events.START, States.PAUSED, null)
        .transition(States.IDLE, Events.START, States.RUNNING, (ctx, args) -> true, null)
        .complete();
    final Transition<States, Events, RecordingContext> transition =
        definition.resolve(States.IDLE, Events.START, new RecordingContext()).getTransition()
            .get();
    assertEquals(TransitionType.GUARDED, transition.getType());
    assertEquals(Optional.of(States.RUNNING), transition.getTargetState());
  }

  @Test
  public void testResolutionOrder() throws StateMachineException {
    final DefaultStateAction<RecordingContext, States, Events> pausedDefault =
        (ctx, state, event, args) -> ctx.record("paused default");
    final DefaultStateAction<RecordingContext, States, Events> globalDefault =
        (ctx, state, event, args) -> ctx.record("global default");
    final StateMachineDefinition<States, Events, RecordingContext> definition = newBuilder()
        .transition(States.RUNNING, Events.PAUSE, States.PAUSED, (ctx, args) -> false, null)
        .transition(States.RUNNING, Events.FINISH, States.DONE, null)
        .defaultTransition(Events.RESET, States.IDLE, null)
        .defaultTransition(Events.PAUSE, null).defaultAction(States.PAUSED, pausedDefault)
        .defaultAction(globalDefault).complete();
    final RecordingContext context = new RecordingContext();

    // 1/2. state specific transition
    TransitionResolution<States, Events, RecordingContext> resolution =
        definition.resolve(States.RUNNING, Events.FINISH, context);
    assertEquals(TransitionType.SIMPLE, resolution.getTransition().get().getType());

    // 3. guard failed and no simple transition, falls through to the default transition
    resolution = definition.resolve(States.RUNNING, Events.PAUSE, context);
    assertEquals(TransitionType.DEFAULT, resolution.getTransition().get().getType());
    assertFalse(resolution.isExternal());

    // 3. default transition wins over the state default action
    resolution = definition.resolve(States.PAUSED, Events.RESET, context);
    assertEquals(TransitionType.DEFAULT, resolution.getTransition().get().getType());
    assertTrue(resolution.isExternal());
    assertFalse(resolution.getTransition().get().getStartState().isPresent());

    // 4. state default action
    resolution = definition.resolve(States.PAUSED, Events.RESUME, context);
    assertEquals(Kind.STATE_DEFAULT, resolution.getKind());
    assertSame(pausedDefault, resolution.getDefaultAction().get());
    assertFalse(resolution.isExternal());

    // 5. global default action
    resolution = definition.resolve(States.DONE, Events.RESUME, context);
    assertEquals(Kind.GLOBAL_DEFAULT, resolution.getKind());
    assertSame(globalDefault, resolution.getDefaultAction().get());

    // resolution itself never runs actions
    assertTrue(context.getCalls().isEmpty());
  }

  @Test
  public void testEventNotAllowed() throws StateMachineException {
    final StateMachineDefinition<States, Events, RecordingContext> definition = newBuilder()
        .transition(States.IDLE, Events.START, States.RUNNING, (ctx, args) -> false, null)
        .complete();
    for (States state : States.values()) {
      for (Events event : Events.values()) {
        try {
          definition.resolve(state, event, new RecordingContext());
          fail("expected " + event + " to be rejected in " + state);
        } catch (StateMachineException expected) {
          assertEquals(Code.EVENT_NOT_ALLOWED, expected.getCode());
        }
        if (state != States.IDLE || event != Events.START) {
          assertFalse(definition.eventAllowed(event, state, false));
          assertFalse(definition.eventAllowed(event, state, true));
        }
      }
    }
    // reported optimistically even though its only guard fails
    assertTrue(definition.eventAllowed(Events.START, States.IDLE, false));
    assertEquals(Collections.singleton(Events.START), definition.allowed(States.IDLE, false));
    assertAllowedAgrees(definition);
  }

  @Test
  public void testAllowedWithDefaults() throws StateMachineException {
    final StateMachineDefinition<States, Events, RecordingContext> definition = newBuilder()
        .transition(States.IDLE, Events.START, States.RUNNING, null)
        .transition(States.RUNNING, Events.PAUSE, States.PAUSED, null)
        .transition(States.PAUSED, Events.RESUME, States.RUNNING, null)
        .defaultTransition(Events.RESET, States.IDLE, null)
        .defaultAction(States.PAUSED, (ctx, state, event, args) -> ctx.record("ignored"))
        .complete();

    assertEquals(Collections.singleton(Events.START), definition.allowed(States.IDLE, false));
    assertEquals(new LinkedHashSet<>(Arrays.asList(Events.START, Events.RESET)),
        definition.allowed(States.IDLE, true));
    assertTrue(definition.allowed(States.DONE, false).isEmpty());
    assertEquals(Collections.singleton(Events.RESET), definition.allowed(States.DONE, true));
    // the state default action covers every event, FINISH included although no rule names it
    assertEquals(new LinkedHashSet<>(Arrays.asList(Events.values())),
        definition.allowed(States.PAUSED, true));

    assertFalse(definition.eventAllowed(Events.RESET, States.DONE, false));
    assertTrue(definition.eventAllowed(Events.RESET, States.DONE, true));
    assertFalse(definition.eventAllowed(Events.FINISH, States.DONE, true));
    assertTrue(definition.eventAllowed(Events.FINISH, States.PAUSED, true));
    assertAllowedAgrees(definition);
  }

  @Test
  public void testGlobalDefaultCoversEventsNoRuleNames() throws StateMachineException {
    final StateMachineDefinition<States, Events, RecordingContext> definition = newBuilder()
        .initial(ctx -> States.IDLE)
        .transition(States.IDLE, Events.START, States.RUNNING, null)
        .defaultAction((ctx, state, event, args) -> ctx.record("default " + event)).complete();

    assertEquals(Collections.singleton(Events.START), definition.allowed(States.IDLE, false));
    assertEquals(new LinkedHashSet<>(Arrays.asList(Events.values())),
        definition.allowed(States.IDLE, true));
    assertTrue(definition.eventAllowed(Events.FINISH, States.IDLE, true));
    assertFalse(definition.eventAllowed(Events.FINISH, States.IDLE, false));
    assertAllowedAgrees(definition);

    final RecordingContext context = new RecordingContext();
    final StateMachine<States, Events, RecordingContext> machine = definition.create(context);
    assertTrue(machine.allowed(true).contains(Events.FINISH));
    machine.sendEvent(Events.FINISH);
    assertEquals(States.IDLE, machine.getCurrentState());
    assertEquals(Collections.singletonList("default FINISH"), context.getCalls());
  }

  private static void assertAllowedAgrees(
      final StateMachineDefinition<States, Events, RecordingContext> definition) {
    for (States state : States.values()) {
      for (boolean includeDefaults : new boolean[] {false, true}) {
        final Set<Events> allowed = definition.allowed(state, includeDefaults);
        for (Events event : Events.values()) {
          assertEquals(state + " " + event + " " + includeDefaults, allowed.contains(event),
              definition.eventAllowed(event, state, includeDefaults));
        }
      }
    }
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testAllowedIsReadOnly() throws StateMachineException {
    final StateMachineDefinition<States, Events, RecordingContext> definition = newBuilder()
        .transition(States.IDLE, Events.START, States.RUNNING, null).complete();
    definition.allowed(States.IDLE, true).add(Events.FINISH);
  }

  @Test
  public void testGuardFailurePropagates() throws StateMachineException {
    final StateMachineDefinition<States, Events, RecordingContext> definition = newBuilder()
        .transition(States.IDLE, Events.START, States.RUNNING, (ctx, args) -> {
          throw new IllegalStateException("guard blew up");
        }, null).complete();
    try {
      definition.resolve(States.IDLE, Events.START, new RecordingContext());
      fail("expected the guard failure");
    } catch (IllegalStateException expected) {
      assertEquals("guard blew up", expected.getMessage());
    }
  }
}
