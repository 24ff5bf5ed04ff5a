package com.github.fsm;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsm.StateMachineException.Code;

/**
 * Single threaded state machine instance. See {@link StateMachine} for the dispatch contract.
 */
final class StateMachineImpl<S, E, C> implements StateMachine<S, E, C> {
  private static final Logger logger = LogManager.getLogger(StateMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();
  private final StateMachineDefinition<S, E, C> definition;
  private final C context;
  private final StateMachineStatistics machineStats;
  private S currentState;

  StateMachineImpl(final StateMachineDefinition<S, E, C> definition, final C context,
      final S initialState) {
    this.definition = definition;
    this.context = context;
    this.currentState = initialState;
    this.machineStats = new StateMachineStatistics(machineId);
    logInfo(machineId, "Created state machine in state " + initialState);
  }

  @Override
  public void sendEvent(final E event, final Object... args) throws StateMachineException {
    if (event == null) {
      throw new StateMachineException(Code.INVALID_EVENT);
    }
    machineStats.eventReceived();
    final S sourceState = currentState;
    final TransitionResolution<S, E, C> resolution;
    try {
      resolution = definition.resolve(sourceState, event, context, args);
    } catch (StateMachineException notAllowed) {
      machineStats.eventRejected();
      logWarning(machineId, notAllowed.getMessage());
      throw notAllowed;
    } catch (RuntimeException guardFailure) {
      machineStats.eventFailed();
      logError(machineId, "Guard failed for " + event + " in state " + sourceState, guardFailure);
      throw guardFailure;
    }
    logDebug(machineId, "Resolved " + event + " in state " + sourceState + " to " + resolution);

    try {
      switch (resolution.getKind()) {
        case TRANSITION:
          final Transition<S, E, C> transition = resolution.getTransition().get();
          if (transition.isExternal()) {
            executeExternal(sourceState, transition, args);
            machineStats.externalTransition();
          } else {
            transition.execute(context, args);
            machineStats.internalTransition();
          }
          break;
        case STATE_DEFAULT:
        case GLOBAL_DEFAULT:
          resolution.getDefaultAction().get().execute(context, sourceState, event, args);
          machineStats.defaultAction();
          break;
        default:
          throw new IllegalStateException("Unknown resolution kind " + resolution.getKind());
      }
    } catch (RuntimeException actionFailure) {
      machineStats.eventFailed();
      logError(machineId, "Failed to handle " + event + " from state " + sourceState
          + ", current state is " + currentState, actionFailure);
      throw actionFailure;
    }
  }

  /**
   * Exit hooks, action, state change, entry hooks. A failing step stops the sequence; the state
   * only changes once the action has completed.
   */
  private void executeExternal(final S sourceState, final Transition<S, E, C> transition,
      final Object... args) {
    final S targetState = transition.getTargetState().get();
    final Optional<StateChangeAction<C, S>> exitAction = definition.exitAction(sourceState);
    if (exitAction.isPresent()) {
      logDebug(machineId, "Exit action for " + sourceState);
      exitAction.get().execute(context, sourceState, targetState, args);
    }
    final Optional<StateChangeAction<C, S>> defaultExit = definition.defaultExitAction();
    if (defaultExit.isPresent()) {
      logDebug(machineId, "Default exit action for " + sourceState);
      defaultExit.get().execute(context, sourceState, targetState, args);
    }

    transition.execute(context, args);
    currentState = targetState;
    logDebug(machineId, String.format("Transitioned %s->%s on %s", sourceState, targetState,
        transition.getEvent()));

    final Optional<StateChangeAction<C, S>> entryAction = definition.entryAction(targetState);
    if (entryAction.isPresent()) {
      logDebug(machineId, "Entry action for " + targetState);
      entryAction.get().execute(context, sourceState, targetState, args);
    }
    final Optional<StateChangeAction<C, S>> defaultEntry = definition.defaultEntryAction();
    if (defaultEntry.isPresent()) {
      logDebug(machineId, "Default entry action for " + targetState);
      defaultEntry.get().execute(context, sourceState, targetState, args);
    }
  }

  @Override
  public S getCurrentState() {
    return currentState;
  }

  @Override
  public Set<E> allowed(final boolean includeDefaults) {
    return definition.allowed(currentState, includeDefaults);
  }

  @Override
  public boolean eventAllowed(final E event, final boolean includeDefault) {
    return definition.eventAllowed(event, currentState, includeDefault);
  }

  @Override
  public C getContext() {
    return context;
  }

  @Override
  public StateMachineDefinition<S, E, C> getDefinition() {
    return definition;
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public StateMachineStatistics getStatistics() {
    return machineStats;
  }

  @Override
  public String toString() {
    return "StateMachineImpl [machineId=" + machineId + ", currentState=" + currentState + "]";
  }

  private static void logError(final String machineId, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString(), error);
  }

  private static void logWarning(final String machineId, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String machineId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }
}
