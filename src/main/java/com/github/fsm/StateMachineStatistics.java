package com.github.fsm;

/**
 * Simple statistics holder for a state machine instance. Updates and reads are synchronized so that
 * totals read from any thread are current, whatever the threading of the owning instance.
 */
public final class StateMachineStatistics {
  private final String machineId;
  private final long startTstampMillis = System.currentTimeMillis();
  private int externalTransitions;
  private int internalTransitions;
  private int defaultActions;
  private int rejectedEvents;
  private int failedEvents;
  private long lastEventMillis;

  StateMachineStatistics(final String machineId) {
    this.machineId = machineId;
  }

  synchronized void eventReceived() {
    lastEventMillis = System.currentTimeMillis();
  }

  synchronized void externalTransition() {
    externalTransitions++;
  }

  synchronized void internalTransition() {
    internalTransitions++;
  }

  synchronized void defaultAction() {
    defaultActions++;
  }

  synchronized void eventRejected() {
    rejectedEvents++;
  }

  synchronized void eventFailed() {
    failedEvents++;
  }

  public String getMachineId() {
    return machineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public synchronized int getExternalTransitions() {
    return externalTransitions;
  }

  public synchronized int getInternalTransitions() {
    return internalTransitions;
  }

  /**
   * Events handled by a state or global default action.
   */
  public synchronized int getDefaultActions() {
    return defaultActions;
  }

  /**
   * Events for which no rule matched.
   */
  public synchronized int getRejectedEvents() {
    return rejectedEvents;
  }

  /**
   * Events during which an action, guard or hook threw.
   */
  public synchronized int getFailedEvents() {
    return failedEvents;
  }

  public synchronized long getLastEventMillis() {
    return lastEventMillis;
  }

  public synchronized int getTotalEvents() {
    return externalTransitions + internalTransitions + defaultActions + rejectedEvents
        + failedEvents;
  }

  @Override
  public synchronized String toString() {
    return "StateMachineStatistics [machineId=" + machineId + ", startTstampMillis="
        + startTstampMillis + ", externalTransitions=" + externalTransitions
        + ", internalTransitions=" + internalTransitions + ", defaultActions=" + defaultActions
        + ", rejectedEvents=" + rejectedEvents + ", failedEvents=" + failedEvents
        + ", lastEventMillis=" + lastEventMillis + "]";
  }

}
