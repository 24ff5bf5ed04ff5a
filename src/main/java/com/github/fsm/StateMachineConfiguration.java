package com.github.fsm;

/**
 * This class encapsulates the per-instance configuration parameters of a StateMachine. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. instances are single threaded by default. Setting synchronizedDispatch wraps the instance so
 * that every sendEvent() runs under a write lock and every query under a read lock.<br>
 * 2. lockAcquisitionMillis bounds how long a caller waits for those locks. If not set, a default of
 * 100 millis is used.<br>
 */
public final class StateMachineConfiguration {
  static final long defaultLockAcquisitionMillis = 100L;

  private final boolean synchronizedDispatch;
  private final long lockAcquisitionMillis;
  private final boolean fairLocking;

  public boolean isSynchronizedDispatch() {
    return synchronizedDispatch;
  }

  public long getLockAcquisitionMillis() {
    return lockAcquisitionMillis;
  }

  public boolean isFairLocking() {
    return fairLocking;
  }

  public final static class StateMachineConfigurationBuilder {
    private boolean synchronizedDispatch;
    private long lockAcquisitionMillis;
    private boolean fairLocking = true;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder synchronizedDispatch(
        final boolean synchronizedDispatch) {
      this.synchronizedDispatch = synchronizedDispatch;
      return this;
    }

    public StateMachineConfigurationBuilder lockAcquisitionMillis(
        final long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public StateMachineConfigurationBuilder fairLocking(final boolean fairLocking) {
      this.fairLocking = fairLocking;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      validate();
      return new StateMachineConfiguration(synchronizedDispatch, lockAcquisitionMillis,
          fairLocking);
    }

    private void validate() throws StateMachineException {
      StringBuilder messages = new StringBuilder();
      if (lockAcquisitionMillis < 0L) {
        messages.append("lockAcquisitionMillis cannot be negative. ");
      }
      if (messages.length() > 0) {
        throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
            messages.toString().trim());
      }
    }

    private StateMachineConfigurationBuilder() {}
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [synchronizedDispatch=" + synchronizedDispatch
        + ", lockAcquisitionMillis=" + lockAcquisitionMillis + ", fairLocking=" + fairLocking
        + "]";
  }

  private StateMachineConfiguration(final boolean synchronizedDispatch,
      final long lockAcquisitionMillis, final boolean fairLocking) {
    this.synchronizedDispatch = synchronizedDispatch;
    this.fairLocking = fairLocking;
    if (lockAcquisitionMillis <= 0L) {
      this.lockAcquisitionMillis = defaultLockAcquisitionMillis;
    } else {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
    }
  }

}
