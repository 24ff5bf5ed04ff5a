package com.github.fsm;

import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsm.StateMachineException.Code;

/**
 * Opt-in thread-safe wrapper. sendEvent() holds the write lock for the whole resolution and
 * execution, so guard evaluation, actions and the state change form one unit; queries hold the
 * read lock. Lock waits are bounded by {@link StateMachineConfiguration#getLockAcquisitionMillis()}.
 */
final class SynchronizedStateMachine<S, E, C> implements StateMachine<S, E, C> {
  private static final Logger logger =
      LogManager.getLogger(SynchronizedStateMachine.class.getSimpleName());

  private final StateMachine<S, E, C> delegate;
  private final long lockAcquisitionMillis;
  private final WriteLock machineWriteLock;
  private final ReadLock machineReadLock;

  SynchronizedStateMachine(final StateMachine<S, E, C> delegate,
      final StateMachineConfiguration config) {
    this.delegate = delegate;
    this.lockAcquisitionMillis = config.getLockAcquisitionMillis();
    final ReentrantReadWriteLock machineSuperLock =
        new ReentrantReadWriteLock(config.isFairLocking());
    this.machineWriteLock = machineSuperLock.writeLock();
    this.machineReadLock = machineSuperLock.readLock();
    logger.info("[m:" + delegate.getId() + "] Synchronized dispatch enabled with " + config);
  }

  @Override
  public void sendEvent(final E event, final Object... args) throws StateMachineException {
    try {
      if (machineWriteLock.tryLock(lockAcquisitionMillis, TimeUnit.MILLISECONDS)) {
        try {
          delegate.sendEvent(event, args);
        } finally {
          machineWriteLock.unlock();
        }
      } else {
        throw new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to send event " + event);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new StateMachineException(Code.INTERRUPTED, exception);
    }
  }

  @Override
  public S getCurrentState() throws StateMachineException {
    acquireReadLock("read current state");
    try {
      return delegate.getCurrentState();
    } finally {
      machineReadLock.unlock();
    }
  }

  @Override
  public Set<E> allowed(final boolean includeDefaults) throws StateMachineException {
    acquireReadLock("read allowed events");
    try {
      return delegate.allowed(includeDefaults);
    } finally {
      machineReadLock.unlock();
    }
  }

  @Override
  public boolean eventAllowed(final E event, final boolean includeDefault)
      throws StateMachineException {
    acquireReadLock("check event " + event);
    try {
      return delegate.eventAllowed(event, includeDefault);
    } finally {
      machineReadLock.unlock();
    }
  }

  @Override
  public C getContext() {
    return delegate.getContext();
  }

  @Override
  public StateMachineDefinition<S, E, C> getDefinition() {
    return delegate.getDefinition();
  }

  @Override
  public String getId() {
    return delegate.getId();
  }

  @Override
  public StateMachineStatistics getStatistics() {
    return delegate.getStatistics();
  }

  boolean isWriteLocked() {
    return machineWriteLock.isHeldByCurrentThread();
  }

  private void acquireReadLock(final String operation) throws StateMachineException {
    try {
      if (!machineReadLock.tryLock(lockAcquisitionMillis, TimeUnit.MILLISECONDS)) {
        throw new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to " + operation);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new StateMachineException(Code.INTERRUPTED, exception);
    }
  }

  @Override
  public String toString() {
    return "SynchronizedStateMachine [delegate=" + delegate + "]";
  }
}
