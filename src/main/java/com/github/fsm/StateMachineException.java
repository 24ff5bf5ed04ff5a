package com.github.fsm;

/**
 * Unified single exception that's thrown by this FSM for its own error conditions. The code enum
 * tells configuration errors (raised by the builder) apart from dispatch errors (raised by an
 * instance). Exceptions thrown by user-supplied actions and guards are never wrapped into this
 * type, they reach the caller as thrown.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1. build time
    MACHINE_COMPLETED("State machine definition has been completed and cannot be changed"),
    // 2.
    DUPLICATE_TRANSITION("Unguarded transition already defined for state and event"),
    // 3.
    DUPLICATE_DEFAULT_TRANSITION("Default transition already defined for event"),
    // 4.
    DUPLICATE_DEFAULT_ACTION("Default action already defined"),
    // 5.
    DUPLICATE_ENTRY_ACTION("Entry action already defined"),
    // 6.
    DUPLICATE_EXIT_ACTION("Exit action already defined"),
    // 7.
    INVALID_STATE("Null state is invalid"),
    // 8.
    INVALID_EVENT("Null event is invalid"),
    // 9.
    INVALID_GUARD("Null guard is invalid"),
    // 10.
    INVALID_ACTION("Null action is invalid"),
    // 11. instance creation
    MISSING_INITIAL_STATE(
        "No explicit initial state was provided and no initial state function is defined"),
    // 12.
    INVALID_CONTEXT("Null context is invalid"),
    // 13.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 14. dispatch time
    EVENT_NOT_ALLOWED("Event is not allowed in the current state"),
    // 15.
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire read or write lock to perform requested operation. This is retryable."),
    // 16.
    INTERRUPTED("State machine was interrupted");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
