package com.github.smvalidator;

/**
 * Unified single exception that's thrown by the validator. The code enum encapsulates the kind of
 * violation or misuse, the message names the offending identifier or state/event pair and the
 * location points back into the state machine definition where one is known.
 */
public final class ValidationException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final SourceLocation location;

  public ValidationException(final Code code) {
    this(code, code.getDescription(), SourceLocation.CALL_SITE);
  }

  public ValidationException(final Code code, final String message) {
    this(code, message, SourceLocation.CALL_SITE);
  }

  public ValidationException(final Code code, final String message,
      final SourceLocation location) {
    super(message);
    this.code = code;
    this.location = location == null ? SourceLocation.CALL_SITE : location;
  }

  public Code getCode() {
    return code;
  }

  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return "ValidationException [code=" + code + ", location=" + location + ", message="
        + getMessage() + "]";
  }

  public static enum Code {
    // 1.
    INCONSISTENT_ACTION_SIGNATURE(
        "Action is reused with differing input state, event or output state data"),
    // 2.
    INCONSISTENT_GUARD_SIGNATURE("Guard is reused with differing input state or event data"),
    // 3.
    UNREACHABLE_TRANSITION("Guarded transition follows an unguarded transition"),
    // 4.
    DUPLICATE_TRANSITION("State and event combination has more than one unguarded transition"),
    // 5.
    INVALID_MODEL("State machine model is malformed"),
    // 6.
    INVALID_VALIDATOR_CONFIG("Validator configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
