package com.github.smvalidator;

import java.util.Objects;

import com.github.smvalidator.ValidationException.Code;

/**
 * A named callable referenced from a transition, either an action or a guard. Every reference
 * sharing an identifier denotes the same callable, so all of them must agree on the call
 * signature.
 */
public abstract class CallableReference {
  private final String identifier;
  private final boolean async;
  private final SourceLocation location;

  CallableReference(final String identifier, final boolean async,
      final SourceLocation location) throws ValidationException {
    if (identifier == null || identifier.trim().isEmpty()) {
      throw new ValidationException(Code.INVALID_MODEL, "Callable identifier cannot be blank",
          location);
    }
    this.identifier = identifier.trim();
    this.async = async;
    this.location = location == null ? SourceLocation.CALL_SITE : location;
  }

  public String getIdentifier() {
    return identifier;
  }

  /**
   * Whether the generated callable is invoked asynchronously. This describes the calling
   * convention of the user's code, the validator itself never waits on anything.
   */
  public boolean isAsync() {
    return async;
  }

  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), identifier, async);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    CallableReference other = (CallableReference) obj;
    return async == other.async && identifier.equals(other.identifier);
  }

  @Override
  public String toString() {
    return async ? identifier + ".await" : identifier;
  }
}
