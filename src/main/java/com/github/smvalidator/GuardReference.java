package com.github.smvalidator;

public final class GuardReference extends CallableReference {

  public GuardReference(final String identifier, final boolean async,
      final SourceLocation location) throws ValidationException {
    super(identifier, async, location);
  }

  public static GuardReference of(final String identifier) throws ValidationException {
    return new GuardReference(identifier, false, SourceLocation.CALL_SITE);
  }

  public static GuardReference async(final String identifier) throws ValidationException {
    return new GuardReference(identifier, true, SourceLocation.CALL_SITE);
  }
}
