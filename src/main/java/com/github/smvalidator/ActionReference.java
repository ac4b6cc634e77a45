package com.github.smvalidator;

public final class ActionReference extends CallableReference {

  public ActionReference(final String identifier, final boolean async,
      final SourceLocation location) throws ValidationException {
    super(identifier, async, location);
  }

  public static ActionReference of(final String identifier) throws ValidationException {
    return new ActionReference(identifier, false, SourceLocation.CALL_SITE);
  }

  public static ActionReference async(final String identifier) throws ValidationException {
    return new ActionReference(identifier, true, SourceLocation.CALL_SITE);
  }
}
