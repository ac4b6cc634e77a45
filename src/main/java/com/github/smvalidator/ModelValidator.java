package com.github.smvalidator;

/**
 * A single stateless analysis pass over a {@link ParsedStateMachine}. Passes only read the model;
 * whatever they track lives for the duration of one call.
 */
interface ModelValidator {

  ValidationCheck getCheck();

  void validate(final ParsedStateMachine machine, final ViolationHandler handler)
      throws ValidationException;

  default void validate(final ParsedStateMachine machine) throws ValidationException {
    validate(machine, ViolationHandler.FAIL_FAST);
  }

  // the callable's own span when the parser tracked one, else the transition's
  static SourceLocation locate(final CallableReference callable, final Transition transition) {
    return callable.getLocation().isCallSite() ? transition.getLocation()
        : callable.getLocation();
  }
}
