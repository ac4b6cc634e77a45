package com.github.smvalidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Receives every violation a {@link ModelValidator} runs into. The fail-fast handler rethrows and
 * so aborts the pass, the collecting handler records and lets the traversal carry on.
 */
interface ViolationHandler {

  void onViolation(final ValidationException violation) throws ValidationException;

  ViolationHandler FAIL_FAST = violation -> {
    throw violation;
  };

  static CollectingHandler collecting() {
    return new CollectingHandler();
  }

  final static class CollectingHandler implements ViolationHandler {
    private final List<ValidationException> violations = new ArrayList<>();

    @Override
    public void onViolation(final ValidationException violation) {
      violations.add(violation);
    }

    List<ValidationException> getViolations() {
      return Collections.unmodifiableList(violations);
    }
  }
}
