package com.github.smvalidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * This object encapsulates the outcome of running every enabled check over a state machine without
 * stopping at the first violation.
 * 
 * Successes report {@link #isSuccessful()} as true and carry no violations. Failures list their
 * violations in the order the checks ran and, within one check, in traversal order.
 */
public final class ValidationResult {
  private final List<ValidationException> violations;

  ValidationResult(final List<ValidationException> violations) {
    this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
  }

  public boolean isSuccessful() {
    return violations.isEmpty();
  }

  public List<ValidationException> getViolations() {
    return violations;
  }

  /**
   * The violation {@link StateMachineValidator#validate(ParsedStateMachine)} would have thrown.
   */
  public Optional<ValidationException> firstViolation() {
    return violations.isEmpty() ? Optional.empty() : Optional.of(violations.get(0));
  }

  @Override
  public String toString() {
    return "ValidationResult [successful=" + isSuccessful() + ", violations=" + violations + "]";
  }
}
