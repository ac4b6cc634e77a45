package com.github.smvalidator;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * This class encapsulates all the configuration parameters for the StateMachineValidator. Use the
 * {@code ValidatorConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. if no checks are set, all of them are run<br>
 * 2. checks always run in {@link ValidationCheck} declaration order, no matter the order they were
 * added in<br>
 * 3. failFast only governs {@link StateMachineValidator#validate(ParsedStateMachine)}: with it
 * turned off every enabled check still runs to completion and the violations found after the first
 * are attached to the thrown exception as suppressed exceptions<br>
 */
public final class ValidatorConfiguration {
  private final Set<ValidationCheck> checks;
  private final boolean failFast;

  public Set<ValidationCheck> getChecks() {
    return checks;
  }

  public boolean isEnabled(final ValidationCheck check) {
    return checks.contains(check);
  }

  public boolean isFailFast() {
    return failFast;
  }

  public static ValidatorConfiguration defaults() {
    return new ValidatorConfiguration(EnumSet.allOf(ValidationCheck.class), true);
  }

  public final static class ValidatorConfigurationBuilder {
    private Set<ValidationCheck> checks;
    private boolean nullCheck;
    private boolean failFast = true;

    public static ValidatorConfigurationBuilder newBuilder() {
      return new ValidatorConfigurationBuilder();
    }

    public ValidatorConfigurationBuilder check(final ValidationCheck check) {
      if (checks == null) {
        checks = EnumSet.noneOf(ValidationCheck.class);
      }
      if (check == null) {
        nullCheck = true;
      } else {
        checks.add(check);
      }
      return this;
    }

    public ValidatorConfigurationBuilder checks(final Set<ValidationCheck> checks) {
      this.checks = EnumSet.noneOf(ValidationCheck.class);
      if (checks != null) {
        for (final ValidationCheck check : checks) {
          check(check);
        }
      }
      return this;
    }

    public ValidatorConfigurationBuilder failFast(final boolean failFast) {
      this.failFast = failFast;
      return this;
    }

    public ValidatorConfiguration build() throws ValidationException {
      validate();
      return new ValidatorConfiguration(
          checks == null ? EnumSet.allOf(ValidationCheck.class) : checks, failFast);
    }

    private void validate() throws ValidationException {
      StringBuilder messages = new StringBuilder();
      if (checks != null && checks.isEmpty()) {
        messages.append("At least one check must be enabled. ");
      }
      if (nullCheck) {
        messages.append("Checks cannot contain null. ");
      }
      if (messages.length() > 0) {
        throw new ValidationException(ValidationException.Code.INVALID_VALIDATOR_CONFIG,
            messages.toString().trim());
      }
    }

    private ValidatorConfigurationBuilder() {}
  }

  @Override
  public String toString() {
    return "ValidatorConfiguration [checks=" + checks + ", failFast=" + failFast + "]";
  }

  private ValidatorConfiguration(final Set<ValidationCheck> checks, final boolean failFast) {
    this.checks = Collections.unmodifiableSet(EnumSet.copyOf(checks));
    this.failFast = failFast;
  }

}
