package com.github.smvalidator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.smvalidator.ValidationException.Code;
import com.github.smvalidator.ViolationHandler.CollectingHandler;

/**
 * Runs the enabled {@link ModelValidator} passes over a model, in {@link ValidationCheck} order.
 */
final class StateMachineValidatorImpl implements StateMachineValidator {
  private static final Logger logger =
      LogManager.getLogger(StateMachineValidatorImpl.class.getSimpleName());

  // all passes in run order
  private static final List<ModelValidator> allPasses =
      Collections.unmodifiableList(Arrays.asList(new ActionSignatureValidator(),
          new GuardSignatureValidator(), new UnreachableTransitionValidator()));

  private final ValidatorConfiguration config;
  private final List<ModelValidator> passes;

  StateMachineValidatorImpl(final ValidatorConfiguration config) {
    this.config = config;
    final List<ModelValidator> enabled = new ArrayList<>();
    for (final ModelValidator pass : allPasses) {
      if (config.isEnabled(pass.getCheck())) {
        enabled.add(pass);
      }
    }
    this.passes = Collections.unmodifiableList(enabled);
  }

  @Override
  public void validate(final ParsedStateMachine machine) throws ValidationException {
    if (!config.isFailFast()) {
      final ValidationResult result = collectViolations(machine);
      if (!result.isSuccessful()) {
        final ValidationException first = result.firstViolation().get();
        for (final ValidationException other : result.getViolations()) {
          if (other != first) {
            first.addSuppressed(other);
          }
        }
        throw first;
      }
      return;
    }

    requireMachine(machine);
    logger.info("Validating " + machine);
    for (final ModelValidator pass : passes) {
      if (logger.isDebugEnabled()) {
        logger.debug("Running " + pass.getCheck() + " check");
      }
      try {
        pass.validate(machine, ViolationHandler.FAIL_FAST);
      } catch (ValidationException violation) {
        logger.warn(pass.getCheck() + " check failed at " + violation.getLocation() + ": "
            + violation.getMessage());
        throw violation;
      }
    }
    logger.info("Successfully validated state machine with " + machine.transitionCount()
        + " transitions");
  }

  @Override
  public ValidationResult collectViolations(final ParsedStateMachine machine)
      throws ValidationException {
    requireMachine(machine);
    logger.info("Collecting violations for " + machine);
    final List<ValidationException> violations = new ArrayList<>();
    for (final ModelValidator pass : passes) {
      final CollectingHandler handler = ViolationHandler.collecting();
      pass.validate(machine, handler);
      for (final ValidationException violation : handler.getViolations()) {
        logger.warn(pass.getCheck() + " check failed at " + violation.getLocation() + ": "
            + violation.getMessage());
      }
      violations.addAll(handler.getViolations());
    }
    final ValidationResult result = new ValidationResult(violations);
    logger.info("Found " + violations.size() + " violations");
    return result;
  }

  @Override
  public ValidatorConfiguration getConfiguration() {
    return config;
  }

  private static void requireMachine(final ParsedStateMachine machine)
      throws ValidationException {
    if (machine == null) {
      throw new ValidationException(Code.INVALID_MODEL, "State machine model cannot be null");
    }
  }
}
