package com.github.smvalidator;

/**
 * Static consistency validator for a parsed state machine definition. It runs before any code is
 * generated from the definition and either accepts it or rejects it with a located violation.
 * 
 * Notes for users:<br>
 * 1. checks run in a fixed order: action signatures, guard signatures, unreachable transitions.
 * That order decides which violation is reported when a definition has several<br>
 * 
 * 2. the validator never mutates the model and keeps no state across calls, so one instance can
 * serve any number of threads and models<br>
 * 
 * 3. signatures are compared by shape only. Nothing here resolves or type checks the data types
 * themselves<br>
 */
public interface StateMachineValidator {

  /**
   * Validate the state machine, throwing the first violation found. Returns normally iff every
   * enabled check passes.
   */
  void validate(final ParsedStateMachine machine) throws ValidationException;

  /**
   * Run every enabled check to completion and report all violations instead of stopping at the
   * first one. Only a null model or similar misuse is thrown.
   */
  ValidationResult collectViolations(final ParsedStateMachine machine)
      throws ValidationException;

  /**
   * Returns the config that this validator is wired with.
   */
  ValidatorConfiguration getConfiguration();

  /**
   * A simple builder to let users use fluent APIs to build validators.
   */
  public final static class StateMachineValidatorBuilder {
    private ValidatorConfiguration config;

    public static StateMachineValidatorBuilder newBuilder() {
      return new StateMachineValidatorBuilder();
    }

    public StateMachineValidatorBuilder config(final ValidatorConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachineValidator build() {
      return new StateMachineValidatorImpl(
          config == null ? ValidatorConfiguration.defaults() : config);
    }

    private StateMachineValidatorBuilder() {}
  }

}
