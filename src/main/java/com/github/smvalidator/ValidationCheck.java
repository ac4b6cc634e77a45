package com.github.smvalidator;

/**
 * The checks a {@link StateMachineValidator} can run. Declaration order is the run order.
 */
public enum ValidationCheck {
  ACTION_SIGNATURES, GUARD_SIGNATURES, UNREACHABLE_TRANSITIONS;
}
