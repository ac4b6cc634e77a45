package com.github.smvalidator;

import java.util.Optional;

import com.github.smvalidator.ValidationException.Code;

/**
 * One arm of a (state, event) pair: where the machine goes, under which guard and invoking which
 * action. A transition without a guard acts as the wildcard "else" arm for its pair.
 */
public final class Transition {
  private final String fromState;
  private final String event;
  private final String toState;
  private final Optional<GuardExpression> guard;
  private final Optional<ActionReference> action;
  private final SourceLocation location;

  public Transition(final String fromState, final String event, final String toState,
      final GuardExpression guard, final ActionReference action, final SourceLocation location)
      throws ValidationException {
    this.fromState = requireName(fromState, "Source state");
    this.event = requireName(event, "Event");
    this.toState = requireName(toState, "Target state");
    this.guard = Optional.ofNullable(guard);
    this.action = Optional.ofNullable(action);
    this.location = location == null ? SourceLocation.CALL_SITE : location;
  }

  static String requireName(final String name, final String what) throws ValidationException {
    if (name == null || name.trim().isEmpty()) {
      throw new ValidationException(Code.INVALID_MODEL, what + " name cannot be null or blank");
    }
    return name.trim();
  }

  public String getFromState() {
    return fromState;
  }

  public String getEvent() {
    return event;
  }

  public String getToState() {
    return toState;
  }

  public Optional<GuardExpression> getGuard() {
    return guard;
  }

  public Optional<ActionReference> getAction() {
    return action;
  }

  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return "Transition [fromState=" + fromState + ", event=" + event + ", toState=" + toState
        + ", guard=" + guard.map(Object::toString).orElse("none") + ", action="
        + action.map(Object::toString).orElse("none") + "]";
  }
}
