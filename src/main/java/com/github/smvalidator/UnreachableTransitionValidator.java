package com.github.smvalidator;

import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.smvalidator.ValidationException.Code;

/**
 * Checks guard ordering for every (state, event) pair with more than one transition. Dispatch is
 * top to bottom, first match wins and an unguarded transition matches everything, so:<br>
 * 1. nothing guarded may follow an unguarded transition<br>
 * 2. there may be at most one unguarded transition<br>
 */
final class UnreachableTransitionValidator implements ModelValidator {
  private static final Logger logger =
      LogManager.getLogger(UnreachableTransitionValidator.class.getSimpleName());

  @Override
  public ValidationCheck getCheck() {
    return ValidationCheck.UNREACHABLE_TRANSITIONS;
  }

  @Override
  public void validate(final ParsedStateMachine machine, final ViolationHandler handler)
      throws ValidationException {
    int checkedPairs = 0;
    for (final Map.Entry<String, Map<String, EventMapping>> stateEntry : machine
        .getStatesEventsMapping().entrySet()) {
      final String inState = stateEntry.getKey();

      for (final EventMapping eventMapping : stateEntry.getValue().values()) {
        if (eventMapping.getTransitions().size() <= 1) {
          continue;
        }
        checkedPairs++;
        int unguardedCount = 0;
        for (final Transition transition : eventMapping.getTransitions()) {
          if (transition.getGuard().isPresent()) {
            if (unguardedCount > 0) {
              handler.onViolation(new ValidationException(Code.UNREACHABLE_TRANSITION,
                  inState + " + " + eventMapping.getEvent() + ": [" + transition.getGuard().get()
                      + "] : guarded transition is unreachable because it follows an unguarded transition, which handles all cases",
                  transition.getLocation()));
            }
          } else {
            unguardedCount++;
            if (unguardedCount > 1) {
              handler.onViolation(new ValidationException(Code.DUPLICATE_TRANSITION,
                  inState + " + " + eventMapping.getEvent()
                      + ": State and event combination specified multiple times, remove duplicates.",
                  transition.getLocation()));
            }
          }
        }
      }
    }

    if (logger.isDebugEnabled()) {
      logger.debug("Checked transition ordering of " + checkedPairs + " state and event pairs");
    }
  }
}
