package com.github.smvalidator;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.smvalidator.ValidationException.Code;

/**
 * Verifies that every guard reused across transitions sees the same source state and event data
 * everywhere. Each leaf of a guard expression is checked, however deeply it is nested.
 */
final class GuardSignatureValidator implements ModelValidator {
  private static final Logger logger =
      LogManager.getLogger(GuardSignatureValidator.class.getSimpleName());

  @Override
  public ValidationCheck getCheck() {
    return ValidationCheck.GUARD_SIGNATURES;
  }

  @Override
  public void validate(final ParsedStateMachine machine, final ViolationHandler handler)
      throws ValidationException {
    // K=guard identifier, V=signature at the first call site seen
    final Map<String, CallSignature> guards = new HashMap<>();

    for (final Map.Entry<String, Map<String, EventMapping>> stateEntry : machine
        .getStatesEventsMapping().entrySet()) {
      final Optional<DataType> inStateData = machine.stateData(stateEntry.getKey());

      for (final EventMapping eventMapping : stateEntry.getValue().values()) {
        final Optional<DataType> eventData = machine.eventData(eventMapping.getEvent());

        for (final Transition transition : eventMapping.getTransitions()) {
          if (!transition.getGuard().isPresent()) {
            continue;
          }
          transition.getGuard().get().visitGuards(guard -> {
            final CallSignature signature =
                CallSignature.ofGuard(inStateData, eventData, guard.isAsync());

            final CallSignature known = guards.putIfAbsent(guard.getIdentifier(), signature);
            if (known != null && !known.equals(signature)) {
              if (logger.isDebugEnabled()) {
                logger.debug("Guard " + guard.getIdentifier() + " first seen as " + known
                    + ", now called as " + signature + " on " + transition);
              }
              handler.onViolation(new ValidationException(Code.INCONSISTENT_GUARD_SIGNATURE,
                  "Guard `" + guard.getIdentifier()
                      + "` can only be reused when all input states and events have the same data",
                  ModelValidator.locate(guard, transition)));
            }
          });
        }
      }
    }

    if (logger.isDebugEnabled()) {
      logger.debug("Checked call signatures of " + guards.size() + " distinct guards");
    }
  }
}
