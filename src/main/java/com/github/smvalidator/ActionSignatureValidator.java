package com.github.smvalidator;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.smvalidator.ValidationException.Code;

/**
 * Verifies that every action reused across transitions is called with the same data everywhere:
 * source state data and event data in, target state data out.
 */
final class ActionSignatureValidator implements ModelValidator {
  private static final Logger logger =
      LogManager.getLogger(ActionSignatureValidator.class.getSimpleName());

  @Override
  public ValidationCheck getCheck() {
    return ValidationCheck.ACTION_SIGNATURES;
  }

  @Override
  public void validate(final ParsedStateMachine machine, final ViolationHandler handler)
      throws ValidationException {
    // K=action identifier, V=signature at the first call site seen
    final Map<String, CallSignature> actions = new HashMap<>();

    for (final Map.Entry<String, Map<String, EventMapping>> stateEntry : machine
        .getStatesEventsMapping().entrySet()) {
      final Optional<DataType> inStateData = machine.stateData(stateEntry.getKey());

      for (final EventMapping eventMapping : stateEntry.getValue().values()) {
        final Optional<DataType> eventData = machine.eventData(eventMapping.getEvent());

        for (final Transition transition : eventMapping.getTransitions()) {
          if (!transition.getAction().isPresent()) {
            continue;
          }
          final ActionReference action = transition.getAction().get();
          final CallSignature signature = CallSignature.of(inStateData, eventData,
              machine.stateData(transition.getToState()), action.isAsync());

          final CallSignature known = actions.putIfAbsent(action.getIdentifier(), signature);
          if (known != null && !known.equals(signature)) {
            if (logger.isDebugEnabled()) {
              logger.debug("Action " + action.getIdentifier() + " first seen as " + known
                  + ", now called as " + signature + " on " + transition);
            }
            handler.onViolation(new ValidationException(Code.INCONSISTENT_ACTION_SIGNATURE,
                "Action `" + action.getIdentifier()
                    + "` can only be reused when all input states, events, and output states have the same data",
                ModelValidator.locate(action, transition)));
          }
        }
      }
    }

    if (logger.isDebugEnabled()) {
      logger.debug("Checked call signatures of " + actions.size() + " distinct actions");
    }
  }
}
