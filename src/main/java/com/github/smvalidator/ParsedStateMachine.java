package com.github.smvalidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.smvalidator.ValidationException.Code;

/**
 * This object represents the fully parsed, immutable state machine definition that gets validated
 * before any code is generated from it.
 * 
 * Notes:<br>
 * 1. transitions are keyed by source state and then by event, both in declaration order<br>
 * 2. states and events without an entry in their data type table carry no data<br>
 * 3. use the {@code ParsedStateMachineBuilder} to put one together<br>
 */
public final class ParsedStateMachine {
  // K=source state, V=(K=event, V=transitions for that pair)
  private final Map<String, Map<String, EventMapping>> statesEventsMapping;
  private final Map<String, DataType> stateDataTypes;
  private final Map<String, DataType> eventDataTypes;
  private final Optional<String> startingState;

  private ParsedStateMachine(final Map<String, Map<String, EventMapping>> statesEventsMapping,
      final Map<String, DataType> stateDataTypes, final Map<String, DataType> eventDataTypes,
      final Optional<String> startingState) {
    this.statesEventsMapping = statesEventsMapping;
    this.stateDataTypes = stateDataTypes;
    this.eventDataTypes = eventDataTypes;
    this.startingState = startingState;
  }

  public Map<String, Map<String, EventMapping>> getStatesEventsMapping() {
    return statesEventsMapping;
  }

  public Map<String, DataType> getStateDataTypes() {
    return stateDataTypes;
  }

  public Map<String, DataType> getEventDataTypes() {
    return eventDataTypes;
  }

  public Optional<DataType> stateData(final String state) {
    return Optional.ofNullable(stateDataTypes.get(state));
  }

  public Optional<DataType> eventData(final String event) {
    return Optional.ofNullable(eventDataTypes.get(event));
  }

  public Optional<String> getStartingState() {
    return startingState;
  }

  public int transitionCount() {
    int count = 0;
    for (final Map<String, EventMapping> eventMappings : statesEventsMapping.values()) {
      for (final EventMapping eventMapping : eventMappings.values()) {
        count += eventMapping.getTransitions().size();
      }
    }
    return count;
  }

  @Override
  public String toString() {
    return "ParsedStateMachine [startingState=" + startingState.orElse("none") + ", states="
        + statesEventsMapping.keySet() + ", transitions=" + transitionCount()
        + ", stateDataTypes=" + stateDataTypes + ", eventDataTypes=" + eventDataTypes + "]";
  }

  /**
   * A simple builder to let parsers and tests use fluent APIs to assemble the model. Transitions
   * keep the order in which they were added.
   */
  public final static class ParsedStateMachineBuilder {
    private final Map<String, Map<String, List<Transition>>> transitions = new LinkedHashMap<>();
    private final Map<String, DataType> stateDataTypes = new LinkedHashMap<>();
    private final Map<String, DataType> eventDataTypes = new LinkedHashMap<>();
    private String startingState;

    public static ParsedStateMachineBuilder newBuilder() {
      return new ParsedStateMachineBuilder();
    }

    public ParsedStateMachineBuilder startingState(final String startingState)
        throws ValidationException {
      this.startingState = Transition.requireName(startingState, "Starting state");
      return this;
    }

    public ParsedStateMachineBuilder stateData(final String state, final String dataType)
        throws ValidationException {
      stateDataTypes.put(Transition.requireName(state, "State"), DataType.of(dataType));
      return this;
    }

    public ParsedStateMachineBuilder eventData(final String event, final String dataType)
        throws ValidationException {
      eventDataTypes.put(Transition.requireName(event, "Event"), DataType.of(dataType));
      return this;
    }

    public ParsedStateMachineBuilder transition(final Transition transition)
        throws ValidationException {
      if (transition == null) {
        throw new ValidationException(Code.INVALID_MODEL, "Transition cannot be null");
      }
      transitions.computeIfAbsent(transition.getFromState(), state -> new LinkedHashMap<>())
          .computeIfAbsent(transition.getEvent(), event -> new ArrayList<>()).add(transition);
      return this;
    }

    public ParsedStateMachineBuilder transition(final String fromState, final String event,
        final String toState) throws ValidationException {
      return transition(new Transition(fromState, event, toState, null, null, null));
    }

    public ParsedStateMachineBuilder transition(final String fromState, final String event,
        final GuardExpression guard, final ActionReference action, final String toState)
        throws ValidationException {
      return transition(new Transition(fromState, event, toState, guard, action, null));
    }

    public ParsedStateMachine build() {
      final Map<String, Map<String, EventMapping>> mapping = new LinkedHashMap<>();
      for (final Map.Entry<String, Map<String, List<Transition>>> stateEntry : transitions
          .entrySet()) {
        final Map<String, EventMapping> eventMappings = new LinkedHashMap<>();
        for (final Map.Entry<String, List<Transition>> eventEntry : stateEntry.getValue()
            .entrySet()) {
          eventMappings.put(eventEntry.getKey(),
              new EventMapping(stateEntry.getKey(), eventEntry.getKey(), eventEntry.getValue()));
        }
        mapping.put(stateEntry.getKey(), Collections.unmodifiableMap(eventMappings));
      }
      return new ParsedStateMachine(Collections.unmodifiableMap(mapping),
          Collections.unmodifiableMap(new LinkedHashMap<>(stateDataTypes)),
          Collections.unmodifiableMap(new LinkedHashMap<>(eventDataTypes)),
          Optional.ofNullable(startingState));
    }

    private ParsedStateMachineBuilder() {}
  }
}
