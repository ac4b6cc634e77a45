package com.github.smvalidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All transitions declared for one (state, event) pair, in declaration order. That order is the
 * dispatch order: the generated machine takes the first transition whose guard holds.
 */
public final class EventMapping {
  private final String inState;
  private final String event;
  private final List<Transition> transitions;

  EventMapping(final String inState, final String event, final List<Transition> transitions) {
    this.inState = inState;
    this.event = event;
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
  }

  public String getInState() {
    return inState;
  }

  public String getEvent() {
    return event;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  @Override
  public String toString() {
    return "EventMapping [inState=" + inState + ", event=" + event + ", transitions="
        + transitions + "]";
  }
}
