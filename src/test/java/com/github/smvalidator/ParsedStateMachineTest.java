package com.github.smvalidator;

import static com.github.smvalidator.GuardExpression.and;
import static com.github.smvalidator.GuardExpression.group;
import static com.github.smvalidator.GuardExpression.guard;
import static com.github.smvalidator.GuardExpression.not;
import static com.github.smvalidator.GuardExpression.or;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.github.smvalidator.ParsedStateMachine.ParsedStateMachineBuilder;
import com.github.smvalidator.ValidationException.Code;

/**
 * Tests for the model handed to the validator.
 */
public class ParsedStateMachineTest {

  @Test
  public void testTransitionsKeepDeclarationOrder() throws ValidationException {
    final ParsedStateMachine machine = ParsedStateMachineBuilder.newBuilder().startingState("A")
        .transition("A", "Tick", guard("first"), null, "B").transition("B", "Tock", "A")
        .transition("A", "Tick", guard("second"), null, "C").transition("A", "Tick", "D").build();

    assertEquals(Optional.of("A"), machine.getStartingState());
    assertEquals(Arrays.asList("A", "B"),
        new ArrayList<>(machine.getStatesEventsMapping().keySet()));
    final EventMapping tick = machine.getStatesEventsMapping().get("A").get("Tick");
    assertEquals("A", tick.getInState());
    assertEquals("Tick", tick.getEvent());
    assertEquals(3, tick.getTransitions().size());
    assertEquals("B", tick.getTransitions().get(0).getToState());
    assertEquals("C", tick.getTransitions().get(1).getToState());
    assertEquals("D", tick.getTransitions().get(2).getToState());
    assertFalse(tick.getTransitions().get(2).getGuard().isPresent());
    assertEquals(4, machine.transitionCount());
  }

  @Test
  public void testModelIsUnmodifiable() throws ValidationException {
    final ParsedStateMachine machine = ParsedStateMachineBuilder.newBuilder()
        .stateData("A", "AData").transition("A", "Tick", "B").build();
    try {
      machine.getStateDataTypes().clear();
      fail("state data types must be read-only");
    } catch (UnsupportedOperationException expected) {
    }
    try {
      machine.getStatesEventsMapping().get("A").get("Tick").getTransitions().clear();
      fail("transitions must be read-only");
    } catch (UnsupportedOperationException expected) {
    }
  }

  @Test
  public void testDataLookup() throws ValidationException {
    final ParsedStateMachine machine = ParsedStateMachineBuilder.newBuilder()
        .stateData("A", "AData").eventData("Tick", "u32").transition("A", "Tick", "B").build();
    assertEquals(Optional.of(DataType.of("AData")), machine.stateData("A"));
    assertFalse(machine.stateData("B").isPresent());
    assertEquals(Optional.of(DataType.of("u32")), machine.eventData("Tick"));
    assertFalse(machine.eventData("Tock").isPresent());
  }

  @Test
  public void testBlankNamesAreRejected() {
    try {
      ParsedStateMachineBuilder.newBuilder().transition(" ", "Tick", "B");
      fail("blank source state");
    } catch (ValidationException problem) {
      assertEquals(Code.INVALID_MODEL, problem.getCode());
    }
    try {
      ParsedStateMachineBuilder.newBuilder().stateData("A", "  ");
      fail("blank data type");
    } catch (ValidationException problem) {
      assertEquals(Code.INVALID_MODEL, problem.getCode());
    }
    try {
      ActionReference.of(null);
      fail("null action");
    } catch (ValidationException problem) {
      assertEquals(Code.INVALID_MODEL, problem.getCode());
    }
    try {
      and(guard("a"), null);
      fail("null operand");
    } catch (ValidationException problem) {
      assertEquals(Code.INVALID_MODEL, problem.getCode());
    }
  }

  @Test
  public void testDataTypeShapeEquality() throws ValidationException {
    assertEquals(DataType.of("Vec< u8 >"), DataType.of("Vec<u8>"));
    assertEquals("Map<K,V>", DataType.of(" Map<K, V> ").getName());
    assertNotEquals(DataType.of("Vec<u8>"), DataType.of("Vec<u16>"));
  }

  @Test
  public void testGuardExpressionRendering() throws ValidationException {
    final GuardExpression expression = and(not(guard("is_idle")),
        group(or(guard("has_fuel"), guard(GuardReference.async("is_downhill")))));
    assertEquals("!is_idle && (has_fuel || is_downhill.await)", expression.toString());
  }

  @Test
  public void testGuardVisitOrder() throws ValidationException {
    final GuardExpression expression =
        or(and(guard("a"), not(guard("b"))), group(and(guard("c"), or(guard("d"), guard("a")))));
    final List<String> visited = new ArrayList<>();
    expression.visitGuards(guard -> visited.add(guard.getIdentifier()));
    assertEquals(Arrays.asList("a", "b", "c", "d", "a"), visited);
  }

  @Test
  public void testGuardVisitStopsAtFirstFailure() throws ValidationException {
    final GuardExpression expression = and(guard("a"), or(guard("stop"), guard("c")));
    final List<String> visited = new ArrayList<>();
    try {
      expression.visitGuards(guard -> {
        visited.add(guard.getIdentifier());
        if (guard.getIdentifier().equals("stop")) {
          throw new ValidationException(Code.INCONSISTENT_GUARD_SIGNATURE, "stop");
        }
      });
      fail("visitor failure must propagate");
    } catch (ValidationException problem) {
      assertEquals("stop", problem.getMessage());
    }
    assertEquals(Arrays.asList("a", "stop"), visited);
  }

  @Test
  public void testCallSignature() throws ValidationException {
    final Optional<DataType> idle = Optional.of(DataType.of("IdleData"));
    final Optional<DataType> start = Optional.of(DataType.of("StartEvent"));
    final CallSignature action = CallSignature.of(idle, start, Optional.empty(), false);
    final CallSignature guard = CallSignature.ofGuard(idle, start, false);
    assertEquals(action, guard);
    assertEquals("(IdleData, StartEvent)", guard.toString());

    // event only, no state data
    final CallSignature eventOnly = CallSignature.of(Optional.empty(), start,
        Optional.of(DataType.of("RunData")), true);
    assertEquals(Arrays.asList(DataType.of("StartEvent")), eventOnly.getArguments());
    assertTrue(eventOnly.isAsync());
    assertEquals("async (StartEvent) -> RunData", eventOnly.toString());
    assertNotEquals(eventOnly, CallSignature.of(Optional.empty(), start,
        Optional.of(DataType.of("RunData")), false));
  }

  @Test
  public void testSourceLocation() {
    assertTrue(SourceLocation.of("machine.sm", 0, 3).isCallSite());
    final SourceLocation location = SourceLocation.of("machine.sm", 4, 2);
    assertFalse(location.isCallSite());
    assertEquals("machine.sm:4:2", location.toString());
    assertEquals("<call-site>", SourceLocation.CALL_SITE.toString());
  }
}
