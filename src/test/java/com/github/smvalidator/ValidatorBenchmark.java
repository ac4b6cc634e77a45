package com.github.smvalidator;

import static com.github.smvalidator.GuardExpression.and;
import static com.github.smvalidator.GuardExpression.guard;
import static com.github.smvalidator.GuardExpression.not;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

import com.github.smvalidator.ParsedStateMachine.ParsedStateMachineBuilder;
import com.github.smvalidator.StateMachineValidator.StateMachineValidatorBuilder;

@State(Scope.Benchmark)
public class ValidatorBenchmark {
  private static final int stateCount = 200;
  private static final int eventCount = 20;

  private StateMachineValidator validator;
  private ParsedStateMachine machine;

  @Setup
  public void setup() throws ValidationException {
    validator = StateMachineValidatorBuilder.newBuilder().build();

    // every state handles every event with two guarded arms and a catch-all
    final ParsedStateMachineBuilder builder = ParsedStateMachineBuilder.newBuilder();
    for (int event = 0; event < eventCount; event++) {
      builder.eventData("E" + event, "EventData" + event);
    }
    for (int state = 0; state < stateCount; state++) {
      builder.stateData("S" + state, "SharedData");
      final String next = "S" + ((state + 1) % stateCount);
      for (int event = 0; event < eventCount; event++) {
        final String eventName = "E" + event;
        builder
            .transition("S" + state, eventName,
                and(guard("ready_" + event), not(guard("blocked_" + event))),
                ActionReference.of("advance_" + event), next)
            .transition("S" + state, eventName, guard("late_" + event),
                ActionReference.of("advance_" + event), next)
            .transition("S" + state, eventName, next);
      }
    }
    machine = builder.build();
  }

  @Benchmark
  public void validate() throws ValidationException {
    validator.validate(machine);
  }

  @Benchmark
  public ValidationResult collectViolations() throws ValidationException {
    return validator.collectViolations(machine);
  }

  public static void main(String args[]) throws ValidationException {
    ValidatorBenchmark benchmark = new ValidatorBenchmark();
    benchmark.setup();
    benchmark.validate();
  }

}
