package com.github.smvalidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A basic representation of a callable's call signature at one call site: the input arguments
 * (state data, then event data, each only when present), the result (actions only) and whether
 * the callable is async. Derived on the fly, never stored in the model.
 */
final class CallSignature {
  private final List<DataType> arguments;
  private final Optional<DataType> result;
  private final boolean async;

  private CallSignature(final List<DataType> arguments, final Optional<DataType> result,
      final boolean async) {
    this.arguments = arguments;
    this.result = result;
    this.async = async;
  }

  static CallSignature of(final Optional<DataType> inputData, final Optional<DataType> eventData,
      final Optional<DataType> outputData, final boolean async) {
    final List<DataType> arguments = new ArrayList<>(2);
    inputData.ifPresent(arguments::add);
    eventData.ifPresent(arguments::add);
    return new CallSignature(Collections.unmodifiableList(arguments), outputData, async);
  }

  // guards never have output data
  static CallSignature ofGuard(final Optional<DataType> inputData,
      final Optional<DataType> eventData, final boolean async) {
    return of(inputData, eventData, Optional.empty(), async);
  }

  List<DataType> getArguments() {
    return arguments;
  }

  Optional<DataType> getResult() {
    return result;
  }

  boolean isAsync() {
    return async;
  }

  @Override
  public int hashCode() {
    return Objects.hash(arguments, result, async);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CallSignature)) {
      return false;
    }
    CallSignature other = (CallSignature) obj;
    return async == other.async && arguments.equals(other.arguments)
        && result.equals(other.result);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder(async ? "async (" : "(");
    for (int i = 0; i < arguments.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(arguments.get(i));
    }
    builder.append(")");
    result.ifPresent(type -> builder.append(" -> ").append(type));
    return builder.toString();
  }
}
