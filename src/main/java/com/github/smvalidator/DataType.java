package com.github.smvalidator;

import java.util.regex.Pattern;

/**
 * This object represents the data type carried by a state or an event, as written in the state
 * machine definition. Types are compared by shape only: two references are equal iff their text is
 * equal once whitespace is dropped. No attempt is made to resolve or type check them.
 */
public final class DataType {
  private static final Pattern whitespace = Pattern.compile("\\s+");

  private final String name;

  private DataType(final String name) {
    this.name = name;
  }

  public static DataType of(final String typeName) throws ValidationException {
    if (typeName == null) {
      throw new ValidationException(ValidationException.Code.INVALID_MODEL,
          "Data type cannot be null");
    }
    final String normalized = whitespace.matcher(typeName).replaceAll("");
    if (normalized.isEmpty()) {
      throw new ValidationException(ValidationException.Code.INVALID_MODEL,
          "Data type cannot be blank");
    }
    return new DataType(normalized);
  }

  public String getName() {
    return name;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return name.equals(((DataType) obj).name);
  }

  @Override
  public String toString() {
    return name;
  }
}
