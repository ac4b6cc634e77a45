package com.github.smvalidator;

import java.util.Objects;
import java.util.Optional;

/**
 * Points at a spot in the state machine definition. Parsers that don't track spans can simply use
 * {@link #CALL_SITE}.
 */
public final class SourceLocation {
  public static final SourceLocation CALL_SITE = new SourceLocation(null, 0, 0);

  private final String sourceName;
  private final int line;
  private final int column;

  private SourceLocation(final String sourceName, final int line, final int column) {
    this.sourceName = sourceName;
    this.line = line;
    this.column = column;
  }

  public static SourceLocation of(final String sourceName, final int line, final int column) {
    if (line <= 0) {
      return CALL_SITE;
    }
    return new SourceLocation(sourceName, line, Math.max(column, 0));
  }

  public Optional<String> getSourceName() {
    return Optional.ofNullable(sourceName);
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public boolean isCallSite() {
    return line == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(sourceName, line, column);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SourceLocation)) {
      return false;
    }
    SourceLocation other = (SourceLocation) obj;
    return line == other.line && column == other.column
        && Objects.equals(sourceName, other.sourceName);
  }

  @Override
  public String toString() {
    if (isCallSite()) {
      return "<call-site>";
    }
    return (sourceName == null ? "<unknown>" : sourceName) + ":" + line + ":" + column;
  }
}
