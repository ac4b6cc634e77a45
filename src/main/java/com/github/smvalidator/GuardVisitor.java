package com.github.smvalidator;

/**
 * Callback handed every leaf of a {@link GuardExpression}. Throwing stops the traversal and the
 * exception reaches the caller of {@link GuardExpression#visitGuards(GuardVisitor)} unchanged.
 */
@FunctionalInterface
public interface GuardVisitor {
  void visit(final GuardReference guard) throws ValidationException;
}
