package com.github.smvalidator;

import com.github.smvalidator.ValidationException.Code;

/**
 * Boolean combination of guard references. The leaves are the only callables, the combinators are
 * evaluated by the generated dispatcher.
 * 
 * Rendering via {@link #toString()} gives back the expression in the definition syntax, eg.
 * {@code !is_idle && (has_fuel || is_downhill)}.
 */
public abstract class GuardExpression {

  private GuardExpression() {}

  /**
   * Visit every leaf guard, depth-first and left to right. All leaves are visited irrespective of
   * the boolean structure since signatures don't depend on runtime truth values.
   */
  public abstract void visitGuards(final GuardVisitor visitor) throws ValidationException;

  public static GuardExpression guard(final GuardReference guard) throws ValidationException {
    return new Guard(guard);
  }

  public static GuardExpression guard(final String identifier) throws ValidationException {
    return new Guard(GuardReference.of(identifier));
  }

  public static GuardExpression not(final GuardExpression operand) throws ValidationException {
    return new Not(requireOperand(operand));
  }

  public static GuardExpression group(final GuardExpression operand)
      throws ValidationException {
    return new Group(requireOperand(operand));
  }

  public static GuardExpression and(final GuardExpression left, final GuardExpression right)
      throws ValidationException {
    return new And(requireOperand(left), requireOperand(right));
  }

  public static GuardExpression or(final GuardExpression left, final GuardExpression right)
      throws ValidationException {
    return new Or(requireOperand(left), requireOperand(right));
  }

  private static GuardExpression requireOperand(final GuardExpression operand)
      throws ValidationException {
    if (operand == null) {
      throw new ValidationException(Code.INVALID_MODEL, "Guard expression operand cannot be null");
    }
    return operand;
  }

  public static final class Guard extends GuardExpression {
    private final GuardReference guard;

    private Guard(final GuardReference guard) throws ValidationException {
      if (guard == null) {
        throw new ValidationException(Code.INVALID_MODEL, "Guard reference cannot be null");
      }
      this.guard = guard;
    }

    public GuardReference getGuard() {
      return guard;
    }

    @Override
    public void visitGuards(final GuardVisitor visitor) throws ValidationException {
      visitor.visit(guard);
    }

    @Override
    public String toString() {
      return guard.toString();
    }
  }

  public static final class Not extends GuardExpression {
    private final GuardExpression operand;

    private Not(final GuardExpression operand) {
      this.operand = operand;
    }

    public GuardExpression getOperand() {
      return operand;
    }

    @Override
    public void visitGuards(final GuardVisitor visitor) throws ValidationException {
      operand.visitGuards(visitor);
    }

    @Override
    public String toString() {
      return "!" + operand;
    }
  }

  public static final class Group extends GuardExpression {
    private final GuardExpression operand;

    private Group(final GuardExpression operand) {
      this.operand = operand;
    }

    public GuardExpression getOperand() {
      return operand;
    }

    @Override
    public void visitGuards(final GuardVisitor visitor) throws ValidationException {
      operand.visitGuards(visitor);
    }

    @Override
    public String toString() {
      return "(" + operand + ")";
    }
  }

  public static final class And extends GuardExpression {
    private final GuardExpression left;
    private final GuardExpression right;

    private And(final GuardExpression left, final GuardExpression right) {
      this.left = left;
      this.right = right;
    }

    public GuardExpression getLeft() {
      return left;
    }

    public GuardExpression getRight() {
      return right;
    }

    @Override
    public void visitGuards(final GuardVisitor visitor) throws ValidationException {
      left.visitGuards(visitor);
      right.visitGuards(visitor);
    }

    @Override
    public String toString() {
      return left + " && " + right;
    }
  }

  public static final class Or extends GuardExpression {
    private final GuardExpression left;
    private final GuardExpression right;

    private Or(final GuardExpression left, final GuardExpression right) {
      this.left = left;
      this.right = right;
    }

    public GuardExpression getLeft() {
      return left;
    }

    public GuardExpression getRight() {
      return right;
    }

    @Override
    public void visitGuards(final GuardVisitor visitor) throws ValidationException {
      left.visitGuards(visitor);
      right.visitGuards(visitor);
    }

    @Override
    public String toString() {
      return left + " || " + right;
    }
  }
}
