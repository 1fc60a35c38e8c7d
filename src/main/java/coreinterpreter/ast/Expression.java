package coreinterpreter.ast;

import coreinterpreter.util.SourceRange;
import java.util.Objects;

/**
 * Integer valued expressions. Sums and products are left-associative chains of {@link
 * BinaryOperator}s, operands are literals, variables or parenthesized expressions.
 */
public abstract class Expression extends Node {

  Expression(SourceRange range) {
    super(range);
  }

  public abstract <T> T acceptVisitor(Visitor<T> visitor);

  public static final class BinaryOperator extends Expression {
    public final BinOp op;
    public final Expression left;
    public final Expression right;

    public BinaryOperator(BinOp op, Expression left, Expression right, SourceRange range) {
      super(range);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitBinaryOperator(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      BinaryOperator that = (BinaryOperator) o;
      return op == that.op && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }
  }

  /** Keeps the literal as written, so that leading zeros survive pretty-printing. */
  public static final class IntegerLiteral extends Expression {

    public final String literal;

    public IntegerLiteral(String literal, SourceRange range) {
      super(range);
      this.literal = literal;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitIntegerLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      return literal.equals(((IntegerLiteral) o).literal);
    }

    @Override
    public int hashCode() {
      return literal.hashCode();
    }
  }

  /** A reference by name into the variable store. */
  public static final class Variable extends Expression {

    public final String name;

    public Variable(String name, SourceRange range) {
      super(range);
      this.name = name;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      return name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /** {@code ( <exp> )} */
  public static final class Parenthesized extends Expression {

    public final Expression expression;

    public Parenthesized(Expression expression, SourceRange range) {
      super(range);
      this.expression = expression;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitParenthesized(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      return expression.equals(((Parenthesized) o).expression);
    }

    @Override
    public int hashCode() {
      return 31 * expression.hashCode();
    }
  }

  public enum BinOp {
    PLUS("+"),
    MINUS("-"),
    TIMES("*");

    public final String string;

    BinOp(String string) {
      this.string = string;
    }
  }

  public interface Visitor<T> {

    T visitBinaryOperator(BinaryOperator that);

    T visitIntegerLiteral(IntegerLiteral that);

    T visitVariable(Variable that);

    T visitParenthesized(Parenthesized that);
  }
}
