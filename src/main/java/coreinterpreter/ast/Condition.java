package coreinterpreter.ast;

import coreinterpreter.util.SourceRange;
import java.util.Objects;

/**
 * Boolean valued conditions. Both operands of {@code &&} and {@code ||} are always enclosed in
 * brackets in the concrete syntax, so there is no precedence between the two.
 */
public abstract class Condition extends Node {

  Condition(SourceRange range) {
    super(range);
  }

  public abstract <T> T acceptVisitor(Visitor<T> visitor);

  /** {@code ( <op> <comp op> <op> )} */
  public static final class Comparison extends Condition {
    public final Expression left;
    public final CompOp op;
    public final Expression right;

    public Comparison(Expression left, CompOp op, Expression right, SourceRange range) {
      super(range);
      this.left = left;
      this.op = op;
      this.right = right;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitComparison(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      Comparison that = (Comparison) o;
      return op == that.op && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, op, right);
    }
  }

  /** {@code ! <cond>} */
  public static final class Negation extends Condition {
    public final Condition condition;

    public Negation(Condition condition, SourceRange range) {
      super(range);
      this.condition = condition;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitNegation(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      return condition.equals(((Negation) o).condition);
    }

    @Override
    public int hashCode() {
      return 31 * condition.hashCode() + 1;
    }
  }

  /** {@code [ <cond> && <cond> ]} */
  public static final class Conjunction extends Condition {
    public final Condition left;
    public final Condition right;

    public Conjunction(Condition left, Condition right, SourceRange range) {
      super(range);
      this.left = left;
      this.right = right;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitConjunction(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      Conjunction that = (Conjunction) o;
      return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, right, "&&");
    }
  }

  /** {@code [ <cond> || <cond> ]} */
  public static final class Disjunction extends Condition {
    public final Condition left;
    public final Condition right;

    public Disjunction(Condition left, Condition right, SourceRange range) {
      super(range);
      this.left = left;
      this.right = right;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitDisjunction(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      Disjunction that = (Disjunction) o;
      return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, right, "||");
    }
  }

  public enum CompOp {
    NEQ("!="),
    EQ("=="),
    LT("<"),
    GT(">"),
    LEQ("<="),
    GEQ(">=");

    public final String string;

    CompOp(String string) {
      this.string = string;
    }
  }

  public interface Visitor<T> {

    T visitComparison(Comparison that);

    T visitNegation(Negation that);

    T visitConjunction(Conjunction that);

    T visitDisjunction(Disjunction that);
  }
}
