package coreinterpreter.ast;

import coreinterpreter.util.SourceRange;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * The statements of Core. The set of statement kinds is closed: only the final classes nested in
 * here extend this class, and every {@link Visitor} has to handle each of them.
 */
public abstract class Statement extends Node {

  Statement(SourceRange range) {
    super(range);
  }

  public abstract <T> T acceptVisitor(Visitor<T> visitor);

  /** {@code <id> = <exp>;} */
  public static final class Assignment extends Statement {
    public final Identifier target;
    public final Expression value;

    public Assignment(Identifier target, Expression value, SourceRange range) {
      super(range);
      this.target = target;
      this.value = value;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitAssignment(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      Assignment that = (Assignment) o;
      return target.equals(that.target) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(target, value);
    }
  }

  /** {@code if <cond> then <stmt seq> [else <stmt seq>] end;} */
  public static final class If extends Statement {
    public final Condition condition;
    public final StatementSequence then;
    public final Optional<StatementSequence> else_;

    public If(
        Condition condition,
        StatementSequence then,
        @Nullable StatementSequence else_,
        SourceRange range) {
      super(range);
      this.condition = condition;
      this.then = then;
      this.else_ = Optional.ofNullable(else_);
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      If that = (If) o;
      return condition.equals(that.condition) && then.equals(that.then) && else_.equals(that.else_);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, then, else_);
    }
  }

  /** {@code while <cond> loop <stmt seq> end;} */
  public static final class While extends Statement {
    public final Condition condition;
    public final StatementSequence body;

    public While(Condition condition, StatementSequence body, SourceRange range) {
      super(range);
      this.condition = condition;
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitWhile(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      While that = (While) o;
      return condition.equals(that.condition) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, body);
    }
  }

  /** {@code read <id list>;} */
  public static final class Read extends Statement {
    public final IdentifierList targets;

    public Read(IdentifierList targets, SourceRange range) {
      super(range);
      this.targets = targets;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitRead(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      return targets.equals(((Read) o).targets);
    }

    @Override
    public int hashCode() {
      return 31 * targets.hashCode() + 1;
    }
  }

  /** {@code write <id list>;} */
  public static final class Write extends Statement {
    public final IdentifierList sources;

    public Write(IdentifierList sources, SourceRange range) {
      super(range);
      this.sources = sources;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitWrite(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      return sources.equals(((Write) o).sources);
    }

    @Override
    public int hashCode() {
      return 31 * sources.hashCode() + 2;
    }
  }

  public interface Visitor<T> {

    T visitAssignment(Assignment that);

    T visitIf(If that);

    T visitWhile(While that);

    T visitRead(Read that);

    T visitWrite(Write that);
  }
}
