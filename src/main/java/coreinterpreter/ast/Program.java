package coreinterpreter.ast;

import com.google.common.collect.ImmutableList;
import coreinterpreter.util.SourceRange;
import java.util.List;
import java.util.Objects;

/** The root of the AST: {@code program <decl seq> begin <stmt seq> end}. */
public final class Program extends Node {
  public final List<Declaration> declarations;
  public final StatementSequence body;

  public Program(List<Declaration> declarations, StatementSequence body, SourceRange range) {
    super(range);
    this.declarations = ImmutableList.copyOf(declarations);
    this.body = body;
  }

  public <T> T acceptVisitor(Visitor<T> visitor) {
    return visitor.visitProgram(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Program that = (Program) o;
    return declarations.equals(that.declarations) && body.equals(that.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(declarations, body);
  }

  public interface Visitor<T> {

    T visitProgram(Program that);
  }
}
