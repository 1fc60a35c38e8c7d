package coreinterpreter.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import coreinterpreter.util.SourceRange;
import java.util.List;

/** A non-empty sequence of statements, executed in order. */
public final class StatementSequence extends Node {
  public final List<Statement> statements;

  public StatementSequence(List<Statement> statements, SourceRange range) {
    super(range);
    checkArgument(!statements.isEmpty(), "A statement sequence must not be empty");
    this.statements = ImmutableList.copyOf(statements);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return statements.equals(((StatementSequence) o).statements);
  }

  @Override
  public int hashCode() {
    return statements.hashCode();
  }
}
