package coreinterpreter.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import coreinterpreter.util.SourceRange;
import java.util.List;

/** A non-empty, comma separated list of identifiers. */
public final class IdentifierList extends Node {
  public final List<Identifier> identifiers;

  public IdentifierList(List<Identifier> identifiers, SourceRange range) {
    super(range);
    checkArgument(!identifiers.isEmpty(), "An identifier list must not be empty");
    this.identifiers = ImmutableList.copyOf(identifiers);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return identifiers.equals(((IdentifierList) o).identifiers);
  }

  @Override
  public int hashCode() {
    return identifiers.hashCode();
  }
}
