package coreinterpreter.ast;

import coreinterpreter.util.SourceRange;

/** {@code int <id list>;} */
public final class Declaration extends Node {
  public final IdentifierList identifiers;

  public Declaration(IdentifierList identifiers, SourceRange range) {
    super(range);
    this.identifiers = identifiers;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return identifiers.equals(((Declaration) o).identifiers);
  }

  @Override
  public int hashCode() {
    return identifiers.hashCode();
  }
}
