package coreinterpreter.ast;

import coreinterpreter.util.SourceRange;

/**
 * An occurrence of an identifier in a declaration, an assignment target or a {@code read}/{@code
 * write} list. Identifiers refer to variables by name only.
 */
public final class Identifier extends Node {
  public final String name;

  public Identifier(String name, SourceRange range) {
    super(range);
    this.name = name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return name.equals(((Identifier) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
