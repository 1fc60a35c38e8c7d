package coreinterpreter.semantic;

import coreinterpreter.ast.Identifier;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps variable names to their declaring {@link Identifier}. Core programs have a single global
 * scope, so there is no nesting.
 */
class SymbolTable {
  private final Map<String, Identifier> defs = new LinkedHashMap<>();

  /**
   * This method possibly overwrites an earlier definition of {@code name}. If this is forbidden,
   * check with {@link #lookup(String)} first.
   */
  void insert(String name, Identifier def) {
    defs.put(name, def);
  }

  /** The declaration of {@code name}, or {@link Optional#empty()} if it was not declared. */
  Optional<Identifier> lookup(String name) {
    return Optional.ofNullable(defs.get(name));
  }
}
