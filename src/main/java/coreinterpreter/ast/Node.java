package coreinterpreter.ast;

import coreinterpreter.util.SourceCodeReferable;
import coreinterpreter.util.SourceRange;

/**
 * This abstract class stores information that is common between all non-abstract AST nodes.
 *
 * <p>Equality of nodes is structural: two nodes are equal if they have the same shape and the same
 * names, literals and operators. Source ranges do not take part in equality.
 */
abstract class Node implements SourceCodeReferable {

  private final SourceRange range;

  Node(SourceRange range) {
    this.range = range;
  }

  @Override
  public SourceRange range() {
    return range;
  }
}
