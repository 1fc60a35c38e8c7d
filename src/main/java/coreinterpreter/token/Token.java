package coreinterpreter.token;

import coreinterpreter.util.SourceCodeReferable;
import coreinterpreter.util.SourceRange;
import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

/** Instances of this class are immutable. */
public class Token implements SourceCodeReferable {

  public final Terminal terminal;
  public final SourceRange range;
  /** The lexeme of identifiers and integer literals, null for all other terminals. */
  @Nullable public final String lexval;

  public Token(Terminal terminal, SourceRange range, @Nullable String lexval) {
    this.terminal = terminal;
    this.range = range;
    this.lexval = lexval == null ? null : lexval.intern();
  }

  @Override
  public SourceRange range() {
    return range;
  }

  /** The text this token was lexed from, empty for EOF. */
  public String text() {
    if (lexval != null) {
      return lexval;
    }
    return terminal.string == null ? "" : terminal.string;
  }

  public boolean isOneOf(Terminal... terminals) {
    return Arrays.stream(terminals).anyMatch(t -> terminal == t);
  }

  /** Describes this token for diagnostics, e.g. {@code identifier 'X'}. */
  public String describe() {
    if (terminal == Terminal.EOF) {
      return terminal.kind.description;
    }
    return terminal.kind.description + " '" + text() + "'";
  }

  @Override
  public String toString() {
    switch (terminal) {
      case IDENT:
        return "identifier " + lexval;
      case INTEGER_LITERAL:
        return "integer literal " + lexval;
      case EOF:
        return "EOF";
      default:
        return terminal.string;
    }
  }
}
