package coreinterpreter.token;

import org.jetbrains.annotations.Nullable;

/** Enum of terminals used by the Lexer. */
public enum Terminal {

  // reserved words
  PROGRAM("program", Kind.RESERVED_WORD),
  BEGIN("begin", Kind.RESERVED_WORD),
  END("end", Kind.RESERVED_WORD),
  INT("int", Kind.RESERVED_WORD),
  IF("if", Kind.RESERVED_WORD),
  THEN("then", Kind.RESERVED_WORD),
  ELSE("else", Kind.RESERVED_WORD),
  WHILE("while", Kind.RESERVED_WORD),
  LOOP("loop", Kind.RESERVED_WORD),
  READ("read", Kind.RESERVED_WORD),
  WRITE("write", Kind.RESERVED_WORD),

  // special symbols
  SEMICOLON(";", Kind.SYMBOL),
  COMMA(",", Kind.SYMBOL),
  ASSIGN("=", Kind.SYMBOL),
  NOT("!", Kind.SYMBOL),
  LBRACK("[", Kind.SYMBOL),
  RBRACK("]", Kind.SYMBOL),
  AND("&&", Kind.SYMBOL),
  OR("||", Kind.SYMBOL),
  LPAREN("(", Kind.SYMBOL),
  RPAREN(")", Kind.SYMBOL),
  ADD("+", Kind.SYMBOL),
  SUB("-", Kind.SYMBOL),
  MUL("*", Kind.SYMBOL),
  NEQ("!=", Kind.SYMBOL),
  EQL("==", Kind.SYMBOL),
  LSS("<", Kind.SYMBOL),
  GTR(">", Kind.SYMBOL),
  LEQ("<=", Kind.SYMBOL),
  GEQ(">=", Kind.SYMBOL),

  // with dynamic string values (lexval in Token is not null for tokens of this types)
  IDENT(null, Kind.IDENTIFIER),
  INTEGER_LITERAL(null, Kind.INTEGER_LITERAL),

  EOF(null, Kind.END_OF_INPUT);

  /** The lexical class of a terminal. */
  public enum Kind {
    RESERVED_WORD("reserved word"),
    SYMBOL("special symbol"),
    IDENTIFIER("identifier"),
    INTEGER_LITERAL("integer"),
    END_OF_INPUT("end of input");

    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }

  /** The fixed spelling of this terminal, null for terminals with a dynamic lexval and EOF. */
  @Nullable public final String string;

  public final Kind kind;

  Terminal(@Nullable String string, Kind kind) {
    this.string = string;
    this.kind = kind;
  }

  public boolean hasLexval() {
    return kind == Kind.IDENTIFIER || kind == Kind.INTEGER_LITERAL;
  }

  /** Human readable form for diagnostics, e.g. {@code ';'} or {@code identifier}. */
  public String describe() {
    return string != null ? "'" + string + "'" : kind.description;
  }
}
