package coreinterpreter.lexer;

import static coreinterpreter.token.Terminal.*;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.ByteStreams;
import coreinterpreter.CoreError;
import coreinterpreter.token.Terminal;
import coreinterpreter.token.Token;
import coreinterpreter.util.SourcePosition;
import coreinterpreter.util.SourceRange;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Iterator;

/**
 * Deterministic scanner for Core source text.
 *
 * <p>The whole source is held in memory, tokens are produced lazily on {@link #next()}. Any maximal
 * run of letters and digits is a single lexeme which must be an integer literal, a reserved word or
 * an identifier, so two such tokens need whitespace in between. Special symbols are munched
 * greedily and may abut anything.
 *
 * <p>After the last token, {@link #next()} keeps returning the same EOF token. {@link #rewind()}
 * restarts the scan at the beginning of the source.
 */
public class Lexer implements Iterator<Token> {

  static final ImmutableMap<String, Terminal> RESERVED_WORDS =
      Maps.uniqueIndex(
          EnumSet.of(PROGRAM, BEGIN, END, INT, IF, THEN, ELSE, WHILE, LOOP, READ, WRITE),
          t -> t.string);

  private final byte[] input;
  private int offset;
  private int ch;
  private int line;
  private int column;
  private Token eof;
  private SourcePosition tokenBegin;
  private int currentTokenNumber;

  public Lexer(InputStream input) {
    this(readFully(input));
  }

  public Lexer(byte[] input) {
    this.input = input.clone();
    rewind();
  }

  public Lexer(String input) {
    this(input.getBytes(StandardCharsets.UTF_8));
  }

  private static byte[] readFully(InputStream input) {
    try {
      return ByteStreams.toByteArray(input);
    } catch (IOException e) {
      throw new CoreError(e);
    }
  }

  /** Resets the lexer to the start of the source. Tokens are produced again from the first one. */
  public void rewind() {
    offset = 0;
    line = 1;
    column = -1; // after calling nextChar the first time, this will be 0
    eof = null;
    currentTokenNumber = 0;
    nextChar();
  }

  private void nextChar() {
    ch = offset < input.length ? input[offset++] & 0xFF : -1;
    if (ch == '\n') {
      column = -1;
      line++;
    } else {
      column++;
    }
    if (ch > 127) {
      throw new LexerError(
          new SourceRange(new SourcePosition(currentTokenNumber, line, column), 1),
          String.format("Unsupported character with code %d", ch));
    }
  }

  private Token scan() {
    skipWhitespace();
    tokenBegin = new SourcePosition(currentTokenNumber, line, column);
    if (isAlphanumeric(ch)) {
      return scanWord();
    }
    switch (ch) {
      case -1:
        return (eof = createToken(EOF));
      case ';':
        nextChar();
        return createToken(SEMICOLON);
      case ',':
        nextChar();
        return createToken(COMMA);
      case '[':
        nextChar();
        return createToken(LBRACK);
      case ']':
        nextChar();
        return createToken(RBRACK);
      case '(':
        nextChar();
        return createToken(LPAREN);
      case ')':
        nextChar();
        return createToken(RPAREN);
      case '+':
        nextChar();
        return createToken(ADD);
      case '-':
        nextChar();
        return createToken(SUB);
      case '*':
        nextChar();
        return createToken(MUL);
      case '=':
        nextChar();
        return scanEqual();
      case '!':
        nextChar();
        return scanInvert();
      case '<':
        nextChar();
        return scanLower();
      case '>':
        nextChar();
        return scanGreater();
      case '&':
        nextChar();
        return scanDoubled('&', AND);
      case '|':
        nextChar();
        return scanDoubled('|', OR);
    }
    throw new LexerError(
        new SourceRange(tokenBegin, 1),
        String.format("tokens must not start with character '%c' (%d)", ch, ch));
  }

  private void skipWhitespace() {
    while (ch == ' ' || ch == '\n' || ch == '\r' || ch == '\t') {
      nextChar();
    }
  }

  private static boolean isDigit(int ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isUpper(int ch) {
    return ch >= 'A' && ch <= 'Z';
  }

  private static boolean isAlphanumeric(int ch) {
    return isDigit(ch) || isUpper(ch) || (ch >= 'a' && ch <= 'z');
  }

  private Token scanEqual() {
    if (ch == '=') {
      nextChar();
      return createToken(EQL);
    }
    return createToken(ASSIGN);
  }

  private Token scanInvert() {
    if (ch == '=') {
      nextChar();
      return createToken(NEQ);
    }
    return createToken(NOT);
  }

  private Token scanLower() {
    if (ch == '=') {
      nextChar();
      return createToken(LEQ);
    }
    return createToken(LSS);
  }

  private Token scanGreater() {
    if (ch == '=') {
      nextChar();
      return createToken(GEQ);
    }
    return createToken(GTR);
  }

  /** {@code &&} and {@code ||} have no single character counterpart in Core. */
  private Token scanDoubled(char symbol, Terminal terminal) {
    if (ch != symbol) {
      throw new LexerError(
          new SourceRange(tokenBegin, 1),
          String.format("expected '%1$c%1$c', but '%1$c' is not followed by '%1$c'", symbol));
    }
    nextChar();
    return createToken(terminal);
  }

  /** Consumes a maximal run of letters and digits and classifies it as a whole. */
  private Token scanWord() {
    StringBuilder builder = new StringBuilder();
    while (isAlphanumeric(ch)) {
      builder.appendCodePoint(ch);
      nextChar();
    }
    String word = builder.toString();
    Terminal reserved = RESERVED_WORDS.get(word);
    if (reserved != null) {
      return createToken(reserved);
    }
    if (word.chars().allMatch(Lexer::isDigit)) {
      return createToken(INTEGER_LITERAL, word);
    }
    if (isUpper(word.charAt(0)) && word.chars().allMatch(c -> isUpper(c) || isDigit(c))) {
      return createToken(IDENT, word);
    }
    throw new LexerError(
        new SourceRange(tokenBegin, word.length()),
        String.format(
            "'%s' is neither a reserved word, an identifier nor an integer literal"
                + " (separate adjacent words with whitespace)",
            word));
  }

  private Token createToken(Terminal terminal, String content) {
    SourceRange range = new SourceRange(tokenBegin, content.length());
    currentTokenNumber++;
    return new Token(terminal, range, content);
  }

  private Token createToken(Terminal terminal) {
    // terminal.string == null can only happen if terminal == EOF
    int length = terminal.string == null ? 1 : terminal.string.length();
    SourceRange range = new SourceRange(tokenBegin, length);
    currentTokenNumber++;
    return new Token(terminal, range, null);
  }

  @Override
  public boolean hasNext() {
    return eof == null;
  }

  @Override
  public Token next() {
    if (eof != null) {
      return eof;
    }
    return scan();
  }
}
