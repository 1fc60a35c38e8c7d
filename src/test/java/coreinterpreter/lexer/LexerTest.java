package coreinterpreter.lexer;

import static coreinterpreter.token.Terminal.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultimap;
import coreinterpreter.CoreError;
import coreinterpreter.token.Terminal;
import coreinterpreter.token.Token;
import coreinterpreter.util.SourcePosition;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.Assert;
import org.junit.Test;

/** Lexer test cases */
public class LexerTest {

  private static List<Terminal> terminals(String input) {
    List<Terminal> actual =
        ImmutableList.copyOf(new Lexer(input))
            .stream()
            .map(t -> t.terminal)
            .collect(Collectors.toList());
    actual.remove(EOF);
    return actual;
  }

  @Test
  public void lexInvalidInput_throwsException() {
    String[] inputs = {
      "ä", "&", "|", "a & b", "X | Y", "#", "/", "readA", "12AB", "Abc", "if2", "x", "_X", "{"
    };
    for (String input : inputs) {
      try {
        Lexer l = new Lexer(input);
        while (l.hasNext()) {
          l.next();
        }
      } catch (CoreError e) {
        continue;
      }
      Assert.fail(String.format("Didn't fail with input '%s'", input));
    }
  }

  @Test
  public void lexValidInput_expectedTokensEmitted() throws Exception {
    ImmutableMultimap<String, Terminal> inputAndOutput =
        new ImmutableMultimap.Builder<String, Terminal>()
            .put("!", NOT)
            .put("program", PROGRAM)
            .put("!=", NEQ)
            .put("<=", LEQ)
            .put(">=", GEQ)
            .put("==", EQL)
            .put("&&", AND)
            .put("||", OR)
            .put("IF2", IDENT)
            .put("X1Y2", IDENT)
            .put("007", INTEGER_LITERAL)
            .putAll("read A", READ, IDENT)
            .putAll("A+B", IDENT, ADD, IDENT)
            .putAll("A + B", IDENT, ADD, IDENT)
            .putAll("<==", LEQ, ASSIGN)
            .putAll("===", EQL, ASSIGN)
            .putAll("!!=", NOT, NEQ)
            .putAll("[(X<5)&&!(Y>=0)]", LBRACK, LPAREN, IDENT, LSS, INTEGER_LITERAL, RPAREN)
            .putAll("[(X<5)&&!(Y>=0)]", AND, NOT, LPAREN, IDENT, GEQ, INTEGER_LITERAL, RPAREN)
            .putAll("[(X<5)&&!(Y>=0)]", RBRACK)
            .putAll("X=X*2-1;", IDENT, ASSIGN, IDENT, MUL, INTEGER_LITERAL, SUB)
            .putAll("X=X*2-1;", INTEGER_LITERAL, SEMICOLON)
            .putAll("int X,Y;", INT, IDENT, COMMA, IDENT, SEMICOLON)
            .putAll("\tbegin\r\nend\n", BEGIN, END)
            .build();

    for (Map.Entry<String, Collection<Terminal>> e : inputAndOutput.asMap().entrySet()) {
      Assert.assertEquals(e.getKey(), ImmutableList.copyOf(e.getValue()), terminals(e.getKey()));
    }
  }

  @Test
  public void lexAllReservedWords_eachIsRecognized() {
    List<Terminal> actual =
        terminals("program begin end int if then else while loop read write");
    assertThat(
        actual, contains(PROGRAM, BEGIN, END, INT, IF, THEN, ELSE, WHILE, LOOP, READ, WRITE));
  }

  @Test
  public void lexReservedWordAndIdentifier_readAAndReadSpaceADiffer() {
    assertThat(terminals("read A"), contains(READ, IDENT));
    try {
      terminals("readA");
      Assert.fail("readA must not be lexed as read followed by A");
    } catch (LexerError e) {
      assertThat(e.getMessage(), containsString("readA"));
    }
  }

  @Test
  public void lexIdentifierAndLiteral_lexvalsAreKept() {
    Lexer lexer = new Lexer("X12 = 0042;");
    Token identifier = lexer.next();
    lexer.next();
    Token literal = lexer.next();
    assertThat(identifier.lexval, is("X12"));
    assertThat(literal.lexval, is("0042"));
  }

  @Test
  public void lexMultipleLines_sourcePositionsPointToTokens() {
    Lexer lexer = new Lexer("program\n  int X;");
    Token program = lexer.next();
    Token int_ = lexer.next();
    Token x = lexer.next();
    assertThat(program.range.begin, is(new SourcePosition(0, 1, 0)));
    assertThat(int_.range.begin, is(new SourcePosition(1, 2, 2)));
    assertThat(int_.range.end, is(new SourcePosition(1, 2, 5)));
    assertThat(x.range.begin, is(new SourcePosition(2, 2, 6)));
  }

  @Test
  public void lexAfterEof_eofIsRepeated() {
    Lexer lexer = new Lexer("end");
    assertThat(lexer.next().terminal, is(END));
    assertThat(lexer.next().terminal, is(EOF));
    assertThat(lexer.hasNext(), is(false));
    assertThat(lexer.next().terminal, is(EOF));
  }

  @Test
  public void rewind_tokensAreProducedAgain() {
    Lexer lexer = new Lexer("write X;");
    List<Token> first = ImmutableList.copyOf(lexer);
    lexer.rewind();
    List<Token> second = ImmutableList.copyOf(lexer);
    assertThat(
        second.stream().map(Token::toString).collect(Collectors.toList()),
        is(equalTo(first.stream().map(Token::toString).collect(Collectors.toList()))));
    assertThat(second, hasSize(4));
  }

  @Test
  public void modifyInputAfterConstruction_rewindScansOriginalInput() {
    byte[] input = "read X;".getBytes(StandardCharsets.US_ASCII);
    Lexer lexer = new Lexer(input);
    input[0] = 'w';
    input[1] = 'r';
    input[2] = 'i';
    input[3] = 't';
    lexer.rewind();
    assertThat(lexer.next().terminal, is(READ));
  }

  @Test
  public void lexFromInputStream_sameAsFromString() {
    String source = "while [(X < 5) || (Y > 0)] loop";
    Lexer fromStream =
        new Lexer(new ByteArrayInputStream(source.getBytes(StandardCharsets.UTF_8)));
    List<Terminal> actual =
        ImmutableList.copyOf(fromStream)
            .stream()
            .map(t -> t.terminal)
            .collect(Collectors.toList());
    actual.remove(EOF);
    assertThat(actual, is(equalTo(terminals(source))));
  }

  @Test
  public void lexLoneAmpersand_errorPointsToIt() {
    try {
      terminals("[(X < 1) & (Y < 2)]");
      Assert.fail();
    } catch (LexerError e) {
      assertThat(e.range.begin, is(new SourcePosition(0, 1, 9)));
      assertThat(e.getMessage(), containsString("'&&'"));
    }
  }
}
