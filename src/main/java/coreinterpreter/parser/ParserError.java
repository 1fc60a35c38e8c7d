package coreinterpreter.parser;

import coreinterpreter.CoreError;
import coreinterpreter.token.Terminal;
import coreinterpreter.token.Token;
import coreinterpreter.util.SourceRange;
import java.util.List;
import org.jooq.lambda.Seq;

/** The token stream does not match any production of the Core grammar at the current position. */
public class ParserError extends CoreError {

  public final SourceRange range;

  ParserError(String rule, Terminal expectedTerminal, Token actualToken) {
    super(
        String.format(
            "Parser error at %s parsed via %s: expected %s but got %s",
            actualToken.range(), rule, expectedTerminal.describe(), actualToken.describe()));
    this.range = actualToken.range();
  }

  ParserError(String rule, Token unexpectedToken, Terminal[] expectedTerminals) {
    super(
        String.format(
            "Parser error at %s parsed via %s: unexpected %s, expected one of %s",
            unexpectedToken.range(),
            rule,
            unexpectedToken.describe(),
            Seq.of(expectedTerminals).map(Terminal::describe).toString(", ")));
    this.range = unexpectedToken.range();
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.annotateSourceFileExcerpt(sourceFile);
  }
}
