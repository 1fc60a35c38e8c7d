package coreinterpreter.lexer;

import coreinterpreter.CoreError;
import coreinterpreter.util.SourceRange;
import java.util.List;

/** A character or lexeme that cannot be extended into a valid Core token. */
public class LexerError extends CoreError {

  public final SourceRange range;

  LexerError(SourceRange range, String message) {
    super(String.format("Lexer error at %s: %s", range, message));
    this.range = range;
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.annotateSourceFileExcerpt(sourceFile);
  }
}
