package coreinterpreter.interpreter;

import coreinterpreter.CoreError;
import coreinterpreter.util.SourceRange;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Aborts the execution of a program. Errors raised while evaluating a statement carry its source
 * range, errors in the input data do not.
 */
public class RuntimeError extends CoreError {
  @Nullable public final SourceRange range;

  RuntimeError(String message) {
    super("Runtime error: " + message);
    this.range = null;
  }

  RuntimeError(SourceRange range, String message) {
    super(String.format("Runtime error at %s: %s", range, message));
    this.range = range;
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceFile) {
    if (range == null) {
      return getMessage();
    }
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.annotateSourceFileExcerpt(sourceFile);
  }
}
