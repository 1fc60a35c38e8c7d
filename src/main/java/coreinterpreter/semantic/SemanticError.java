package coreinterpreter.semantic;

import coreinterpreter.CoreError;
import coreinterpreter.util.SourceRange;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public class SemanticError extends CoreError {
  public final SourceRange range;
  @Nullable public final SourceRange secondRange;

  SemanticError(SourceRange range, String message) {
    this(range, null, message);
  }

  SemanticError(SourceRange range, @Nullable SourceRange secondRange, String message) {
    super(String.format("Semantic error at %s: %s", range, message));
    this.range = range;
    this.secondRange = secondRange;
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceFile) {
    String message =
        getMessage()
            + System.lineSeparator()
            + System.lineSeparator()
            + range.annotateSourceFileExcerpt(sourceFile);
    if (null != secondRange) {
      message += System.lineSeparator() + secondRange.annotateSourceFileExcerpt(sourceFile);
    }

    return message;
  }
}
