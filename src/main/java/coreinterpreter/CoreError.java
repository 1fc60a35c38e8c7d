package coreinterpreter;

import java.util.List;

/** Basic error class in this project. */
public class CoreError extends RuntimeException {

  public CoreError(Exception wrapped) {
    super(wrapped);
  }

  public CoreError(String message) {
    super(message);
  }

  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage();
  }
}
