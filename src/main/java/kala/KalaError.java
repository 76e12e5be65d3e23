package kala;

import java.util.List;

/** Basic error class in this project. */
public class KalaError extends RuntimeException {

  public KalaError(String message) {
    super(message);
  }

  public String getSourceReferencingMessage(List<String> sourceLines) {
    return getMessage();
  }
}
