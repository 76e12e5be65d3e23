package kala.parser;

import java.util.List;
import kala.KalaError;
import kala.util.SourceRange;

/**
 * A block boundary without partner: a closing brace while no block is open, or a block that is
 * still open when the source ends.
 */
public class StructuralFault extends KalaError {

  public final SourceRange range;

  public StructuralFault(SourceRange range, String message) {
    super(String.format("Structural fault at %s: %s", range, message));
    this.range = range;
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceLines) {
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.annotateSourceFileExcerpt(sourceLines);
  }
}
