package kala.parser;

import java.util.List;
import kala.KalaError;
import kala.util.SourceRange;

/** A malformed statement. Recoverable: the statement is dropped and translation goes on. */
public class ParserError extends KalaError {

  public final SourceRange range;
  public final String rule;
  public final String reason;

  public ParserError(SourceRange range, String rule, String reason) {
    super(String.format("Parser error at %s parsed via %s: %s", range, rule, reason));
    this.range = range;
    this.rule = rule;
    this.reason = reason;
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceLines) {
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.annotateSourceFileExcerpt(sourceLines);
  }
}
