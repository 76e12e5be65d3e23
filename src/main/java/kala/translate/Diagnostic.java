package kala.translate;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import kala.KalaError;
import kala.parser.ParserError;
import kala.parser.StructuralFault;
import kala.util.SourceRange;

/** A problem found while translating. Diagnostics never stop a lenient translation. */
public class Diagnostic {
  public final Kind kind;
  public final SourceRange range;
  public final KalaError error;

  private Diagnostic(Kind kind, SourceRange range, KalaError error) {
    this.kind = checkNotNull(kind);
    this.range = checkNotNull(range);
    this.error = checkNotNull(error);
  }

  public static Diagnostic of(ParserError error) {
    return new Diagnostic(Kind.PARSE_ERROR, error.range, error);
  }

  public static Diagnostic of(StructuralFault fault) {
    return new Diagnostic(Kind.STRUCTURAL_FAULT, fault.range, fault);
  }

  public int line() {
    return range.begin.line;
  }

  public String message() {
    return error.getMessage();
  }

  public String getSourceReferencingMessage(List<String> sourceLines) {
    return error.getSourceReferencingMessage(sourceLines);
  }

  @Override
  public String toString() {
    return kind + " " + message();
  }

  public enum Kind {
    PARSE_ERROR,
    STRUCTURAL_FAULT
  }
}
