package kala.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import java.util.List;

/**
 * A half-open interval on one source line, denoting the extent of some syntax element. In
 * particular, @end@ is one beyond the last character of the syntax element.
 *
 * <p>Kala statements never span lines, so a range always starts and ends on the same line.
 */
public class SourceRange {
  public final SourcePosition begin;
  public final SourcePosition end; // exclusive!

  private SourceRange(SourcePosition begin, int length) {
    checkArgument(length > 0, "SourceRange ends before it begins");
    this.begin = checkNotNull(begin);
    this.end = begin.moveHorizontal(length);
  }

  /**
   * The range covering {@code length} characters of {@code line}, starting at {@code column}. An
   * empty range is widened to one column, so there is always something to point at.
   */
  public static SourceRange onLine(int line, int column, int length) {
    checkArgument(line >= 1 && column >= 0, "no such position %s:%s", line, column);
    return new SourceRange(new SourcePosition(line, column), Math.max(1, length));
  }

  /**
   * Quotes the line of this range and underlines the range with carets. Returns the empty string
   * if the line is not part of {@code sourceLines}.
   */
  public String annotateSourceFileExcerpt(List<String> sourceLines) {
    int line0 = begin.line - 1; // recall that lines start with 1
    if (line0 >= sourceLines.size()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    String prefix = String.format("%d| ", begin.line);
    sb.append(prefix);
    sb.append(sourceLines.get(line0));
    sb.append(System.lineSeparator());
    sb.append(Strings.repeat(" ", prefix.length() + begin.column));
    sb.append(Strings.repeat("^", end.column - begin.column));
    sb.append(System.lineSeparator());
    return sb.toString();
  }

  @Override
  public String toString() {
    return String.format("%s-%s", begin, end);
  }
}
