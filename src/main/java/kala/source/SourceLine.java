package kala.source;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;
import kala.util.SourceRange;

/** One logical line of Kala source, remembering where its trimmed text sits in the raw line. */
public class SourceLine {
  public final int number;
  public final String raw;
  /** The line without leading and trailing whitespace. */
  public final String text;
  /** Column of the first character of {@link #text} within {@link #raw}. */
  public final int offset;

  public SourceLine(int number, String raw) {
    checkArgument(number >= 1, "line numbers start with 1");
    this.number = number;
    this.raw = raw;
    this.text = CharMatcher.whitespace().trimFrom(raw);
    int firstNonBlank = CharMatcher.whitespace().negate().indexIn(raw);
    this.offset = firstNonBlank < 0 ? 0 : firstNonBlank;
  }

  public boolean isBlank() {
    return text.isEmpty();
  }

  /** The range of the whole trimmed text. */
  public SourceRange range() {
    return rangeOf(0, text.length());
  }

  /** The range of {@code text.substring(from, to)}; empty ranges are widened to one column. */
  public SourceRange rangeOf(int from, int to) {
    return SourceRange.onLine(number, offset + from, to - from);
  }

  @Override
  public String toString() {
    return number + ": " + text;
  }
}
