package kala.util;

/**
 * Position in the source file. Lines start with 1, columns with 0. Instances of this class are
 * immutable.
 */
public class SourcePosition {
  public final int line;
  public final int column;

  public SourcePosition(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public SourcePosition moveHorizontal(int length) {
    return new SourcePosition(line, column + length);
  }

  @Override
  public String toString() {
    return "[" + line + ":" + column + "]";
  }
}
