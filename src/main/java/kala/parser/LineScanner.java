package kala.parser;

import com.google.common.base.CharMatcher;
import kala.source.SourceLine;

/**
 * Cursor over the trimmed text of one source line. Every {@code expect*} method either consumes
 * what it expects or throws a {@link ParserError} pointing at the current column.
 */
class LineScanner {
  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();
  private static final CharMatcher IDENT_START =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.is('_'));
  private static final CharMatcher IDENT_PART = IDENT_START.or(CharMatcher.inRange('0', '9'));

  private final SourceLine line;
  private final String text;
  private final String rule;
  private int pos = 0;

  LineScanner(SourceLine line, String rule) {
    this.line = line;
    this.text = line.text;
    this.rule = rule;
  }

  int position() {
    return pos;
  }

  /** The character under the cursor. */
  char current() {
    return text.charAt(pos);
  }

  boolean atEnd() {
    return pos >= text.length();
  }

  void skipWhitespace() {
    while (!atEnd() && WHITESPACE.matches(text.charAt(pos))) {
      pos++;
    }
  }

  /** Consumes {@code keyword} and the whitespace following it. */
  void expectKeyword(String keyword) {
    if (!text.startsWith(keyword, pos)) {
      throw error("expected '" + keyword + "'");
    }
    pos += keyword.length();
    if (!atEnd() && !WHITESPACE.matches(text.charAt(pos))) {
      throw error("expected whitespace after '" + keyword + "'");
    }
    skipWhitespace();
  }

  /** Consumes {@code keyword} and the whitespace after it, if the cursor is looking at both. */
  boolean tryKeyword(String keyword) {
    int end = pos + keyword.length();
    if (text.startsWith(keyword, pos)
        && end < text.length()
        && WHITESPACE.matches(text.charAt(end))) {
      pos = end;
      skipWhitespace();
      return true;
    }
    return false;
  }

  /** Consumes {@code literal} if the cursor is looking at it. */
  boolean tryConsume(String literal) {
    if (text.startsWith(literal, pos)) {
      pos += literal.length();
      return true;
    }
    return false;
  }

  void expect(char c) {
    if (atEnd() || text.charAt(pos) != c) {
      throw error("expected '" + c + "'");
    }
    pos++;
  }

  String identifier(String what) {
    int begin = pos;
    if (atEnd() || !IDENT_START.matches(text.charAt(pos))) {
      throw error("expected " + what);
    }
    while (!atEnd() && IDENT_PART.matches(text.charAt(pos))) {
      pos++;
    }
    return text.substring(begin, pos);
  }

  /**
   * Consumes everything up to, but excluding, the first occurrence of any of {@code stops}, and
   * returns it trimmed. Returns {@code null} if none of the stop characters occurs.
   */
  String upTo(CharMatcher stops) {
    int stop = stops.indexIn(text, pos);
    if (stop < 0) {
      return null;
    }
    String consumed = text.substring(pos, stop);
    pos = stop;
    return WHITESPACE.trimFrom(consumed);
  }

  /**
   * The opaque header of a block statement: everything between the cursor and the opening brace
   * that ends the line. Consumes the rest of the line.
   */
  String blockHeader(String what) {
    if (!text.endsWith("{")) {
      pos = text.length();
      throw error("expected '{' at the end of the line");
    }
    String header = WHITESPACE.trimFrom(text.substring(pos, text.length() - 1));
    if (header.isEmpty()) {
      throw error("missing " + what);
    }
    pos = text.length();
    return header;
  }

  /** Expects the opening brace of a block to be the last thing on the line. */
  void expectBlockOpening() {
    skipWhitespace();
    expect('{');
    expectEnd();
  }

  void expectEnd() {
    skipWhitespace();
    if (!atEnd()) {
      throw error("unexpected '" + text.substring(pos) + "'");
    }
  }

  ParserError error(String reason) {
    return new ParserError(line.rangeOf(pos, pos + 1), rule, reason);
  }

  ParserError error(int from, int to, String reason) {
    return new ParserError(line.rangeOf(from, to), rule, reason);
  }
}
