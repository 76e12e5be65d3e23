package kala.parser;

import com.google.common.base.CharMatcher;
import kala.backend.Fragment;
import kala.backend.instructions.Cmp;
import kala.backend.instructions.Jcc;
import kala.backend.instructions.Label;
import kala.backend.instructions.Mov;
import kala.backend.operands.Operand;
import kala.backend.operands.RegisterOperand;
import kala.block.Block;
import kala.block.LabelAllocator;
import kala.source.SourceLine;

/**
 * {@code for <var> in range(<start>, <end>)} and an opening brace. The loop variable lives in a
 * register of the same name and runs from start (inclusive) to end (exclusive).
 */
public class ForParser implements ConstructParser {
  private static final CharMatcher RANGE_DELIMITERS = CharMatcher.anyOf(",()");

  @Override
  public Fragment parse(SourceLine line, TranslationState state) {
    LineScanner scanner = new LineScanner(line, "for statement");
    scanner.expectKeyword("for");
    String variable = scanner.identifier("loop variable");
    scanner.skipWhitespace();
    int rangeBegin = scanner.position();
    if (!scanner.tryKeyword("in")) {
      throw scanner.error("missing 'in range(...)'");
    }
    if (!scanner.tryConsume("range")) {
      throw scanner.error(rangeBegin, scanner.position() + 1, "missing 'in range(...)'");
    }
    scanner.skipWhitespace();
    int openParen = scanner.position();
    scanner.expect('(');

    String start = scanner.upTo(RANGE_DELIMITERS);
    if (start == null || scanner.current() == '(') {
      throw scanner.error(openParen, openParen + 1, "unbalanced parentheses");
    }
    if (scanner.current() != ',') {
      throw scanner.error("expected ','");
    }
    if (start.isEmpty()) {
      throw scanner.error("missing range start");
    }
    scanner.expect(',');

    String end = scanner.upTo(RANGE_DELIMITERS);
    if (end == null || scanner.current() == '(') {
      throw scanner.error(openParen, openParen + 1, "unbalanced parentheses");
    }
    if (scanner.current() != ')') {
      throw scanner.error("expected ')'");
    }
    if (end.isEmpty()) {
      throw scanner.error("missing range end");
    }
    scanner.expect(')');
    scanner.expectBlockOpening();

    RegisterOperand counter = Operand.reg(variable);
    LabelAllocator.LabelPair labels = state.labels.allocatePair("for");
    state.blocks.push(new Block.For(variable, labels, line.range()));
    return Fragment.of(
        new Mov(Operand.verbatim(start), counter),
        new Label(labels.entry),
        new Cmp(counter, Operand.verbatim(end)),
        new Jcc(Jcc.Condition.GREATER_OR_EQUAL, labels.exit));
  }
}
