package kala.parser;

import kala.backend.Fragment;
import kala.backend.instructions.Cmp;
import kala.backend.instructions.Jcc;
import kala.backend.operands.Operand;
import kala.block.Block;
import kala.source.SourceLine;

/** {@code if <condition>} and an opening brace: skip the body if the condition is zero. */
public class IfParser implements ConstructParser {

  @Override
  public Fragment parse(SourceLine line, TranslationState state) {
    LineScanner scanner = new LineScanner(line, "if statement");
    scanner.expectKeyword("if");
    String condition = scanner.blockHeader("condition");

    String falseBranch = state.labels.allocate("else");
    state.blocks.push(new Block.If(falseBranch, line.range()));
    return Fragment.of(
        new Cmp(Operand.verbatim(condition), Operand.verbatim("0")),
        new Jcc(Jcc.Condition.EQUAL, falseBranch));
  }
}
