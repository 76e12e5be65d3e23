package kala.parser;

import kala.backend.Fragment;
import kala.backend.instructions.Cmp;
import kala.backend.instructions.Jcc;
import kala.backend.instructions.Label;
import kala.backend.operands.Operand;
import kala.block.Block;
import kala.block.LabelAllocator;
import kala.source.SourceLine;

/**
 * {@code while <condition>} and an opening brace: test at the top, leave the loop when the
 * condition is zero.
 */
public class WhileParser implements ConstructParser {

  @Override
  public Fragment parse(SourceLine line, TranslationState state) {
    LineScanner scanner = new LineScanner(line, "while statement");
    scanner.expectKeyword("while");
    String condition = scanner.blockHeader("condition");

    LabelAllocator.LabelPair labels = state.labels.allocatePair("while");
    state.blocks.push(new Block.While(labels, line.range()));
    return Fragment.of(
        new Label(labels.entry),
        new Cmp(Operand.verbatim(condition), Operand.verbatim("0")),
        new Jcc(Jcc.Condition.EQUAL, labels.exit));
  }
}
