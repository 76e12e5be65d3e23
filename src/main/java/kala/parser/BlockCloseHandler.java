package kala.parser;

import kala.backend.Fragment;
import kala.backend.instructions.Comment;
import kala.backend.instructions.Jmp;
import kala.backend.instructions.Label;
import kala.block.Block;
import kala.source.SourceLine;

/**
 * A lone closing brace. Closes the innermost open block and emits its back edge and merge point,
 * using the labels stored in the block when it was opened.
 */
public class BlockCloseHandler implements ConstructParser, Block.Visitor<Fragment> {

  @Override
  public Fragment parse(SourceLine line, TranslationState state) {
    return state
        .blocks
        .pop()
        .orElseThrow(() -> new StructuralFault(line.range(), "mismatched block closure"))
        .acceptVisitor(this);
  }

  @Override
  public Fragment visitClass(Block.ClassDecl that) {
    return Fragment.of(new Comment("End of class " + that.name));
  }

  @Override
  public Fragment visitMethod(Block.MethodDecl that) {
    return Fragment.of(new Comment("End of method " + that.name));
  }

  @Override
  public Fragment visitIf(Block.If that) {
    return Fragment.of(new Label(that.exitLabel));
  }

  @Override
  public Fragment visitWhile(Block.While that) {
    return closeLoop(that);
  }

  @Override
  public Fragment visitFor(Block.For that) {
    return closeLoop(that);
  }

  private static Fragment closeLoop(Block.Loop loop) {
    return Fragment.of(new Jmp(loop.entryLabel), new Label(loop.exitLabel));
  }
}
