package kala.parser;

import static com.google.common.base.Preconditions.checkArgument;

import kala.backend.Fragment;
import kala.backend.instructions.Comment;
import kala.block.Block;
import kala.source.SourceLine;

/**
 * Class and method headers, {@code class <Name>} or {@code method <Name>} followed by an opening
 * brace. Opens a named block and marks its start with a comment. Classes and methods are no jump
 * targets, so no label is allocated.
 */
public class HeaderParser implements ConstructParser {
  private final Block.Kind kind;

  public HeaderParser(Block.Kind kind) {
    checkArgument(
        kind == Block.Kind.CLASS || kind == Block.Kind.METHOD, "%s has no named header", kind);
    this.kind = kind;
  }

  @Override
  public Fragment parse(SourceLine line, TranslationState state) {
    LineScanner scanner = new LineScanner(line, kind.keyword + " declaration");
    scanner.expectKeyword(kind.keyword);
    String name = scanner.identifier(kind.keyword + " name");
    scanner.expectBlockOpening();

    Block block =
        kind == Block.Kind.CLASS
            ? new Block.ClassDecl(name, line.range())
            : new Block.MethodDecl(name, line.range());
    state.blocks.push(block);
    return Fragment.of(new Comment("Start of " + kind.keyword + " " + name));
  }
}
