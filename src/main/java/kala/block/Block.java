package kala.block;

import static com.google.common.base.Preconditions.checkNotNull;

import kala.util.SourceRange;

/**
 * A construct that was opened with a brace and is not closed yet. One variant per kind, each
 * carrying only what its closing fragment needs: a name for classes and methods, the labels bound
 * at open time for control flow.
 */
public abstract class Block {
  /** Where the block was opened, for diagnostics about blocks that are never closed. */
  public final SourceRange opened;

  private Block(SourceRange opened) {
    this.opened = checkNotNull(opened);
  }

  public abstract Kind kind();

  public abstract <T> T acceptVisitor(Visitor<T> visitor);

  public enum Kind {
    CLASS("class"),
    METHOD("method"),
    IF("if"),
    WHILE("while"),
    FOR("for");

    public final String keyword;

    Kind(String keyword) {
      this.keyword = keyword;
    }
  }

  public static class ClassDecl extends Block {
    public final String name;

    public ClassDecl(String name, SourceRange opened) {
      super(opened);
      this.name = checkNotNull(name);
    }

    @Override
    public Kind kind() {
      return Kind.CLASS;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitClass(this);
    }

    @Override
    public String toString() {
      return "class " + name;
    }
  }

  public static class MethodDecl extends Block {
    public final String name;

    public MethodDecl(String name, SourceRange opened) {
      super(opened);
      this.name = checkNotNull(name);
    }

    @Override
    public Kind kind() {
      return Kind.METHOD;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitMethod(this);
    }

    @Override
    public String toString() {
      return "method " + name;
    }
  }

  public static class If extends Block {
    /** Target of the jump taken when the condition is false. */
    public final String exitLabel;

    public If(String exitLabel, SourceRange opened) {
      super(opened);
      this.exitLabel = checkNotNull(exitLabel);
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public String toString() {
      return "if statement";
    }
  }

  /** Common shape of while and for loops: a back edge to the top, an exit below the body. */
  public abstract static class Loop extends Block {
    public final String entryLabel;
    public final String exitLabel;

    private Loop(LabelAllocator.LabelPair labels, SourceRange opened) {
      super(opened);
      this.entryLabel = labels.entry;
      this.exitLabel = labels.exit;
    }

    @Override
    public String toString() {
      return kind().keyword + " loop";
    }
  }

  public static class While extends Loop {
    public While(LabelAllocator.LabelPair labels, SourceRange opened) {
      super(labels, opened);
    }

    @Override
    public Kind kind() {
      return Kind.WHILE;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitWhile(this);
    }
  }

  public static class For extends Loop {
    public final String variable;

    public For(String variable, LabelAllocator.LabelPair labels, SourceRange opened) {
      super(labels, opened);
      this.variable = checkNotNull(variable);
    }

    @Override
    public Kind kind() {
      return Kind.FOR;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitFor(this);
    }
  }

  public interface Visitor<T> {

    T visitClass(ClassDecl that);

    T visitMethod(MethodDecl that);

    T visitIf(If that);

    T visitWhile(While that);

    T visitFor(For that);
  }
}
