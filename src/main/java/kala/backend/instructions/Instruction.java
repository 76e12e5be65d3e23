package kala.backend.instructions;

/**
 * A single line of the generated assembly. Instructions are immutable; a construct parser produces
 * a handful of them as a {@link kala.backend.Fragment}.
 */
public abstract class Instruction {

  public abstract void accept(Visitor visitor);

  public interface Visitor {
    void visit(Cmp cmp);

    void visit(Comment comment);

    void visit(DataDeclaration data);

    void visit(Jcc jcc);

    void visit(Jmp jmp);

    void visit(Label label);

    void visit(Lea lea);

    void visit(Mov mov);

    void visit(Syscall syscall);
  }
}
