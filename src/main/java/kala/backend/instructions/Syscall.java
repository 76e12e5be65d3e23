package kala.backend.instructions;

public class Syscall extends Instruction {

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }
}
