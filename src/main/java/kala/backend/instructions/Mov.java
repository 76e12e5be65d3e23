package kala.backend.instructions;

import static com.google.common.base.Preconditions.checkNotNull;

import kala.backend.operands.Operand;

public class Mov extends Instruction {
  public final Operand src;
  public final Operand dest;

  public Mov(Operand src, Operand dest) {
    this.src = checkNotNull(src);
    this.dest = checkNotNull(dest);
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }
}
