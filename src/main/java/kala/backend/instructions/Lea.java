package kala.backend.instructions;

import static com.google.common.base.Preconditions.checkNotNull;

import kala.backend.operands.Operand;

public class Lea extends Instruction {
  public final Operand src;
  public final Operand dest;

  public Lea(Operand src, Operand dest) {
    this.src = checkNotNull(src);
    this.dest = checkNotNull(dest);
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }
}
