package kala.backend.instructions;

import static com.google.common.base.Preconditions.checkNotNull;

import kala.backend.operands.Operand;

public class Cmp extends Instruction {
  public final Operand left;
  public final Operand right;

  public Cmp(Operand left, Operand right) {
    this.left = checkNotNull(left);
    this.right = checkNotNull(right);
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }
}
