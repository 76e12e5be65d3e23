package kala.backend.instructions;

import static com.google.common.base.Preconditions.checkNotNull;

public class Jmp extends Instruction {
  public final String label;

  public Jmp(String label) {
    this.label = checkNotNull(label);
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }
}
