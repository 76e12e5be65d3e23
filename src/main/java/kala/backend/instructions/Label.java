package kala.backend.instructions;

import static com.google.common.base.Preconditions.checkNotNull;

/** Definition of a jump target. */
public class Label extends Instruction {
  public final String label;

  public Label(String label) {
    this.label = checkNotNull(label);
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }
}
