package kala.backend.instructions;

import static com.google.common.base.Preconditions.checkNotNull;

public class Jcc extends Instruction {
  public final Condition condition;
  public final String label;

  public Jcc(Condition condition, String label) {
    this.condition = checkNotNull(condition);
    this.label = checkNotNull(label);
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  public enum Condition {
    EQUAL("e"),
    GREATER_OR_EQUAL("ge");

    public final String suffix;

    Condition(String suffix) {
      this.suffix = suffix;
    }
  }
}
