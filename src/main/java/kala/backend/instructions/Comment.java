package kala.backend.instructions;

import static com.google.common.base.Preconditions.checkNotNull;

/** A comment line. Used for class and method boundaries and for unrecognized source lines. */
public class Comment extends Instruction {
  public final String text;

  public Comment(String text) {
    this.text = checkNotNull(text);
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }
}
