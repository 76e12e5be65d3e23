package kala.translate;

import java.util.Optional;

/** The statement kinds, recognized by the literal form a trimmed line starts with. */
public enum Construct {
  LIST("list "),
  CLASS("class "),
  METHOD("method "),
  PRINT("print "),
  IF("if "),
  WHILE("while "),
  FOR("for "),
  BLOCK_CLOSE("}") {
    @Override
    boolean matches(String text) {
      return text.equals(leadingForm);
    }
  };

  public final String leadingForm;

  Construct(String leadingForm) {
    this.leadingForm = leadingForm;
  }

  boolean matches(String text) {
    return text.startsWith(leadingForm);
  }

  /** Classifies a trimmed, non-blank line. No two leading forms overlap, so order is irrelevant. */
  public static Optional<Construct> classify(String text) {
    for (Construct construct : values()) {
      if (construct.matches(text)) {
        return Optional.of(construct);
      }
    }
    return Optional.empty();
  }
}
