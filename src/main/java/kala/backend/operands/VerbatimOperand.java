package kala.backend.operands;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.Function;

/** A source token copied into the output as is, e.g. a condition or a range bound. */
public class VerbatimOperand extends Operand {
  public final String token;

  public VerbatimOperand(String token) {
    this.token = checkNotNull(token);
  }

  @Override
  public <T> T match(
      Function<ImmediateOperand, T> matchImm,
      Function<RegisterOperand, T> matchReg,
      Function<VerbatimOperand, T> matchVerbatim) {
    return matchVerbatim.apply(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return token.equals(((VerbatimOperand) o).token);
  }

  @Override
  public int hashCode() {
    return token.hashCode();
  }

  @Override
  public String toString() {
    return token;
  }
}
