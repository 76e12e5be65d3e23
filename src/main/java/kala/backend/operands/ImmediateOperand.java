package kala.backend.operands;

import java.util.Objects;
import java.util.function.Function;

public class ImmediateOperand extends Operand {
  public final long value;

  public ImmediateOperand(long value) {
    this.value = value;
  }

  @Override
  public <T> T match(
      Function<ImmediateOperand, T> matchImm,
      Function<RegisterOperand, T> matchReg,
      Function<VerbatimOperand, T> matchVerbatim) {
    return matchImm.apply(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return value == ((ImmediateOperand) o).value;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value);
  }

  @Override
  public String toString() {
    return "$" + value;
  }
}
