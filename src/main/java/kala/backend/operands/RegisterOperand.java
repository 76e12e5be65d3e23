package kala.backend.operands;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.function.Function;

/**
 * A named register. Loop variables of {@code for} statements are rendered as registers of the same
 * name, there is no register allocation.
 */
public class RegisterOperand extends Operand {
  public static final RegisterOperand RAX = new RegisterOperand("rax");
  public static final RegisterOperand RDI = new RegisterOperand("rdi");
  public static final RegisterOperand RSI = new RegisterOperand("rsi");

  public final String name;

  public RegisterOperand(String name) {
    checkArgument(!name.isEmpty(), "register name must not be empty");
    this.name = name;
  }

  @Override
  public <T> T match(
      Function<ImmediateOperand, T> matchImm,
      Function<RegisterOperand, T> matchReg,
      Function<VerbatimOperand, T> matchVerbatim) {
    return matchReg.apply(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return name.equals(((RegisterOperand) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return "%" + name;
  }
}
