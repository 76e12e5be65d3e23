package kala.backend.operands;

import java.util.function.Function;

/**
 * Operand for an assembler instruction. Kala has no expression grammar, so apart from fixed
 * registers and immediates used by the instruction templates, operands are source tokens that are
 * passed through verbatim.
 */
public abstract class Operand {

  public abstract <T> T match(
      Function<ImmediateOperand, T> matchImm,
      Function<RegisterOperand, T> matchReg,
      Function<VerbatimOperand, T> matchVerbatim);

  public static ImmediateOperand imm(long value) {
    return new ImmediateOperand(value);
  }

  public static RegisterOperand reg(String name) {
    return new RegisterOperand(name);
  }

  public static VerbatimOperand verbatim(String token) {
    return new VerbatimOperand(token);
  }
}
