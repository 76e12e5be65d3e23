package kala.backend.syntax;

import com.google.common.base.Joiner;
import java.util.List;
import kala.backend.instructions.Cmp;
import kala.backend.instructions.Comment;
import kala.backend.instructions.DataDeclaration;
import kala.backend.instructions.Instruction;
import kala.backend.instructions.Jcc;
import kala.backend.instructions.Jmp;
import kala.backend.instructions.Label;
import kala.backend.instructions.Lea;
import kala.backend.instructions.Mov;
import kala.backend.instructions.Syscall;
import kala.backend.operands.Operand;

/**
 * Renders instructions as GNU assembler text in AT&T operand order, one instruction per line.
 * Lines are always terminated by {@code \n}, independent of the platform.
 */
public class GasSyntax implements Instruction.Visitor {
  public static final String NEWLINE = "\n";

  private final StringBuilder builder;

  private GasSyntax(StringBuilder builder) {
    this.builder = builder;
  }

  @Override
  public void visit(Cmp cmp) {
    formatInstruction("cmp", cmp.left, cmp.right);
  }

  @Override
  public void visit(Comment comment) {
    builder.append("; ");
    builder.append(comment.text);
    appendLine();
  }

  @Override
  public void visit(DataDeclaration data) {
    builder.append(data.name);
    builder.append(": .data");
    if (!data.elements.isEmpty()) {
      builder.append(' ');
      Joiner.on(", ").appendTo(builder, data.elements);
    }
    appendLine();
  }

  @Override
  public void visit(Jcc jcc) {
    builder.append("j");
    builder.append(jcc.condition.suffix);
    builder.append(" ");
    builder.append(jcc.label);
    appendLine();
  }

  @Override
  public void visit(Jmp jmp) {
    builder.append("jmp ");
    builder.append(jmp.label);
    appendLine();
  }

  @Override
  public void visit(Label label) {
    builder.append(label.label);
    builder.append(":");
    appendLine();
  }

  @Override
  public void visit(Lea lea) {
    formatInstruction("lea", lea.src, lea.dest);
  }

  @Override
  public void visit(Mov mov) {
    formatInstruction("mov", mov.src, mov.dest);
  }

  @Override
  public void visit(Syscall syscall) {
    builder.append("syscall");
    appendLine();
  }

  private void formatInstruction(String mnemonic, Operand... operands) {
    builder.append(mnemonic);
    boolean first = true;
    for (Operand operand : operands) {
      builder.append(first ? " " : ", ");
      first = false;
      formatOperand(operand);
    }
    appendLine();
  }

  private void formatOperand(Operand operand) {
    builder.append(
        operand.<String>match(
            imm -> "$" + imm.value, reg -> "%" + reg.name, verbatim -> verbatim.token));
  }

  private void appendLine() {
    builder.append(NEWLINE);
  }

  public static void formatInstructions(StringBuilder builder, List<Instruction> instructions) {
    GasSyntax syntax = new GasSyntax(builder);
    instructions.forEach(i -> i.accept(syntax));
  }

  public static String format(List<Instruction> instructions) {
    StringBuilder builder = new StringBuilder();
    formatInstructions(builder, instructions);
    return builder.toString();
  }

  public static void formatFileDirective(StringBuilder builder, String fileName) {
    builder.append(".file \"");
    builder.append(fileName);
    builder.append("\"");
    builder.append(NEWLINE);
  }
}
