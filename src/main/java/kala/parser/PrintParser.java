package kala.parser;

import static kala.backend.operands.RegisterOperand.RAX;
import static kala.backend.operands.RegisterOperand.RDI;
import static kala.backend.operands.RegisterOperand.RSI;

import kala.backend.Fragment;
import kala.backend.instructions.Lea;
import kala.backend.instructions.Mov;
import kala.backend.instructions.Syscall;
import kala.backend.operands.Operand;
import kala.source.SourceLine;

/**
 * {@code print "<message>"}. Emits a write(2) to stdout. The message is not escaped; quotes inside
 * it are copied as they are.
 */
public class PrintParser implements ConstructParser {
  private static final int SYS_WRITE = 1;
  private static final int STDOUT = 1;

  @Override
  public Fragment parse(SourceLine line, TranslationState state) {
    LineScanner scanner = new LineScanner(line, "print statement");
    scanner.expectKeyword("print");
    int begin = scanner.position();
    String quoted = line.text.substring(begin);
    if (!quoted.startsWith("\"")) {
      throw scanner.error("expected '\"'");
    }
    if (quoted.length() < 2 || !quoted.endsWith("\"")) {
      throw scanner.error(begin, line.text.length(), "unterminated message");
    }
    String message = quoted.substring(1, quoted.length() - 1);
    if (message.isEmpty()) {
      throw scanner.error(begin, line.text.length(), "empty message");
    }
    return Fragment.of(
        new Mov(Operand.imm(SYS_WRITE), RAX),
        new Mov(Operand.imm(STDOUT), RDI),
        new Lea(Operand.verbatim(message), RSI),
        new Syscall());
  }
}
