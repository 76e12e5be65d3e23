package kala.backend;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import kala.backend.instructions.Instruction;
import kala.backend.syntax.GasSyntax;
import org.jetbrains.annotations.Nullable;

/**
 * Accumulates the fragments of one translation in source order. Owns the output buffer; knows
 * nothing about parsing.
 */
public class InstructionEmitter {

  private final List<Instruction> instructions = new ArrayList<>();
  private int fragments = 0;

  public void append(Fragment fragment) {
    if (fragment.isEmpty()) {
      return;
    }
    fragments++;
    instructions.addAll(fragment.instructions());
  }

  /** Number of non-empty fragments appended so far. */
  public int fragmentCount() {
    return fragments;
  }

  public ImmutableList<Instruction> instructions() {
    return ImmutableList.copyOf(instructions);
  }

  public String toGNUAssembler(@Nullable String fileName) {
    StringBuilder builder = new StringBuilder();
    if (fileName != null) {
      GasSyntax.formatFileDirective(builder, fileName);
    }
    GasSyntax.formatInstructions(builder, instructions);
    return builder.toString();
  }
}
