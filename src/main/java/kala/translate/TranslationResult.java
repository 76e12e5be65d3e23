package kala.translate;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import kala.backend.instructions.Instruction;

/** Everything a translation produced: the instructions, their text, and the diagnostics. */
public class TranslationResult {
  public final ImmutableList<Instruction> instructions;
  public final String assembly;
  public final ImmutableList<Diagnostic> diagnostics;
  public final int blocksOpened;
  public final int blocksClosed;

  TranslationResult(
      ImmutableList<Instruction> instructions,
      String assembly,
      ImmutableList<Diagnostic> diagnostics,
      int blocksOpened,
      int blocksClosed) {
    this.instructions = instructions;
    this.assembly = assembly;
    this.diagnostics = diagnostics;
    this.blocksOpened = blocksOpened;
    this.blocksClosed = blocksClosed;
  }

  public boolean hasDiagnostics() {
    return !diagnostics.isEmpty();
  }

  public long count(Diagnostic.Kind kind) {
    return seq(diagnostics).filter(d -> d.kind == kind).count();
  }

  public ImmutableList<Diagnostic> structuralFaults() {
    return seq(diagnostics)
        .filter(d -> d.kind == Diagnostic.Kind.STRUCTURAL_FAULT)
        .collect(ImmutableList.toImmutableList());
  }
}
