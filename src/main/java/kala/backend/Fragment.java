package kala.backend;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import kala.backend.instructions.Instruction;
import kala.backend.syntax.GasSyntax;
import org.jetbrains.annotations.NotNull;

/** The instructions produced for a single source line. Immutable once produced. */
public final class Fragment implements Iterable<Instruction> {
  public static final Fragment EMPTY = new Fragment(ImmutableList.of());

  private final ImmutableList<Instruction> instructions;

  private Fragment(ImmutableList<Instruction> instructions) {
    this.instructions = instructions;
  }

  public static Fragment of(Instruction... instructions) {
    return instructions.length == 0 ? EMPTY : new Fragment(ImmutableList.copyOf(instructions));
  }

  public boolean isEmpty() {
    return instructions.isEmpty();
  }

  public ImmutableList<Instruction> instructions() {
    return instructions;
  }

  @NotNull
  @Override
  public Iterator<Instruction> iterator() {
    return instructions.iterator();
  }

  @Override
  public String toString() {
    return GasSyntax.format(instructions);
  }
}
