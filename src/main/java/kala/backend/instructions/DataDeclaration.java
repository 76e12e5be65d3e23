package kala.backend.instructions;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** {@code name: .data e1, e2, ...}; the elements are kept verbatim. */
public class DataDeclaration extends Instruction {
  public final String name;
  public final ImmutableList<String> elements;

  public DataDeclaration(String name, List<String> elements) {
    this.name = checkNotNull(name);
    this.elements = ImmutableList.copyOf(elements);
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }
}
