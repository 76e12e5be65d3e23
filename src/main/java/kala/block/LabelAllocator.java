package kala.block;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Mints the jump targets of one translation. A single counter is shared by all construct kinds,
 * so every construct instance gets its own number and no two labels of a translation collide.
 *
 * <p>Labels look like {@code else_3}, {@code while_0}/{@code end_while_0} or {@code
 * for_1}/{@code end_for_1}. Names of that shape are reserved: declared data must not use them.
 */
public class LabelAllocator {
  private static final ImmutableSet<String> STEMS = ImmutableSet.of("else", "while", "for");
  private static final Pattern RESERVED =
      Pattern.compile("(end_)?(" + Joiner.on('|').join(STEMS) + ")_[0-9]+");

  private final Set<String> issued = new HashSet<>();
  private int next = 0;

  /** A single label {@code <stem>_<n>}. */
  public String allocate(String stem) {
    return issue(stem + "_" + nextNumber(stem));
  }

  /** An entry/exit pair {@code <stem>_<n>} and {@code end_<stem>_<n>} sharing one number. */
  public LabelPair allocatePair(String stem) {
    int n = nextNumber(stem);
    String entry = issue(stem + "_" + n);
    String exit = issue("end_" + stem + "_" + n);
    return new LabelPair(entry, exit);
  }

  /** True if {@code name} could be minted by some allocator, now or later in a translation. */
  public static boolean isReserved(String name) {
    return RESERVED.matcher(name).matches();
  }

  /** How many construct instances received labels so far. */
  public int allocated() {
    return next;
  }

  private int nextNumber(String stem) {
    checkArgument(STEMS.contains(stem), "invalid label stem '%s'", stem);
    return next++;
  }

  private String issue(String label) {
    checkState(issued.add(label), "label %s was issued twice", label);
    return label;
  }

  public static class LabelPair {
    public final String entry;
    public final String exit;

    LabelPair(String entry, String exit) {
      this.entry = entry;
      this.exit = exit;
    }

    @Override
    public String toString() {
      return "(" + entry + ", " + exit + ")";
    }
  }
}
