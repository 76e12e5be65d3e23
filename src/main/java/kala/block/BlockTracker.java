package kala.block;

import java.util.Optional;
import org.pcollections.ConsPStack;
import org.pcollections.PStack;

/**
 * The stack of open blocks of one translation. Backed by a persistent stack, so {@link
 * #openBlocks()} hands out snapshots without copying.
 */
public class BlockTracker {
  private PStack<Block> open = ConsPStack.empty();
  private int pushed = 0;
  private int popped = 0;

  public void push(Block block) {
    open = open.plus(block);
    pushed++;
  }

  /** Pops the innermost open block, or returns nothing if no block is open. */
  public Optional<Block> pop() {
    if (open.isEmpty()) {
      return Optional.empty();
    }
    Block top = open.get(0);
    open = open.minus(0);
    popped++;
    return Optional.of(top);
  }

  public Optional<Block> peek() {
    return open.isEmpty() ? Optional.empty() : Optional.of(open.get(0));
  }

  public boolean isEmpty() {
    return open.isEmpty();
  }

  public int depth() {
    return open.size();
  }

  /** Number of blocks opened so far. */
  public int pushCount() {
    return pushed;
  }

  /** Number of blocks closed so far. */
  public int popCount() {
    return popped;
  }

  /** The currently open blocks, innermost first. */
  public PStack<Block> openBlocks() {
    return open;
  }
}
