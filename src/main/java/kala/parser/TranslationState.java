package kala.parser;

import kala.block.BlockTracker;
import kala.block.LabelAllocator;

/**
 * The mutable state of one translation. Construct parsers consult and update it; nothing of it
 * survives the translation.
 */
public class TranslationState {
  public final BlockTracker blocks = new BlockTracker();
  public final LabelAllocator labels = new LabelAllocator();
}
