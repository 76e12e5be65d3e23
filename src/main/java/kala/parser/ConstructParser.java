package kala.parser;

import kala.backend.Fragment;
import kala.source.SourceLine;

/** Parses one kind of statement and translates it to its instruction fragment. */
public interface ConstructParser {

  /**
   * @throws ParserError if the line is malformed. The state must be left untouched in that case.
   * @throws StructuralFault if the line closes a block that was never opened
   */
  Fragment parse(SourceLine line, TranslationState state);
}
