package kala.translate;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import kala.backend.Fragment;
import kala.backend.instructions.Comment;
import kala.block.Block;
import kala.parser.BlockCloseHandler;
import kala.parser.ConstructParser;
import kala.parser.ForParser;
import kala.parser.HeaderParser;
import kala.parser.IfParser;
import kala.parser.ListDeclarationParser;
import kala.parser.ParserError;
import kala.parser.PrintParser;
import kala.parser.StructuralFault;
import kala.parser.TranslationState;
import kala.parser.WhileParser;
import kala.source.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes each source line to the parser of its construct. Errors of a single statement are caught
 * here, reported and replaced by an empty fragment.
 */
public class StatementDispatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger("StatementDispatcher");
  private static final String COMMENT_START = "#";

  private final ImmutableMap<Construct, ConstructParser> parsers;
  private final DiagnosticsSink diagnostics;

  public StatementDispatcher(DiagnosticsSink diagnostics) {
    this(defaultParsers(), diagnostics);
  }

  StatementDispatcher(Map<Construct, ConstructParser> parsers, DiagnosticsSink diagnostics) {
    this.parsers = Maps.immutableEnumMap(parsers);
    this.diagnostics = diagnostics;
  }

  private static Map<Construct, ConstructParser> defaultParsers() {
    Map<Construct, ConstructParser> parsers = new EnumMap<>(Construct.class);
    parsers.put(Construct.LIST, new ListDeclarationParser());
    parsers.put(Construct.CLASS, new HeaderParser(Block.Kind.CLASS));
    parsers.put(Construct.METHOD, new HeaderParser(Block.Kind.METHOD));
    parsers.put(Construct.PRINT, new PrintParser());
    parsers.put(Construct.IF, new IfParser());
    parsers.put(Construct.WHILE, new WhileParser());
    parsers.put(Construct.FOR, new ForParser());
    parsers.put(Construct.BLOCK_CLOSE, new BlockCloseHandler());
    return parsers;
  }

  public Fragment dispatch(SourceLine line, TranslationState state) {
    if (line.isBlank() || line.text.startsWith(COMMENT_START)) {
      return Fragment.EMPTY;
    }
    Optional<Construct> construct = Construct.classify(line.text);
    if (!construct.isPresent()) {
      LOGGER.debug("line {}: unrecognized syntax '{}'", line.number, line.text);
      return Fragment.of(new Comment(line.text + " (unrecognized syntax)"));
    }
    LOGGER.trace("line {}: {}", line.number, construct.get());
    ConstructParser parser = parsers.get(construct.get());
    if (parser == null) {
      throw new IllegalStateException("no parser registered for " + construct.get());
    }
    try {
      return parser.parse(line, state);
    } catch (ParserError e) {
      diagnostics.report(Diagnostic.of(e));
    } catch (StructuralFault e) {
      diagnostics.report(Diagnostic.of(e));
    }
    return Fragment.EMPTY;
  }
}
