package kala.translate;

import static org.jooq.lambda.Seq.seq;

import kala.backend.InstructionEmitter;
import kala.block.Block;
import kala.parser.StructuralFault;
import kala.parser.TranslationState;
import kala.source.SourceLine;
import kala.source.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates Kala source to assembly in a single pass, line by line. Every call to {@link
 * #translate(SourceText)} works on fresh state, so a translator may be reused and shared between
 * threads.
 */
public class Translator {
  private static final Logger LOGGER = LoggerFactory.getLogger("Translator");

  private final TranslationOptions options;

  public Translator(TranslationOptions options) {
    this.options = options;
  }

  public Translator() {
    this(TranslationOptions.DEFAULT);
  }

  /**
   * @throws TranslationAborted under {@link FaultPolicy#STRICT} at the first structural fault
   */
  public TranslationResult translate(SourceText source) {
    TranslationState state = new TranslationState();
    DiagnosticsCollector diagnostics = new DiagnosticsCollector(options.faultPolicy);
    StatementDispatcher dispatcher = new StatementDispatcher(diagnostics);
    InstructionEmitter emitter = new InstructionEmitter();

    for (SourceLine line : source) {
      emitter.append(dispatcher.dispatch(line, state));
    }
    reportUnclosedBlocks(state, diagnostics);

    LOGGER.debug(
        "translated {} lines into {} fragments, {} labels, {} diagnostics",
        source.size(),
        emitter.fragmentCount(),
        state.labels.allocated(),
        diagnostics.diagnostics().size());
    return new TranslationResult(
        emitter.instructions(),
        emitter.toGNUAssembler(options.fileName.orElse(null)),
        diagnostics.diagnostics(),
        state.blocks.pushCount(),
        state.blocks.popCount());
  }

  private static void reportUnclosedBlocks(TranslationState state, DiagnosticsSink diagnostics) {
    // outermost first, that is in source order
    for (Block block : seq(state.blocks.openBlocks()).reverse()) {
      diagnostics.report(
          Diagnostic.of(new StructuralFault(block.opened, block + " is never closed")));
    }
  }
}
