package kala.translate;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs and records diagnostics, and aborts on structural faults under {@link FaultPolicy#STRICT}.
 */
class DiagnosticsCollector implements DiagnosticsSink {
  private static final Logger LOGGER = LoggerFactory.getLogger("Diagnostics");

  private final FaultPolicy policy;
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  DiagnosticsCollector(FaultPolicy policy) {
    this.policy = policy;
  }

  @Override
  public void report(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
    LOGGER.warn(diagnostic.message());
    if (diagnostic.kind == Diagnostic.Kind.STRUCTURAL_FAULT && policy == FaultPolicy.STRICT) {
      throw new TranslationAborted(diagnostics());
    }
  }

  ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }
}
