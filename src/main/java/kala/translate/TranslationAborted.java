package kala.translate;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import kala.KalaError;

/** Thrown when a strict translation hits a structural fault. Nothing is emitted in that case. */
public class TranslationAborted extends KalaError {
  public final ImmutableList<Diagnostic> diagnostics;

  public TranslationAborted(List<Diagnostic> diagnostics) {
    super(
        String.format(
            "translation aborted after %d diagnostic(s): %s",
            diagnostics.size(),
            diagnostics.isEmpty() ? "" : diagnostics.get(diagnostics.size() - 1).message()));
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceLines) {
    return seq(diagnostics)
        .map(d -> d.getSourceReferencingMessage(sourceLines))
        .collect(Collectors.joining(System.lineSeparator()));
  }
}
