package kala.translate;

/** Receives every diagnostic of a translation as soon as it is found. */
public interface DiagnosticsSink {

  /**
   * @throws TranslationAborted if the diagnostic ends the translation
   */
  void report(Diagnostic diagnostic);
}
