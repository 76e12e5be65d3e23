package kala.translate;

/** What a structural fault does to the running translation. */
public enum FaultPolicy {
  /** Report the fault and go on; the translation always completes. */
  LENIENT,
  /** Abort the translation at the first structural fault. */
  STRICT
}
