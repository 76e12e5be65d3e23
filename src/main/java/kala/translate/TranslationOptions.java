package kala.translate;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Knobs of a single translation. Instances are immutable. */
public class TranslationOptions {
  public static final TranslationOptions DEFAULT =
      new TranslationOptions(FaultPolicy.LENIENT, null);

  public final FaultPolicy faultPolicy;
  /** Emitted as a {@code .file} directive, which helps debuggers. */
  public final Optional<String> fileName;

  private TranslationOptions(FaultPolicy faultPolicy, @Nullable String fileName) {
    this.faultPolicy = checkNotNull(faultPolicy);
    this.fileName = Optional.ofNullable(fileName);
  }

  public TranslationOptions withFaultPolicy(FaultPolicy faultPolicy) {
    return new TranslationOptions(faultPolicy, fileName.orElse(null));
  }

  public TranslationOptions withFileName(@Nullable String fileName) {
    return new TranslationOptions(faultPolicy, fileName);
  }
}
