package kala;

import java.io.IOException;
import java.io.InputStream;
import kala.source.SourceText;
import kala.translate.TranslationOptions;
import kala.translate.TranslationResult;
import kala.translate.Translator;

public class Compiler {

  public static SourceText read(InputStream in) throws IOException {
    return SourceText.read(in);
  }

  public static TranslationResult translate(SourceText source, TranslationOptions options) {
    return new Translator(options).translate(source);
  }

  public static TranslationResult translate(String source) {
    return translate(SourceText.of(source), TranslationOptions.DEFAULT);
  }
}
