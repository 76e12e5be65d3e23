package kala;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Joiner;
import com.google.common.collect.ObjectArrays;
import com.google.common.io.ByteStreams;
import com.google.common.primitives.Booleans;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import kala.source.SourceText;
import kala.translate.Diagnostic;
import kala.translate.FaultPolicy;
import kala.translate.TranslationOptions;
import kala.translate.TranslationResult;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.impl.SimpleLogger;

public class Cli {

  static final String SOURCE_EXTENSION = ".kala";
  static final String ASSEMBLY_EXTENSION = ".s";

  static final String usage =
      Joiner.on(System.lineSeparator())
          .join(
              ObjectArrays.concat(
                  new String[] {
                    "Usage: kalac [--echo|--print-asm] [--strict] [--force] [--help] [--verbosity] file.kala [file.s]",
                    "",
                    "  --echo          write file's content to stdout",
                    "  --print-asm     translate the given file and write the assembly to stdout",
                    "  --strict        abort on the first mismatched or unclosed block",
                    "  --force         overwrite the output file if it exists",
                    "  --verbosity|-v  Crank this up for more debug output",
                    "  --help          display this help and exit",
                    "",
                    "  If no flag is given, file.kala is translated to file.s, or to the given output file.",
                    "",
                    "Environment variables:"
                  },
                  EnvVar.getAllEnvVarDescriptions(),
                  String.class));

  private final PrintStream out;
  private final PrintStream err;
  private final FileSystem fileSystem;

  Cli(OutputStream out, OutputStream err, FileSystem fileSystem) {
    this.out = new PrintStream(out);
    this.err = new PrintStream(err);
    this.fileSystem = fileSystem;
  }

  int run(String... args) {
    Parameters params = Parameters.parse(args);
    setLogLevel(params.verbosity);
    if (!params.valid()) {
      err.println("Called as: " + String.join(" ", args));
      err.println(usage);
      return 1;
    }
    if (params.help) {
      out.println(usage);
      return 0;
    }
    Path input = fileSystem.getPath(params.inputFile());
    try {
      if (params.echo) {
        echo(input);
        return 0;
      }
      if (!Files.exists(input)) {
        throw new NoSuchFileException(input.toString());
      }
      if (!input.toString().endsWith(SOURCE_EXTENSION)) {
        err.println("error: input file '" + input + "' must have a .kala extension");
        return 1;
      }
      TranslationOptions options = options(params);
      if (params.printAsm) {
        return printAsm(input, options);
      }
      return translate(input, params.outputFile(input, fileSystem), params.force, options);
    } catch (AccessDeniedException e) {
      err.println("error: access to file '" + e.getFile() + "' was denied");
      return 1;
    } catch (KalaError e) {
      try {
        err.println("error: " + e.getSourceReferencingMessage(Files.readAllLines(input)));
      } catch (IOException io) {
        err.println("error: " + e.getMessage());
      }
      return 1;
    } catch (NoSuchFileException e) {
      err.println("error: file '" + e.getFile() + "' doesn't exist");
      return 1;
    } catch (Throwable t) {
      // print full stacktrace for any other error
      // if a better description becomes necessary,
      // add a another more specific catch block
      t.printStackTrace(err);
      return 1;
    } finally {
      out.flush();
      err.flush();
    }
  }

  private void setLogLevel(int verbosity) {
    verbosity = Math.max(0, verbosity);
    verbosity = Math.min(Level.values().length - 1, verbosity);
    // only effective as long as no logger was created yet
    String level = Level.values()[verbosity].toString();
    System.setProperty(SimpleLogger.DEFAULT_LOG_LEVEL_KEY, level);
  }

  private static TranslationOptions options(Parameters params) {
    boolean strict = params.strict || EnvVar.KALA_STRICT.isSetToOne();
    TranslationOptions options =
        TranslationOptions.DEFAULT.withFaultPolicy(
            strict ? FaultPolicy.STRICT : FaultPolicy.LENIENT);
    if (EnvVar.KALA_FILENAME.isAvailable()) {
      options = options.withFileName(EnvVar.KALA_FILENAME.value());
    }
    return options;
  }

  private void echo(Path input) throws IOException {
    try (InputStream in = Files.newInputStream(input)) {
      ByteStreams.copy(in, out);
    }
  }

  private int printAsm(Path input, TranslationOptions options) throws IOException {
    SourceText source = read(input);
    TranslationResult result = Compiler.translate(source, options);
    out.print(result.assembly);
    reportDiagnostics(source, result);
    return 0;
  }

  private int translate(Path input, Path output, boolean force, TranslationOptions options)
      throws IOException {
    if (!output.toString().endsWith(ASSEMBLY_EXTENSION)) {
      err.println("error: output file '" + output + "' must have a .s extension");
      return 1;
    }
    if (!force && Files.exists(output)) {
      err.println("error: output file '" + output + "' already exists");
      return 1;
    }
    SourceText source = read(input);
    TranslationResult result = Compiler.translate(source, options);
    OpenOption[] openOptions =
        force
            ? new OpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING}
            : new OpenOption[] {StandardOpenOption.CREATE_NEW};
    try {
      Files.write(output, result.assembly.getBytes(StandardCharsets.UTF_8), openOptions);
    } catch (FileAlreadyExistsException e) {
      err.println("error: output file '" + output + "' already exists");
      return 1;
    }
    reportDiagnostics(source, result);
    LoggerFactory.getLogger("kalac").info("Compilation successful: {}", output);
    return 0;
  }

  private static SourceText read(Path input) throws IOException {
    try (InputStream in = Files.newInputStream(input)) {
      return Compiler.read(in);
    }
  }

  private void reportDiagnostics(SourceText source, TranslationResult result) {
    if (!result.hasDiagnostics()) {
      return;
    }
    List<String> lines = source.rawLines();
    for (Diagnostic diagnostic : result.diagnostics) {
      err.println("warning: " + diagnostic.getSourceReferencingMessage(lines));
    }
    err.println(result.diagnostics.size() + " diagnostic(s)");
  }

  private static class Parameters {
    private Parameters() {}

    /** True if the --echo option was set */
    @Parameter(names = "--echo")
    boolean echo;

    /** True if the --print-asm option was set */
    @Parameter(names = "--print-asm")
    boolean printAsm;

    /** True if the --strict option was set */
    @Parameter(names = "--strict")
    boolean strict;

    /** True if the --force option was set */
    @Parameter(names = "--force")
    boolean force;

    @Parameter(names = {"--verbosity", "-v"})
    Integer verbosity = 0;

    /** True if the --help option was set */
    @Parameter(names = "--help")
    boolean help;

    @SuppressWarnings("MismatchedQueryAndUpdateOfCollection")
    @Parameter
    private List<String> mainParameters = new ArrayList<>();

    // set to true, if parsing arguments failed
    private boolean invalid;

    /** The path of the file to translate, possibly relative to the current working directory */
    String inputFile() {
      return mainParameters.get(0);
    }

    /** The explicitly given output file, or the input file with its extension replaced by .s */
    Path outputFile(Path input, FileSystem fileSystem) {
      if (mainParameters.size() > 1) {
        return fileSystem.getPath(mainParameters.get(1));
      }
      String name = input.toString();
      return fileSystem.getPath(
          name.substring(0, name.length() - SOURCE_EXTENSION.length()) + ASSEMBLY_EXTENSION);
    }

    /** Returns true if the parameter values represent a valid set */
    boolean valid() {
      return !invalid
          && (help
              || (Booleans.countTrue(echo, printAsm) <= 1
                  && !mainParameters.isEmpty()
                  && mainParameters.size() <= ((echo || printAsm) ? 1 : 2)));
    }

    static Parameters parse(String... args) {
      Parameters params = new Parameters();
      try {
        JCommander.newBuilder().addObject(params).build().parse(args);
      } catch (ParameterException e) {
        params.invalid = true;
      }
      return params;
    }
  }
}
