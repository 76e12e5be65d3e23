package kala.translate;

import com.google.common.base.Joiner;
import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import java.util.stream.IntStream;
import kala.block.LabelAllocator;
import org.jooq.lambda.Seq;

/**
 * Generates random programs in which every statement is well-formed and every opened block is
 * closed again. Nesting is bounded by {@link #MAX_DEPTH}.
 */
public class KalaProgramGenerator extends Generator<GeneratedProgram> {
  private static final int MAX_DEPTH = 5;

  public KalaProgramGenerator() {
    super(GeneratedProgram.class);
  }

  @Override
  public GeneratedProgram generate(SourceOfRandomness random, GenerationStatus status) {
    GeneratedProgram program = new GeneratedProgram();
    int statements = random.nextInt(1, 10);
    for (int i = 0; i < statements; ++i) {
      statement(program, 0, random);
    }
    return program;
  }

  private static void statement(GeneratedProgram program, int depth, SourceOfRandomness random) {
    int kinds = depth < MAX_DEPTH ? 8 : 3;
    switch (random.nextInt(0, kinds - 1)) {
      case 0:
        program.line(depth, "print \"" + message(random) + "\"");
        break;
      case 1:
        program.line(depth, "list " + identifier(random) + " = [" + elements(random) + "]");
        break;
      case 2:
        program.line(depth, random.nextBoolean() ? "# " + message(random) : "");
        break;
      case 3:
        block(program, depth, "class " + identifier(random) + " {", random);
        break;
      case 4:
        block(program, depth, "method " + identifier(random) + " {", random);
        break;
      case 5:
        program.ifs++;
        block(program, depth, "if " + condition(random) + " {", random);
        break;
      case 6:
        program.loops++;
        block(program, depth, "while " + condition(random) + " {", random);
        break;
      default:
        program.loops++;
        String header =
            String.format(
                "for %s in range(%s, %s) {",
                identifier(random), bound(random), bound(random));
        block(program, depth, header, random);
        break;
    }
  }

  private static void block(
      GeneratedProgram program, int depth, String header, SourceOfRandomness random) {
    program.blocks++;
    program.line(depth, header);
    int statements = random.nextInt(0, 3);
    for (int i = 0; i < statements; ++i) {
      statement(program, depth + 1, random);
    }
    program.line(depth, "}");
  }

  private static String identifier(SourceOfRandomness random) {
    StringBuilder id;
    do {
      id = new StringBuilder();
      id.append(random.choose(IDENT_FIRST_CHARS));
      Seq.generate(() -> random.choose(IDENT_FOLLOWING_CHARS))
          .limit(random.nextInt(0, 8))
          .forEach(id::append);
    } while (LabelAllocator.isReserved(id.toString()));
    return id.toString();
  }

  private static String condition(SourceOfRandomness random) {
    if (random.nextBoolean()) {
      return identifier(random);
    }
    return identifier(random) + " " + random.choose(COMPARISONS) + " " + bound(random);
  }

  private static String bound(SourceOfRandomness random) {
    return random.nextBoolean() ? identifier(random) : Integer.toString(random.nextInt(0, 1000));
  }

  private static String elements(SourceOfRandomness random) {
    return Joiner.on(", ")
        .join(Seq.generate(() -> bound(random)).limit(random.nextInt(0, 5)).toList());
  }

  private static String message(SourceOfRandomness random) {
    return Joiner.on(' ')
        .join(Seq.generate(() -> identifier(random)).limit(random.nextInt(1, 4)).toList());
  }

  private static final String[] COMPARISONS = {"<", "<=", "==", "!=", ">", ">="};

  private static final Character[] IDENT_FIRST_CHARS =
      IntStream.concat(
              IntStream.of('_'),
              IntStream.concat(IntStream.rangeClosed('A', 'Z'), IntStream.rangeClosed('a', 'z')))
          .mapToObj(c -> (char) c)
          .toArray(Character[]::new);

  private static final Character[] IDENT_FOLLOWING_CHARS =
      IntStream.concat(
              IntStream.of('_'),
              IntStream.concat(
                  IntStream.rangeClosed('A', 'Z'),
                  IntStream.concat(
                      IntStream.rangeClosed('a', 'z'), IntStream.rangeClosed('0', '9'))))
          .mapToObj(c -> (char) c)
          .toArray(Character[]::new);
}
