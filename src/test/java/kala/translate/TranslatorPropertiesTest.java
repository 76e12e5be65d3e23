package kala.translate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.in;
import static org.hamcrest.Matchers.is;

import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;
import java.util.List;
import java.util.Set;
import kala.backend.instructions.Instruction;
import kala.backend.instructions.Jcc;
import kala.backend.instructions.Jmp;
import kala.backend.instructions.Label;
import kala.source.SourceText;
import org.jooq.lambda.Seq;
import org.junit.runner.RunWith;

@RunWith(JUnitQuickcheck.class)
public class TranslatorPropertiesTest {

  private static TranslationResult translate(GeneratedProgram program) {
    return new Translator().translate(SourceText.of(program.source()));
  }

  private static List<String> definedLabels(List<Instruction> instructions) {
    return Seq.seq(instructions).ofType(Label.class).map(l -> l.label).toList();
  }

  private static List<String> jumpTargets(List<Instruction> instructions) {
    return Seq.seq(instructions)
        .ofType(Jmp.class)
        .map(j -> j.label)
        .concat(Seq.seq(instructions).ofType(Jcc.class).map(j -> j.label))
        .toList();
  }

  @Property(trials = 200)
  public void wellFormedProgram_noDiagnosticsAndBalancedBlocks(
      @From(KalaProgramGenerator.class) GeneratedProgram program) {
    TranslationResult result = translate(program);

    assertThat(result.diagnostics, is(empty()));
    assertThat(result.blocksOpened, is(program.blocks));
    assertThat(result.blocksClosed, is(program.blocks));
  }

  @Property(trials = 200)
  public void labelsPairwiseDistinctAndEveryJumpHasATarget(
      @From(KalaProgramGenerator.class) GeneratedProgram program) {
    TranslationResult result = translate(program);

    List<String> defined = definedLabels(result.instructions);
    Set<String> distinct = Seq.seq(defined).toSet();
    assertThat(distinct.size(), is(defined.size()));
    assertThat(jumpTargets(result.instructions), everyItem(is(in(distinct))));
  }

  @Property(trials = 200)
  public void oneLabelPerIfTwoPerLoop(
      @From(KalaProgramGenerator.class) GeneratedProgram program) {
    TranslationResult result = translate(program);

    assertThat(definedLabels(result.instructions).size(), is(program.ifs + 2 * program.loops));
  }

  @Property(trials = 100)
  public void translatingTwice_sameAssembly(
      @From(KalaProgramGenerator.class) GeneratedProgram program) {
    assertThat(translate(program).assembly, is(translate(program).assembly));
  }
}
