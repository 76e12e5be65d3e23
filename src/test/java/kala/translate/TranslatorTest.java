package kala.translate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.fail;

import com.google.common.base.Joiner;
import kala.source.SourceText;
import org.junit.Before;
import org.junit.Test;

public class TranslatorTest {

  private Translator translator;

  @Before
  public void setup() {
    translator = new Translator();
  }

  private static String program(String... lines) {
    return Joiner.on('\n').join(lines);
  }

  private TranslationResult translate(String... lines) {
    return translator.translate(SourceText.of(program(lines)));
  }

  @Test
  public void listDeclaration_dataWithExactlyTheElements() throws Exception {
    TranslationResult result = translate("list nums = [1, 2, 3]");

    assertThat(result.assembly, is("nums: .data 1, 2, 3\n"));
    assertThat(result.diagnostics, is(empty()));
  }

  @Test
  public void ifWithPrint_jumpsOverBodyToFreshLabel() throws Exception {
    TranslationResult result = translate("if x {", "print \"a\"", "}", "if y {", "}");

    assertThat(
        result.assembly,
        is(
            program(
                "cmp x, 0",
                "je else_0",
                "mov $1, %rax",
                "mov $1, %rdi",
                "lea a, %rsi",
                "syscall",
                "else_0:",
                "cmp y, 0",
                "je else_1",
                "else_1:",
                "")));
  }

  @Test
  public void forLoop_initTestBodyBackEdgeExit() throws Exception {
    TranslationResult result = translate("for i in range(0, 5) {", "print \"x\"", "}");

    assertThat(
        result.assembly,
        is(
            program(
                "mov 0, %i",
                "for_0:",
                "cmp %i, 5",
                "jge end_for_0",
                "mov $1, %rax",
                "mov $1, %rdi",
                "lea x, %rsi",
                "syscall",
                "jmp for_0",
                "end_for_0:",
                "")));
  }

  @Test
  public void nestedConstructs_closeInnermostFirst() throws Exception {
    TranslationResult result =
        translate(
            "# a small program",
            "class Main {",
            "  method run {",
            "    while n {",
            "      for i in range(0, n) {",
            "        if i {",
            "          print \"hi\"",
            "        }",
            "      }",
            "    }",
            "  }",
            "}");

    assertThat(
        result.assembly,
        is(
            program(
                "; Start of class Main",
                "; Start of method run",
                "while_0:",
                "cmp n, 0",
                "je end_while_0",
                "mov 0, %i",
                "for_1:",
                "cmp %i, n",
                "jge end_for_1",
                "cmp i, 0",
                "je else_2",
                "mov $1, %rax",
                "mov $1, %rdi",
                "lea hi, %rsi",
                "syscall",
                "else_2:",
                "jmp for_1",
                "end_for_1:",
                "jmp while_0",
                "end_while_0:",
                "; End of method run",
                "; End of class Main",
                "")));
    assertThat(result.diagnostics, is(empty()));
    assertThat(result.blocksOpened, is(5));
    assertThat(result.blocksClosed, is(5));
  }

  @Test
  public void loneClosingBrace_exactlyOneStructuralFault() throws Exception {
    TranslationResult result = translate("}");

    assertThat(result.assembly, is(""));
    assertThat(result.diagnostics, hasSize(1));
    assertThat(result.count(Diagnostic.Kind.STRUCTURAL_FAULT), is(1L));
  }

  @Test
  public void extraClosingBrace_outputOfTheRestUnaffected() throws Exception {
    TranslationResult result = translate("list a = [1]", "}", "list b = [2]");

    assertThat(result.assembly, is("a: .data 1\nb: .data 2\n"));
    assertThat(result.structuralFaults(), hasSize(1));
    assertThat(result.structuralFaults().get(0).line(), is(2));
  }

  @Test
  public void unclosedBlocks_reportedOutermostFirst() throws Exception {
    TranslationResult result = translate("class A {", "while x {");

    assertThat(result.structuralFaults(), hasSize(2));
    assertThat(result.structuralFaults().get(0).line(), is(1));
    assertThat(
        result.structuralFaults().get(0).message(), containsString("class A is never closed"));
    assertThat(result.structuralFaults().get(1).line(), is(2));
    assertThat(
        result.structuralFaults().get(1).message(), containsString("while loop is never closed"));
    assertThat(result.assembly, is("; Start of class A\nwhile_0:\ncmp x, 0\nje end_while_0\n"));
    assertThat(result.blocksOpened, is(2));
    assertThat(result.blocksClosed, is(0));
  }

  @Test
  public void parseError_statementDroppedAndTranslationContinues() throws Exception {
    TranslationResult result = translate("list = [1]", "print \"ok\"");

    assertThat(result.count(Diagnostic.Kind.PARSE_ERROR), is(1L));
    assertThat(result.count(Diagnostic.Kind.STRUCTURAL_FAULT), is(0L));
    assertThat(result.assembly, startsWith("mov $1, %rax\n"));
  }

  @Test
  public void rejectedHeader_itsClosingBraceBecomesAFault() throws Exception {
    TranslationResult result = translate("if x", "}");

    assertThat(result.count(Diagnostic.Kind.PARSE_ERROR), is(1L));
    assertThat(result.count(Diagnostic.Kind.STRUCTURAL_FAULT), is(1L));
    assertThat(result.assembly, is(""));
  }

  @Test
  public void listNamedLikeALabel_rejectedSoEveryTargetIsDefinedOnce() throws Exception {
    TranslationResult result = translate("list else_0 = [1]", "if x {", "}");

    assertThat(result.count(Diagnostic.Kind.PARSE_ERROR), is(1L));
    assertThat(result.diagnostics.get(0).line(), is(1));
    assertThat(result.assembly, is("cmp x, 0\nje else_0\nelse_0:\n"));
  }

  @Test
  public void unrecognizedLine_keptAsComment() throws Exception {
    TranslationResult result = translate("return 0");

    assertThat(result.assembly, is("; return 0 (unrecognized syntax)\n"));
    assertThat(result.hasDiagnostics(), is(false));
  }

  @Test
  public void windowsLineEndings_sameOutput() throws Exception {
    String unix = translator.translate(SourceText.of("if a {\nprint \"b\"\n}\n")).assembly;
    String windows = translator.translate(SourceText.of("if a {\r\nprint \"b\"\r\n}\r\n")).assembly;

    assertThat(windows, is(unix));
  }

  @Test
  public void translateTwice_identicalOutput() throws Exception {
    SourceText source = SourceText.of(program("while a {", "if b {", "}", "}"));

    assertThat(translator.translate(source).assembly, is(translator.translate(source).assembly));
  }

  @Test
  public void fileName_emittedAsFileDirective() throws Exception {
    Translator named = new Translator(TranslationOptions.DEFAULT.withFileName("hello.kala"));

    String assembly = named.translate(SourceText.of("list a = []")).assembly;

    assertThat(assembly, is(".file \"hello.kala\"\na: .data\n"));
  }

  @Test
  public void strictPolicy_abortsAtStrayBrace() throws Exception {
    Translator strict =
        new Translator(TranslationOptions.DEFAULT.withFaultPolicy(FaultPolicy.STRICT));
    try {
      strict.translate(SourceText.of(program("list = [1]", "}", "}")));
      fail("strict translation went on after a structural fault");
    } catch (TranslationAborted e) {
      assertThat(e.diagnostics, hasSize(2));
      assertThat(e.diagnostics.get(1).kind, is(Diagnostic.Kind.STRUCTURAL_FAULT));
      assertThat(e.diagnostics.get(1).line(), is(2));
    }
  }

  @Test
  public void strictPolicy_abortsOnUnclosedBlock() throws Exception {
    Translator strict =
        new Translator(TranslationOptions.DEFAULT.withFaultPolicy(FaultPolicy.STRICT));
    try {
      strict.translate(SourceText.of("method m {"));
      fail("strict translation accepted an unclosed block");
    } catch (TranslationAborted e) {
      assertThat(e.getMessage(), containsString("method m is never closed"));
    }
  }

  @Test
  public void strictPolicy_parseErrorsDoNotAbort() throws Exception {
    Translator strict =
        new Translator(TranslationOptions.DEFAULT.withFaultPolicy(FaultPolicy.STRICT));

    TranslationResult result = strict.translate(SourceText.of(program("print", "print 1")));

    assertThat(result.count(Diagnostic.Kind.PARSE_ERROR), is(1L));
    assertThat(result.assembly, not(is("")));
  }
}
