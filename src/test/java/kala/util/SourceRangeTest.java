package kala.util;

import static kala.util.SourceRange.onLine;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsEqual.equalTo;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

@RunWith(Parameterized.class)
public class SourceRangeTest {
  private final String sourceFile;
  private final SourceRange range;
  private final String expectedAnnotation;

  public SourceRangeTest(String sourceFile, SourceRange range, String expectedAnnotation) {
    this.sourceFile = sourceFile;
    this.range = range;
    this.expectedAnnotation = expectedAnnotation;
  }

  private static String f(String s) {
    return String.format(s);
  }

  @Parameterized.Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(
        new Object[][] {
          {"single line", onLine(1, 2, 4), f("1| single line%n     ^^^^%n")},
          {"    list nums [1]", onLine(1, 14, 1), f("1|     list nums [1]%n                 ^%n")},
          {"while x", onLine(1, 7, 1), f("1| while x%n          ^%n")},
          {"if x", onLine(1, 4, 0), f("1| if x%n       ^%n")},
          {f("class A {%n  }}"), onLine(2, 2, 2), f("2|   }}%n     ^^%n")},
          {
            f("1%n2%n3%n4%n5%n6%n7%n8%n9%nprint x"),
            onLine(10, 6, 1),
            f("10| print x%n          ^%n")
          },
          {"only one line", onLine(3, 0, 1), ""},
        });
  }

  @Test
  public void annotateSourceFileExcerpt_correctAnnotations() {
    String[] lines = sourceFile.split("\\R");

    String actualAnnotation = range.annotateSourceFileExcerpt(Arrays.asList(lines));

    assertThat(actualAnnotation, is(equalTo(expectedAnnotation)));
  }
}
