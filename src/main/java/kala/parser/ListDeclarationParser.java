package kala.parser;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import kala.backend.Fragment;
import kala.backend.instructions.DataDeclaration;
import kala.block.LabelAllocator;
import kala.source.SourceLine;

/**
 * {@code list <name> = [<e1>, <e2>, ...]}. Elements are taken verbatim; a list declaration opens
 * no block.
 */
public class ListDeclarationParser implements ConstructParser {
  private static final CharMatcher BRACKETS = CharMatcher.anyOf("[]");
  private static final Splitter ELEMENTS = Splitter.on(',').trimResults();

  @Override
  public Fragment parse(SourceLine line, TranslationState state) {
    LineScanner scanner = new LineScanner(line, "list declaration");
    scanner.expectKeyword("list");
    int nameBegin = scanner.position();
    String name = scanner.identifier("list name");
    if (LabelAllocator.isReserved(name)) {
      throw scanner.error(
          nameBegin, scanner.position(), "list name '" + name + "' is reserved for labels");
    }
    scanner.skipWhitespace();
    scanner.expect('=');
    scanner.skipWhitespace();
    scanner.expect('[');
    int elementsBegin = scanner.position();
    String elements = scanner.upTo(BRACKETS);
    if (elements == null || line.text.charAt(scanner.position()) != ']') {
      throw scanner.error(elementsBegin - 1, elementsBegin, "unbalanced brackets");
    }
    scanner.expect(']');
    scanner.expectEnd();
    return Fragment.of(new DataDeclaration(name, splitElements(elements, scanner, elementsBegin)));
  }

  private static List<String> splitElements(
      String elements, LineScanner scanner, int elementsBegin) {
    List<String> result = new ArrayList<>();
    if (elements.isEmpty()) {
      return result;
    }
    for (String element : ELEMENTS.split(elements)) {
      if (element.isEmpty()) {
        throw scanner.error(elementsBegin, scanner.position(), "empty list element");
      }
      result.add(element);
    }
    return result;
  }
}
