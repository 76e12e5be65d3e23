package kala.source;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import org.jooq.lambda.Seq;

/** Source provider: the complete text of one Kala file, split into logical lines. */
public class SourceText implements Iterable<SourceLine> {

  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r\n|\r|\n");

  private final ImmutableList<SourceLine> lines;

  private SourceText(ImmutableList<SourceLine> lines) {
    this.lines = lines;
  }

  public static SourceText of(String text) {
    List<String> raw = LINE_SPLITTER.splitToList(text);
    if (!raw.isEmpty() && raw.get(raw.size() - 1).isEmpty()) {
      // a terminating line break does not start another line
      raw = raw.subList(0, raw.size() - 1);
    }
    return new SourceText(
        Seq.seq(raw)
            .zipWithIndex()
            .map(t -> new SourceLine((int) (long) t.v2 + 1, t.v1))
            .collect(ImmutableList.toImmutableList()));
  }

  public static SourceText read(InputStream in) throws IOException {
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return of(CharStreams.toString(reader));
    }
  }

  public List<SourceLine> lines() {
    return lines;
  }

  /** The raw lines, as needed for source excerpts in error messages. */
  public List<String> rawLines() {
    return Seq.seq(lines).map(l -> l.raw).toList();
  }

  public int size() {
    return lines.size();
  }

  @Override
  public Iterator<SourceLine> iterator() {
    return lines.iterator();
  }
}
