package textwiki.markup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A markup dialect: file extension, metadata line format and the raw text to HTML pipeline.
 */
public interface Markup {
  String CONTINUATION_INDENT = "    ";

  /**
   * Registry name, for example {@code markdown}.
   */
  String name();

  /**
   * File suffix of pages in this dialect, including the dot.
   */
  String extension();

  /**
   * Format string taking the key and one value.
   */
  default String metaLineTemplate() {
    return "%s: %s";
  }

  /**
   * Header lines for one key, without line terminators. The first value goes on the key line and
   * each further value on its own indented continuation line. A value holding line breaks takes
   * one line per text line.
   */
  default List<String> metaLines(String key, List<String> values) {
    List<String> split = new ArrayList<>();
    for (String value : values) {
      split.addAll(Arrays.asList(value.split("\\r\\n|\\r|\\n", -1)));
    }
    List<String> lines = new ArrayList<>();
    if (split.isEmpty()) {
      lines.add(String.format(metaLineTemplate(), key, ""));
      return lines;
    }
    lines.add(String.format(metaLineTemplate(), key, split.get(0)));
    for (int i = 1; i < split.size(); i++) {
      lines.add(CONTINUATION_INDENT + split.get(i));
    }
    return lines;
  }

  /**
   * Splits the metadata header from the raw text and renders the body.
   */
  Rendered process(String raw);
}
