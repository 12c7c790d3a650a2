package textwiki.markup;

import textwiki.page.Metadata;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the metadata header that opens every page file.
 * <pre>
 * title: Home
 * tags: intro, start
 *
 * body text...
 * </pre>
 * Exactly one space after the colon and exactly four spaces of continuation indent belong to the
 * format; everything after them is value text, kept as is. A line indented by four or more
 * spaces adds another value to the key above it, so a line of only those four spaces is an empty
 * value. The header stops at the first empty line, which is dropped, or at the first line that
 * is not a header line, which stays in the body. A whitespace-only line that is not a
 * continuation also ends the header.
 */
public final class MetaHeader {
  private static final Pattern KEY_LINE = Pattern.compile("^[ ]{0,3}(" + Metadata.KEY.pattern() + "):(.*)$");
  private static final Pattern MORE_LINE = Pattern.compile("^" + Markup.CONTINUATION_INDENT + "(.*)$");

  private final Metadata metadata;
  private final String body;

  private MetaHeader(Metadata metadata, String body) {
    this.metadata = metadata;
    this.body = body;
  }

  public Metadata metadata() {
    return metadata;
  }

  public String body() {
    return body;
  }

  public static MetaHeader parse(String raw) {
    Metadata metadata = new Metadata();
    String text = normalizeNewlines(raw == null ? "" : raw);
    int pos = 0;
    String lastKey = null;
    while (pos < text.length()) {
      int end = text.indexOf('\n', pos);
      int next = end < 0 ? text.length() : end + 1;
      String line = end < 0 ? text.substring(pos) : text.substring(pos, end);
      if (line.isEmpty()) {
        pos = next;
        break;
      }
      Matcher key = KEY_LINE.matcher(line);
      if (key.matches()) {
        lastKey = key.group(1);
        String value = key.group(2);
        metadata.add(lastKey, value.startsWith(" ") ? value.substring(1) : value);
        pos = next;
        continue;
      }
      Matcher more = MORE_LINE.matcher(line);
      if (lastKey != null && more.matches()) {
        metadata.add(lastKey, more.group(1));
        pos = next;
        continue;
      }
      if (line.trim().isEmpty()) {
        pos = next;
      }
      break;
    }
    return new MetaHeader(metadata, text.substring(Math.min(pos, text.length())));
  }

  /**
   * Writes keys in lexicographic order, one blank separator line, then the body with its line
   * endings converted to {@code lineSeparator}.
   */
  public static String serialize(Markup markup, Metadata metadata, String body, String lineSeparator) {
    StringBuilder out = new StringBuilder();
    for (String key : metadata.sortedKeys()) {
      for (String line : markup.metaLines(key, metadata.getAll(key))) {
        out.append(line).append(lineSeparator);
      }
    }
    out.append(lineSeparator);
    out.append(normalizeNewlines(body == null ? "" : body).replace("\n", lineSeparator));
    return out.toString();
  }

  public static String serialize(Markup markup, Metadata metadata, String body) {
    return serialize(markup, metadata, body, System.lineSeparator());
  }

  static String normalizeNewlines(String text) {
    return text.replace("\r\n", "\n").replace('\r', '\n');
  }
}
