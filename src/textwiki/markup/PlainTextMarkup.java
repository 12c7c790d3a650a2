package textwiki.markup;

/**
 * Plain text pages ({@code .txt}), shown preformatted.
 */
public final class PlainTextMarkup implements Markup {
  public static final String NAME = "text";
  public static final String EXTENSION = ".txt";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String extension() {
    return EXTENSION;
  }

  @Override
  public Rendered process(String raw) {
    MetaHeader header = MetaHeader.parse(raw);
    String html = "<pre class=\"textwiki-plain\">" + escapeHtml(header.body()) + "</pre>";
    return new Rendered(html, header.body(), header.metadata());
  }

  static String escapeHtml(String value) {
    StringBuilder out = new StringBuilder(value.length() + 16);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '<':
          out.append("&lt;");
          break;
        case '>':
          out.append("&gt;");
          break;
        case '&':
          out.append("&amp;");
          break;
        case '"':
          out.append("&quot;");
          break;
        default:
          out.append(c);
      }
    }
    return out.toString();
  }
}
