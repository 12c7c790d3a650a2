package textwiki.markup;

import textwiki.page.Metadata;

/**
 * Output of one {@link Markup#process(String)} pass over a raw page text.
 */
public final class Rendered {
  private final String html;
  private final String body;
  private final Metadata metadata;

  public Rendered(String html, String body, Metadata metadata) {
    this.html = html;
    this.body = body;
    this.metadata = metadata;
  }

  public String html() {
    return html;
  }

  public String body() {
    return body;
  }

  public Metadata metadata() {
    return metadata;
  }
}
