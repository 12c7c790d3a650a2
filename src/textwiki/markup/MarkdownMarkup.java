package textwiki.markup;

import com.vladsch.flexmark.ext.autolink.AutolinkExtension;
import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;

import java.util.Arrays;

/**
 * Markdown pages ({@code .md}) rendered with flexmark.
 */
public final class MarkdownMarkup implements Markup {
  public static final String NAME = "markdown";
  public static final String EXTENSION = ".md";

  private final Parser parser;
  private final HtmlRenderer renderer;

  public MarkdownMarkup() {
    MutableDataSet options = new MutableDataSet()
      .set(Parser.EXTENSIONS, Arrays.asList(
        TablesExtension.create(),
        StrikethroughExtension.create(),
        AutolinkExtension.create()
      ));
    this.parser = Parser.builder(options).build();
    this.renderer = HtmlRenderer.builder(options).build();
  }

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
    Node document = parser.parse(header.body());
    return new Rendered(renderer.render(document), header.body(), header.metadata());
  }
}
