package textwiki.markup;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class MarkdownMarkupTest {
  private final Markup markup = new MarkdownMarkup();

  @Test
  public void rendersBodyWithoutHeader() {
    Rendered rendered = markup.process("title: Home\ntags: intro, start\n\nHello *world*.");
    assertThat(rendered.html(), containsString("<em>world</em>"));
    assertThat(rendered.html(), not(containsString("title")));
    assertThat(rendered.body(), is("Hello *world*."));
    assertThat(rendered.metadata().text("title"), is("Home"));
  }

  @Test
  public void rendersTablesAndStrikethrough() {
    Rendered rendered = markup.process("title: T\n\n| a | b |\n|---|---|\n| 1 | 2 |\n\n~~gone~~");
    assertThat(rendered.html(), containsString("<table>"));
    assertThat(rendered.html(), containsString("<del>gone</del>"));
  }

  @Test
  public void usesMarkdownExtension() {
    assertThat(markup.extension(), is(".md"));
    assertThat(markup.name(), is("markdown"));
  }
}
