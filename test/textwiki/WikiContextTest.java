package textwiki;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import textwiki.config.WikiConfig;
import textwiki.markup.PlainTextMarkup;
import textwiki.page.Page;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(VertxExtension.class)
public class WikiContextTest {
  @TempDir
  public Path tempDir;

  @Test
  public void wiresConfiguredMarkupIntoPages(Vertx vertx) {
    WikiConfig config = new WikiConfig(tempDir.toString(), "text", 0L);
    WikiContext context = WikiContext.create(vertx, config);
    assertTrue(context.markup() instanceof PlainTextMarkup);
    assertEquals(tempDir.resolve("notes.txt").toAbsolutePath().normalize(), context.pages().path("notes"));

    Page page = context.pages().getBare("notes").get();
    page.setTitle("Notes");
    page.setBody("<raw>");
    page.save();
    assertEquals("<pre class=\"textwiki-plain\">&lt;raw&gt;</pre>", context.pages().get("notes").cachedHtml());
    context.close();
    assertEquals(vertx, context.vertx());
  }

  @Test
  public void unknownMarkupFails(Vertx vertx) {
    WikiConfig config = new WikiConfig(tempDir.toString(), "wikicreole", 0L);
    assertThrows(IllegalArgumentException.class, () -> WikiContext.create(vertx, config));
  }

  @Test
  public void failedCreateClosesOwnedVertx() throws Exception {
    Vertx owned = Vertx.vertx();
    CountDownLatch stopped = new CountDownLatch(1);
    owned.deployVerticle(new AbstractVerticle() {
      @Override
      public void stop() {
        stopped.countDown();
      }
    }).toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);

    WikiConfig config = new WikiConfig(tempDir.toString(), "wikicreole", 0L);
    assertThrows(IllegalArgumentException.class, () -> WikiContext.owning(owned, config));
    assertTrue(stopped.await(5, TimeUnit.SECONDS));
  }
}
