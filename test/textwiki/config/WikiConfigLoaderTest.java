package textwiki.config;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

@ExtendWith(VertxExtension.class)
public class WikiConfigLoaderTest {
  @TempDir
  public Path tempDir;

  @Test
  public void fileOverridesFallback(Vertx vertx) throws Exception {
    Path file = tempDir.resolve("textwiki-config.json");
    JsonObject json = new JsonObject()
      .put("rootPath", "/srv/wiki")
      .put("markup", "text")
      .put("cacheTtlMillis", 5000L);
    Files.write(file, json.encode().getBytes(StandardCharsets.UTF_8));

    WikiConfig config = WikiConfigLoader.load(vertx, file.toString(), WikiConfig.defaults());
    assertEquals("/srv/wiki", config.rootPath());
    assertEquals("text", config.markup());
    assertEquals(5000L, config.cacheTtlMillis());
  }

  @Test
  public void missingFileKeepsFallback(Vertx vertx) {
    WikiConfig fallback = new WikiConfig("pages", "markdown", 0L);
    WikiConfig config = WikiConfigLoader.load(vertx, tempDir.resolve("absent.json").toString(), fallback);
    assertEquals("markdown", config.markup());
    assertEquals(0L, config.cacheTtlMillis());
  }

  @Test
  public void environmentNamesMapOntoKeys() {
    JsonObject env = new JsonObject()
      .put(WikiConfig.ENV_ROOT, "/data")
      .put(WikiConfig.ENV_MARKUP, "text")
      .put(WikiConfig.ENV_CACHE_TTL, 250);
    WikiConfig config = WikiConfig.fromJson(WikiConfigLoader.fromEnvNames(env), WikiConfig.defaults());
    assertEquals("/data", config.rootPath());
    assertEquals("text", config.markup());
    assertEquals(250L, config.cacheTtlMillis());
  }

  @Test
  public void systemPropertyOutranksFileAndEnvironment(Vertx vertx) throws Exception {
    Path file = tempDir.resolve("textwiki-config.json");
    Files.write(file, new JsonObject().put("markup", "markdown").put("rootPath", "/from/file").encode()
      .getBytes(StandardCharsets.UTF_8));
    System.setProperty(WikiConfig.ENV_MARKUP, "text");
    try {
      WikiConfig config = WikiConfigLoader.load(vertx, file.toString(), WikiConfig.defaults());
      assertEquals("text", config.markup());
      assertEquals("/from/file", config.rootPath());

      JsonObject env = new JsonObject().put(WikiConfig.ENV_MARKUP, "markdown");
      JsonObject merged = WikiConfigLoader.fromEnvNames(WikiConfigLoader.withSystemProperties(env));
      assertEquals("text", WikiConfig.fromJson(merged, WikiConfig.defaults()).markup());
    } finally {
      System.clearProperty(WikiConfig.ENV_MARKUP);
    }
  }

  @Test
  public void toJsonRoundTrips() {
    WikiConfig config = new WikiConfig("root", "text", 10L);
    WikiConfig copy = WikiConfig.fromJson(config.toJson(), WikiConfig.defaults());
    assertEquals(config.rootPath(), copy.rootPath());
    assertEquals(config.markup(), copy.markup());
    assertEquals(config.cacheTtlMillis(), copy.cacheTtlMillis());
  }
}
