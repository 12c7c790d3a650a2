package textwiki;

import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import textwiki.cache.LocalMapRenderCache;
import textwiki.cache.RenderCache;
import textwiki.config.WikiConfig;
import textwiki.markup.Markup;
import textwiki.markup.MarkupRegistry;
import textwiki.page.PageIndex;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * Everything one wiki instance needs, built once at startup and handed to whoever serves pages.
 */
public final class WikiContext implements AutoCloseable {
  private static final Logger LOG = Logger.getLogger(WikiContext.class.getName());

  private final Vertx vertx;
  private final boolean ownsVertx;
  private final WikiConfig config;
  private final Markup markup;
  private final RenderCache cache;
  private final PageIndex pages;

  private WikiContext(Vertx vertx, boolean ownsVertx, WikiConfig config, MarkupRegistry registry) {
    this.vertx = vertx;
    this.ownsVertx = ownsVertx;
    this.config = config;
    this.markup = registry.forName(config.markup());
    this.cache = new LocalMapRenderCache(vertx, config.cacheTtlMillis());
    Path root = Paths.get(config.rootPath()).toAbsolutePath().normalize();
    this.pages = new PageIndex(vertx.fileSystem(), root, markup, cache);
    LOG.info("Wiki root " + root + " using " + markup.name() + " markup");
  }

  /**
   * Creates a context with its own Vert.x instance, closed by {@link #close()}.
   */
  public static WikiContext create(WikiConfig config) {
    return owning(Vertx.vertx(new VertxOptions().setUseDaemonThread(Boolean.TRUE)), config);
  }

  /**
   * Takes ownership of {@code vertx}; it is closed again when the context cannot be built.
   */
  static WikiContext owning(Vertx vertx, WikiConfig config) {
    try {
      return new WikiContext(vertx, true, config, MarkupRegistry.withDefaults());
    } catch (RuntimeException e) {
      vertx.close();
      throw e;
    }
  }

  /**
   * Creates a context on a caller-owned Vert.x instance.
   */
  public static WikiContext create(Vertx vertx, WikiConfig config) {
    return create(vertx, config, MarkupRegistry.withDefaults());
  }

  public static WikiContext create(Vertx vertx, WikiConfig config, MarkupRegistry registry) {
    return new WikiContext(vertx, false, config, registry);
  }

  public Vertx vertx() {
    return vertx;
  }

  public WikiConfig config() {
    return config;
  }

  public Markup markup() {
    return markup;
  }

  public RenderCache cache() {
    return cache;
  }

  public PageIndex pages() {
    return pages;
  }

  @Override
  public void close() {
    if (ownsVertx) {
      vertx.close();
    }
  }
}
