package textwiki.config;

import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads configuration from an optional JSON file and the environment, over a fallback.
 * <p>
 * Precedence, highest first: system properties, environment variables, the JSON file, the
 * fallback. Both system properties and the environment use the {@code TEXTWIKI_*} names; they
 * are mapped onto the JSON keys used by {@link WikiConfig#fromJson}.
 */
public final class WikiConfigLoader {
  private static final Logger LOG = Logger.getLogger(WikiConfigLoader.class.getName());
  public static final String DEFAULT_FILE = "textwiki-config.json";

  private WikiConfigLoader() {
  }

  public static WikiConfig load(Vertx vertx) {
    return load(vertx, DEFAULT_FILE, WikiConfig.fromEnv());
  }

  public static WikiConfig load(Vertx vertx, String file, WikiConfig fallback) {
    ConfigStoreOptions fileStore = new ConfigStoreOptions()
      .setType("file")
      .setOptional(true)
      .setConfig(new JsonObject().put("path", file));

    ConfigStoreOptions envStore = new ConfigStoreOptions().setType("env");

    ConfigRetrieverOptions options = new ConfigRetrieverOptions()
      .setIncludeDefaultStores(false)
      .addStore(fileStore)
      .addStore(envStore);

    JsonObject loaded = new JsonObject();
    ConfigRetriever retriever = ConfigRetriever.create(vertx, options);
    try {
      JsonObject cfg = retriever.getConfig().toCompletionStage().toCompletableFuture().get(2, TimeUnit.SECONDS);
      if (cfg != null) {
        loaded = cfg;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.log(Level.WARNING, "Interrupted while reading configuration, using defaults", e);
    } catch (ExecutionException | TimeoutException e) {
      LOG.log(Level.WARNING, "Unable to read configuration from " + file + ", using defaults", e);
    } finally {
      retriever.close();
    }
    return WikiConfig.fromJson(fromEnvNames(withSystemProperties(loaded)), fallback);
  }

  /**
   * Lays the {@code TEXTWIKI_*} system properties over the loaded environment names.
   */
  static JsonObject withSystemProperties(JsonObject loaded) {
    JsonObject merged = loaded.copy();
    for (String name : new String[] { WikiConfig.ENV_ROOT, WikiConfig.ENV_MARKUP, WikiConfig.ENV_CACHE_TTL }) {
      String value = System.getProperty(name);
      if (value != null && !value.isEmpty()) {
        merged.put(name, value);
      }
    }
    return merged;
  }

  static JsonObject fromEnvNames(JsonObject loaded) {
    JsonObject merged = loaded.copy();
    copy(loaded, WikiConfig.ENV_ROOT, merged, "rootPath");
    copy(loaded, WikiConfig.ENV_MARKUP, merged, "markup");
    if (loaded.containsKey(WikiConfig.ENV_CACHE_TTL)) {
      try {
        merged.put("cacheTtlMillis", Long.parseLong(String.valueOf(loaded.getValue(WikiConfig.ENV_CACHE_TTL))));
      } catch (NumberFormatException e) {
        LOG.warning("Ignoring non-numeric " + WikiConfig.ENV_CACHE_TTL);
      }
    }
    return merged;
  }

  private static void copy(JsonObject from, String fromKey, JsonObject to, String toKey) {
    Object value = from.getValue(fromKey);
    if (value != null && !String.valueOf(value).isEmpty()) {
      to.put(toKey, String.valueOf(value));
    }
  }
}
