package textwiki.config;

import io.vertx.core.json.JsonObject;
import textwiki.markup.MarkdownMarkup;

/**
 * Settings of one wiki instance: content root, markup dialect and render cache lifetime.
 * <p>
 * Sources rank system properties over environment variables over the JSON file over
 * {@link #defaults()}; see {@link WikiConfigLoader}.
 */
public final class WikiConfig {
  public static final String ENV_ROOT = "TEXTWIKI_ROOT";
  public static final String ENV_MARKUP = "TEXTWIKI_MARKUP";
  public static final String ENV_CACHE_TTL = "TEXTWIKI_CACHE_TTL_MS";

  private final String rootPath;
  private final String markup;
  private final long cacheTtlMillis;

  public WikiConfig(String rootPath, String markup, long cacheTtlMillis) {
    this.rootPath = rootPath;
    this.markup = markup;
    this.cacheTtlMillis = cacheTtlMillis;
  }

  public static WikiConfig defaults() {
    return new WikiConfig("content", MarkdownMarkup.NAME, 0L);
  }

  /**
   * Reads system properties first, then environment variables, then falls back to
   * {@link #defaults()}.
   */
  public static WikiConfig fromEnv() {
    WikiConfig defaults = defaults();
    String rootPath = readString(ENV_ROOT, defaults.rootPath());
    String markup = readString(ENV_MARKUP, defaults.markup());
    long cacheTtlMillis = readLong(ENV_CACHE_TTL, defaults.cacheTtlMillis());
    return new WikiConfig(rootPath, markup, cacheTtlMillis);
  }

  public static WikiConfig fromJson(JsonObject json, WikiConfig fallback) {
    if (json == null) {
      return fallback;
    }
    String rootPath = json.getString("rootPath", fallback.rootPath());
    String markup = json.getString("markup", fallback.markup());
    long cacheTtlMillis = json.getLong("cacheTtlMillis", fallback.cacheTtlMillis());
    return new WikiConfig(rootPath, markup, cacheTtlMillis);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("rootPath", rootPath)
      .put("markup", markup)
      .put("cacheTtlMillis", cacheTtlMillis);
  }

  public WikiConfig withRootPath(String rootPath) {
    return new WikiConfig(rootPath, markup, cacheTtlMillis);
  }

  public WikiConfig withMarkup(String markup) {
    return new WikiConfig(rootPath, markup, cacheTtlMillis);
  }

  public String rootPath() {
    return rootPath;
  }

  public String markup() {
    return markup;
  }

  public long cacheTtlMillis() {
    return cacheTtlMillis;
  }

  private static long readLong(String key, long fallback) {
    String raw = readString(key, null);
    if (raw == null || raw.isEmpty()) {
      return fallback;
    }
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException e) {
      return fallback;
    }
  }

  private static String readString(String key, String fallback) {
    String value = System.getProperty(key);
    if (value == null || value.isEmpty()) {
      value = System.getenv(key);
    }
    return (value == null || value.isEmpty()) ? fallback : value;
  }
}
