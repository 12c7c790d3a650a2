package textwiki.cache;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.core.shareddata.LocalMap;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Render cache kept in a Vert.x shared-data map, visible to every verticle of the instance.
 */
public final class LocalMapRenderCache implements RenderCache {
  private static final Logger LOG = Logger.getLogger(LocalMapRenderCache.class.getName());
  static final String CACHE_NAME = "textwiki.render.cache";

  private final LocalMap<String, JsonObject> cache;
  private final long ttlMillis;

  public LocalMapRenderCache(Vertx vertx) {
    this(vertx, 0L);
  }

  /**
   * @param ttlMillis maximum entry age, or {@code 0} to keep entries until invalidated
   */
  public LocalMapRenderCache(Vertx vertx, long ttlMillis) {
    this.cache = vertx.sharedData().getLocalMap(CACHE_NAME);
    this.ttlMillis = Math.max(0L, ttlMillis);
  }

  @Override
  public String get(String key, String fingerprint) {
    JsonObject cached = cache.get(key);
    if (!isFresh(cached, fingerprint)) {
      return null;
    }
    return cached.getString("value");
  }

  @Override
  public void put(String key, String fingerprint, String value) {
    cache.put(key, new JsonObject()
      .put("timestamp", System.currentTimeMillis())
      .put("fingerprint", fingerprint)
      .put("value", value));
  }

  @Override
  public void invalidate(String key) {
    if (cache.remove(key) != null) {
      LOG.log(Level.FINER, "Invalidated render cache entry {0}", key);
    }
  }

  public int size() {
    return cache.size();
  }

  public void clear() {
    cache.clear();
  }

  private boolean isFresh(JsonObject cached, String fingerprint) {
    if (cached == null) {
      return false;
    }
    if (fingerprint != null && !fingerprint.equals(cached.getString("fingerprint"))) {
      return false;
    }
    if (ttlMillis == 0L) {
      return true;
    }
    long timestamp = cached.getLong("timestamp", 0L);
    return (System.currentTimeMillis() - timestamp) <= ttlMillis;
  }
}
