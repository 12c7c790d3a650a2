package textwiki.cache;

import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Memoizes rendered page output. Entries are keyed by page identity and carry a fingerprint of
 * the text they were rendered from.
 */
public interface RenderCache {

  /**
   * Cache key for the page stored at {@code path}.
   */
  default String keyFor(Path path) {
    return "page.html|" + path.toAbsolutePath().normalize();
  }

  /**
   * Returns the cached value when present, fresh and rendered from {@code fingerprint}.
   */
  String get(String key, String fingerprint);

  void put(String key, String fingerprint, String value);

  void invalidate(String key);

  default String memoize(String key, String fingerprint, Supplier<String> compute) {
    String cached = get(key, fingerprint);
    if (cached != null) {
      return cached;
    }
    String value = compute.get();
    if (value != null) {
      put(key, fingerprint, value);
    }
    return value;
  }
}
