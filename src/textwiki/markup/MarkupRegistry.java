package textwiki.markup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Named markup dialects, selected by configuration.
 */
public final class MarkupRegistry {
  private final Map<String, Supplier<Markup>> factories = new LinkedHashMap<>();

  public static MarkupRegistry withDefaults() {
    MarkupRegistry registry = new MarkupRegistry();
    registry.register(MarkdownMarkup.NAME, MarkdownMarkup::new);
    registry.register(PlainTextMarkup.NAME, PlainTextMarkup::new);
    return registry;
  }

  public void register(String name, Supplier<Markup> factory) {
    if (name != null && factory != null) {
      factories.put(name.toLowerCase(Locale.ROOT), factory);
    }
  }

  public Markup forName(String name) {
    Supplier<Markup> factory = name == null ? null : factories.get(name.trim().toLowerCase(Locale.ROOT));
    if (factory == null) {
      throw new IllegalArgumentException("Unknown markup '" + name + "', expected one of " + names());
    }
    return factory.get();
  }

  public List<String> names() {
    return new ArrayList<>(factories.keySet());
  }
}
