package textwiki.page;

import textwiki.errors.MissingMetadataException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Ordered page metadata. Every key holds one or more string values; keys are stored lower-cased.
 * Values never contain line breaks: a multi-line value is kept as one value per line, which is
 * how the page header writes it.
 * <p>
 * {@link #get(String)} follows the one-or-many rule: a key with exactly one value reads as that
 * {@code String}, a key with several values reads as the unmodifiable list.
 */
public final class Metadata {
  /**
   * Keys are words of letters, digits, {@code _}, {@code .} or {@code -}, separated by single
   * spaces. Anything else could not be read back from a header line.
   */
  public static final Pattern KEY = Pattern.compile("[\\p{L}\\p{M}\\p{N}_.-]+(?: [\\p{L}\\p{M}\\p{N}_.-]+)*");

  private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

  private final Map<String, List<String>> entries = new LinkedHashMap<>();

  public Metadata() {
  }

  public Metadata(Metadata other) {
    for (Map.Entry<String, List<String>> entry : other.entries.entrySet()) {
      entries.put(entry.getKey(), new ArrayList<>(entry.getValue()));
    }
  }

  public boolean contains(String key) {
    return entries.containsKey(normalize(key));
  }

  /**
   * Returns the single value of a key as a {@code String}, or all of its values as a list.
   */
  public Object get(String key) {
    List<String> values = getAll(key);
    if (values.size() == 1) {
      return values.get(0);
    }
    return values;
  }

  public List<String> getAll(String key) {
    List<String> values = entries.get(normalize(key));
    if (values == null) {
      throw new MissingMetadataException(key);
    }
    return Collections.unmodifiableList(values);
  }

  /**
   * Returns the values of a key joined by newlines.
   */
  public String text(String key) {
    return String.join("\n", getAll(key));
  }

  public String textOrEmpty(String key) {
    List<String> values = entries.get(normalize(key));
    return values == null ? "" : String.join("\n", values);
  }

  public void put(String key, String... values) {
    put(key, Arrays.asList(values));
  }

  /**
   * Replaces the values of a key. A value spanning several lines is stored as one value per line.
   *
   * @throws IllegalArgumentException when the key cannot be written as a header line
   */
  public void put(String key, List<String> values) {
    String name = writableKey(key);
    List<String> copy = new ArrayList<>();
    for (String value : values) {
      addLines(copy, value);
    }
    if (copy.isEmpty()) {
      copy.add("");
    }
    entries.put(name, copy);
  }

  /**
   * Appends a value to a key, creating the key when absent.
   *
   * @throws IllegalArgumentException when the key cannot be written as a header line
   */
  public void add(String key, String value) {
    addLines(entries.computeIfAbsent(writableKey(key), k -> new ArrayList<>()), value);
  }

  private static void addLines(List<String> target, String value) {
    if (value == null) {
      target.add("");
      return;
    }
    target.addAll(Arrays.asList(LINE_BREAK.split(value, -1)));
  }

  public boolean remove(String key) {
    return entries.remove(normalize(key)) != null;
  }

  public Set<String> keys() {
    return Collections.unmodifiableSet(entries.keySet());
  }

  public SortedSet<String> sortedKeys() {
    return new TreeSet<>(entries.keySet());
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public void clear() {
    entries.clear();
  }

  public Map<String, List<String>> asMap() {
    Map<String, List<String>> view = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> entry : entries.entrySet()) {
      view.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
    }
    return Collections.unmodifiableMap(view);
  }

  private static String normalize(String key) {
    Objects.requireNonNull(key, "key");
    return key.trim().toLowerCase(Locale.ROOT);
  }

  private static String writableKey(String key) {
    String name = normalize(key);
    if (!KEY.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid metadata key '" + key + "'");
    }
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Metadata)) {
      return false;
    }
    return entries.equals(((Metadata) o).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
