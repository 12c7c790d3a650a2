package textwiki.page;

import io.vertx.core.file.FileSystem;
import io.vertx.core.file.FileSystemException;
import textwiki.cache.RenderCache;
import textwiki.errors.InvalidPatternException;
import textwiki.errors.PageNotFoundException;
import textwiki.errors.WikiStorageException;
import textwiki.markup.Markup;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The wiki: resolves urls to {@link Page}s under a root directory and builds listings, tag maps
 * and search results from them.
 * <p>
 * Nothing is indexed ahead of time. Every listing walks the tree again, so the files on disk are
 * the only source of truth. Directories are walked in lexicographic name order.
 */
public final class PageIndex {
  private static final Logger LOG = Logger.getLogger(PageIndex.class.getName());

  public static final List<String> DEFAULT_SEARCH_ATTRIBUTES =
    Collections.unmodifiableList(Arrays.asList("title", "tags", "body"));

  /**
   * Orders by lower-cased title, then by url.
   */
  public static final Comparator<Page> BY_TITLE =
    Comparator.comparing((Page page) -> page.attributeOrEmpty("title").toLowerCase(Locale.ROOT))
      .thenComparing(Page::url);

  private final FileSystem fs;
  private final Path root;
  private final Markup markup;
  private final RenderCache cache;

  public PageIndex(FileSystem fs, Path root, Markup markup, RenderCache cache) {
    this.fs = fs;
    this.root = root.toAbsolutePath().normalize();
    this.markup = markup;
    this.cache = cache;
  }

  public Path root() {
    return root;
  }

  public Markup markup() {
    return markup;
  }

  /**
   * The file of {@code url} below the root.
   *
   * @throws IllegalArgumentException when {@code url} resolves outside the root
   */
  public Path path(String url) {
    Path path = root.resolve(url + markup.extension()).normalize();
    if (!path.startsWith(root) || path.equals(root)) {
      throw new IllegalArgumentException("Page url '" + url + "' is outside the wiki root");
    }
    return path;
  }

  public boolean exists(String url) {
    return fs.existsBlocking(path(url).toString());
  }

  /**
   * Loads and renders the page at {@code url}.
   *
   * @return the page, or {@code null} when there is none
   */
  public Page get(String url) {
    if (!exists(url)) {
      return null;
    }
    return open(path(url), url);
  }

  /**
   * As {@link #get(String)}, failing when the page does not exist.
   *
   * @throws PageNotFoundException when there is no page at {@code url}
   */
  public Page getOr404(String url) {
    Page page = get(url);
    if (page == null) {
      throw new PageNotFoundException(url);
    }
    return page;
  }

  /**
   * An unsaved page with empty metadata and body, or empty when a page already exists at
   * {@code url}.
   */
  public Optional<Page> getBare(String url) {
    if (exists(url)) {
      return Optional.empty();
    }
    return Optional.of(new Page(fs, path(url), url, markup, cache));
  }

  /**
   * Renames the file of {@code url} to that of {@code newUrl}. Page objects already handed out for
   * {@code url} are stale afterwards.
   *
   * @throws WikiStorageException when the source is missing, the destination exists or the rename
   *                              fails
   */
  public void move(String url, String newUrl) {
    Path from = path(url);
    Path to = path(newUrl);
    if (!fs.existsBlocking(from.toString())) {
      throw new WikiStorageException("Cannot move " + url + ": no such page");
    }
    if (fs.existsBlocking(to.toString())) {
      throw new WikiStorageException("Cannot move " + url + " to " + newUrl + ": destination exists");
    }
    try {
      fs.moveBlocking(from.toString(), to.toString());
    } catch (FileSystemException e) {
      throw new WikiStorageException("Failed to move " + url + " to " + newUrl, e);
    }
    invalidate(from);
    LOG.log(Level.FINE, "Moved {0} to {1}", new Object[] { url, newUrl });
  }

  /**
   * @return {@code false} when there is no page at {@code url}
   */
  public boolean delete(String url) {
    Path path = path(url);
    if (!exists(url)) {
      return false;
    }
    try {
      fs.deleteBlocking(path.toString());
    } catch (FileSystemException e) {
      throw new WikiStorageException("Failed to delete " + url, e);
    }
    invalidate(path);
    LOG.log(Level.FINE, "Deleted {0}", url);
    return true;
  }

  /**
   * Every page under the root, sorted by {@link #BY_TITLE}.
   */
  public List<Page> index() {
    List<Page> pages = walk();
    pages.sort(BY_TITLE);
    return pages;
  }

  /**
   * Maps each page's {@code attr} value to the page, in traversal order. When two pages share a
   * value the later one replaces the earlier.
   */
  public Map<String, Page> index(String attr) {
    Map<String, Page> pages = new LinkedHashMap<>();
    for (Page page : walk()) {
      pages.put(page.attributeOrEmpty(attr), page);
    }
    return pages;
  }

  public Page getByTitle(String title) {
    return index("title").get(title);
  }

  /**
   * Maps every tag to the pages carrying it, tags in order of first appearance over
   * {@link #index()}.
   * <p>
   * Tag segments are de-duplicated before they are trimmed, so {@code "a, b, a"} lists its page
   * twice under {@code a}.
   */
  public Map<String, List<Page>> getTags() {
    Map<String, List<Page>> tags = new LinkedHashMap<>();
    for (Page page : index()) {
      Set<String> segments = new LinkedHashSet<>(Arrays.asList(page.attributeOrEmpty("tags").split(",")));
      for (String segment : segments) {
        String tag = segment.trim();
        if (tag.isEmpty()) {
          continue;
        }
        tags.computeIfAbsent(tag, k -> new ArrayList<>()).add(page);
      }
    }
    return tags;
  }

  /**
   * Pages whose tags string contains {@code tag}, sorted by {@link #BY_TITLE}. This is a substring
   * test: {@code "java"} also finds pages tagged {@code "javascript"}.
   */
  public List<Page> indexByTag(String tag) {
    List<Page> tagged = new ArrayList<>();
    for (Page page : index()) {
      if (page.attributeOrEmpty("tags").contains(tag)) {
        tagged.add(page);
      }
    }
    tagged.sort(BY_TITLE);
    return tagged;
  }

  public List<Page> search(String term) {
    return search(term, DEFAULT_SEARCH_ATTRIBUTES);
  }

  /**
   * Pages where {@code term}, as a regular expression, is found in at least one of {@code attrs}.
   * Results keep traversal order.
   *
   * @throws InvalidPatternException when {@code term} is not a valid expression
   */
  public List<Page> search(String term, List<String> attrs) {
    Pattern regex;
    try {
      regex = Pattern.compile(term);
    } catch (PatternSyntaxException e) {
      throw new InvalidPatternException(term, e);
    }
    List<Page> matched = new ArrayList<>();
    for (Page page : walk()) {
      for (String attr : attrs) {
        if (regex.matcher(page.attributeOrEmpty(attr)).find()) {
          matched.add(page);
          break;
        }
      }
    }
    return matched;
  }

  private List<Page> walk() {
    List<Page> pages = new ArrayList<>();
    if (!fs.existsBlocking(root.toString())) {
      return pages;
    }
    walk(root, pages);
    return pages;
  }

  private void walk(Path directory, List<Page> pages) {
    List<String> names = new ArrayList<>();
    try {
      // readDir answers canonical paths; keep the names and resolve them against our own root
      for (String entry : fs.readDirBlocking(directory.toString())) {
        names.add(Paths.get(entry).getFileName().toString());
      }
    } catch (FileSystemException e) {
      throw new WikiStorageException("Failed to list " + directory, e);
    }
    Collections.sort(names);
    String extension = markup.extension();
    for (String name : names) {
      Path child = directory.resolve(name);
      boolean isDirectory;
      try {
        isDirectory = fs.propsBlocking(child.toString()).isDirectory();
      } catch (FileSystemException e) {
        LOG.log(Level.WARNING, "Skipping unreadable entry " + child, e);
        continue;
      }
      if (isDirectory) {
        walk(child, pages);
      } else if (name.endsWith(extension) && name.length() > extension.length()) {
        pages.add(open(child, urlOf(child)));
      }
    }
  }

  private String urlOf(Path file) {
    String relative = root.relativize(file).toString();
    String url = relative.substring(0, relative.length() - markup.extension().length());
    return url.replace('\\', '/');
  }

  private Page open(Path path, String url) {
    Page page = new Page(fs, path, url, markup, cache);
    page.load();
    page.render();
    return page;
  }

  private void invalidate(Path path) {
    if (cache != null) {
      cache.invalidate(cache.keyFor(path));
    }
  }
}
