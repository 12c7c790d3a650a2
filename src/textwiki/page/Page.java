package textwiki.page;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.CopyOptions;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.FileSystemException;
import textwiki.cache.RenderCache;
import textwiki.errors.PageNotFoundException;
import textwiki.errors.WikiStorageException;
import textwiki.markup.MetaHeader;
import textwiki.markup.Markup;
import textwiki.markup.Rendered;

import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One wiki document backed by one file.
 * <p>
 * The raw file text goes through two steps: {@link #load()} reads it, {@link #render()} splits
 * the metadata header from the body and renders the HTML. Setters change metadata and body in
 * memory only; {@link #save()} writes them back.
 */
public class Page {
  private static final Logger LOG = Logger.getLogger(Page.class.getName());

  private final FileSystem fs;
  private final Path path;
  private final String url;
  private final Markup markup;
  private final RenderCache cache;

  private String raw = "";
  private String html = "";
  private String body = "";
  private Metadata metadata = new Metadata();

  public Page(FileSystem fs, Path path, String url, Markup markup, RenderCache cache) {
    this.fs = Objects.requireNonNull(fs, "fs");
    this.path = Objects.requireNonNull(path, "path");
    this.url = Objects.requireNonNull(url, "url");
    this.markup = Objects.requireNonNull(markup, "markup");
    this.cache = cache;
  }

  public String url() {
    return url;
  }

  public Path path() {
    return path;
  }

  public Markup markup() {
    return markup;
  }

  /**
   * Reads the backing file as UTF-8.
   *
   * @throws PageNotFoundException when the file does not exist
   */
  public void load() {
    load(null);
  }

  /**
   * Uses {@code content} as the raw page text. A {@code null} or empty content reads the file.
   */
  public void load(String content) {
    if (content == null || content.isEmpty()) {
      raw = read();
    } else {
      raw = content;
    }
  }

  public void render() {
    Rendered rendered = markup.process(raw);
    html = rendered.html();
    body = rendered.body();
    metadata = rendered.metadata();
  }

  public void save() {
    save(true);
  }

  /**
   * Overwrites the backing file with the serialized metadata and body.
   *
   * @param update reload and re-render from the written file afterwards
   */
  public void save(boolean update) {
    Path target = path.toAbsolutePath();
    Path folder = target.getParent();
    String text = MetaHeader.serialize(markup, metadata, body);
    String temp = null;
    try {
      if (!fs.existsBlocking(folder.toString())) {
        fs.mkdirsBlocking(folder.toString());
      }
      temp = fs.createTempFileBlocking(folder.toString(), "." + target.getFileName(), ".tmp", (String) null);
      fs.writeFileBlocking(temp, Buffer.buffer(text, StandardCharsets.UTF_8.name()));
      replace(temp, target.toString());
      temp = null;
    } catch (FileSystemException e) {
      WikiStorageException failure = new WikiStorageException("Failed to write page " + url, e);
      discard(temp, failure);
      throw failure;
    }
    LOG.log(Level.FINE, "Saved {0}", this);
    deleteCache();
    if (update) {
      load();
      render();
    }
  }

  public void deleteCache() {
    if (cache != null) {
      cache.invalidate(cache.keyFor(path));
    }
  }

  /**
   * Rendered output from the last {@link #render()}.
   */
  public String html() {
    return html;
  }

  /**
   * Rendered output through the render cache. The entry is reused while the raw text it was
   * rendered from is unchanged.
   */
  public String cachedHtml() {
    if (cache == null) {
      return html;
    }
    return cache.memoize(cache.keyFor(path), fingerprint(), this::html);
  }

  public String raw() {
    return raw;
  }

  public String body() {
    return body;
  }

  public void setBody(String body) {
    this.body = body == null ? "" : body;
  }

  public Metadata metadata() {
    return metadata;
  }

  /**
   * One-or-many read of a metadata key.
   *
   * @return the value as a {@code String} when the key has one value, otherwise the list
   * @throws textwiki.errors.MissingMetadataException when the key is absent
   */
  public Object get(String key) {
    return metadata.get(key);
  }

  public String text(String key) {
    return metadata.text(key);
  }

  public void set(String key, String... values) {
    metadata.put(key, values);
  }

  public String title() {
    return metadata.text("title");
  }

  public void setTitle(String title) {
    metadata.put("title", title);
  }

  /**
   * The raw comma separated tags string.
   */
  public String tags() {
    return metadata.text("tags");
  }

  public void setTags(String tags) {
    metadata.put("tags", tags);
  }

  public void setTags(List<String> tags) {
    metadata.put("tags", String.join(", ", tags));
  }

  /**
   * Distinct trimmed tags in the order they are written. Empty when the page has no tags.
   */
  public List<String> tagList() {
    Set<String> tags = new LinkedHashSet<>();
    for (String tag : metadata.textOrEmpty("tags").split(",")) {
      String trimmed = tag.trim();
      if (!trimmed.isEmpty()) {
        tags.add(trimmed);
      }
    }
    return new ArrayList<>(tags);
  }

  /**
   * String value of a named attribute: {@code url}, {@code path}, {@code body}, {@code html}, or
   * else the metadata key of that name.
   */
  public String attribute(String name) {
    String fixed = fixedAttribute(name);
    return fixed != null ? fixed : metadata.text(name);
  }

  /**
   * As {@link #attribute(String)}, reading a missing metadata key as empty text.
   */
  public String attributeOrEmpty(String name) {
    String fixed = fixedAttribute(name);
    return fixed != null ? fixed : metadata.textOrEmpty(name);
  }

  private String fixedAttribute(String name) {
    switch (name) {
      case "url":
        return url;
      case "path":
        return path.toString();
      case "body":
        return body;
      case "html":
        return html;
      default:
        return null;
    }
  }

  private String read() {
    String file = path.toString();
    if (!fs.existsBlocking(file)) {
      throw new PageNotFoundException(url);
    }
    try {
      return fs.readFileBlocking(file).toString(StandardCharsets.UTF_8);
    } catch (FileSystemException e) {
      if (e.getCause() instanceof NoSuchFileException) {
        throw new PageNotFoundException(url, e);
      }
      throw new WikiStorageException("Failed to read page " + url, e);
    }
  }

  /**
   * Atomic replacing rename. Only the async {@code move} takes copy options, so this blocks on its
   * result; it must not run on an event loop thread.
   */
  private void replace(String from, String to) {
    CopyOptions options = new CopyOptions().setReplaceExisting(true).setAtomicMove(true);
    try {
      fs.move(from, to, options).toCompletionStage().toCompletableFuture().get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof FileSystemException) {
        throw (FileSystemException) cause;
      }
      throw new FileSystemException(cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FileSystemException(e);
    }
  }

  private void discard(String temp, WikiStorageException failure) {
    if (temp == null) {
      return;
    }
    try {
      fs.deleteBlocking(temp);
    } catch (FileSystemException e) {
      failure.addSuppressed(e);
    }
  }

  private String fingerprint() {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(raw.getBytes(StandardCharsets.UTF_8));
      StringBuilder out = new StringBuilder(hash.length * 2);
      for (byte b : hash) {
        out.append(String.format("%02x", b));
      }
      return out.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + path + ")";
  }
}
