package textwiki.errors;

/**
 * Raised when a url has no backing file.
 */
public class PageNotFoundException extends WikiException {
  private final String url;

  public PageNotFoundException(String url) {
    super("Page not found: " + url);
    this.url = url;
  }

  public PageNotFoundException(String url, Throwable cause) {
    super("Page not found: " + url, cause);
    this.url = url;
  }

  public String url() {
    return url;
  }
}
