package textwiki.errors;

/**
 * Base type of all failures raised by the wiki core.
 */
public class WikiException extends RuntimeException {
  public WikiException(String message) {
    super(message);
  }

  public WikiException(String message, Throwable cause) {
    super(message, cause);
  }
}
