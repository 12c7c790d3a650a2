package textwiki.errors;

/**
 * Filesystem failure while reading, writing, renaming or deleting page files.
 */
public class WikiStorageException extends WikiException {
  public WikiStorageException(String message) {
    super(message);
  }

  public WikiStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
