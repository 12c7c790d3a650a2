package textwiki.errors;

public class MissingMetadataException extends WikiException {
  private final String key;

  public MissingMetadataException(String key) {
    super("No metadata value for key '" + key + "'");
    this.key = key;
  }

  public String key() {
    return key;
  }
}
