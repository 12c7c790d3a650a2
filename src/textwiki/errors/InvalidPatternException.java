package textwiki.errors;

import java.util.regex.PatternSyntaxException;

public class InvalidPatternException extends WikiException {
  private final String pattern;

  public InvalidPatternException(String pattern, PatternSyntaxException cause) {
    super("Invalid search pattern '" + pattern + "': " + cause.getDescription(), cause);
    this.pattern = pattern;
  }

  public String pattern() {
    return pattern;
  }
}
