package io.brouwer.parser.api;

/**
 * A hard syntax error: a production matched its distinguishing token but a required continuation
 * was missing. Always fatal to the current parse.
 */
public class BrouwerSyntaxException extends RuntimeException {

  private final String reason;
  private final TextPosition position;

  public BrouwerSyntaxException(String reason, TextPosition position) {
    super(reason + " at " + position);
    this.reason = reason;
    this.position = position;
  }

  /** The unmet grammar expectation, without location. */
  public String getReason() {
    return reason;
  }

  public TextPosition getPosition() {
    return position;
  }
}
