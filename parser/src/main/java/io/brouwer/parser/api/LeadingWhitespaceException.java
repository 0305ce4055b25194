package io.brouwer.parser.api;

/** Blank characters where a top-level line must start in the first column. */
public final class LeadingWhitespaceException extends BrouwerSyntaxException {

  public LeadingWhitespaceException(String reason, TextPosition position) {
    super(reason, position);
  }
}
