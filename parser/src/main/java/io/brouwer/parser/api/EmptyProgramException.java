package io.brouwer.parser.api;

/** Thrown when the source is structurally valid but contains no program (no module declaration). */
public final class EmptyProgramException extends RuntimeException {

  public EmptyProgramException(String message) {
    super(message);
  }
}
