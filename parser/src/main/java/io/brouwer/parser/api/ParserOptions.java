package io.brouwer.parser.api;

/**
 * Tunables for a {@link BrouwerParser}.
 *
 * @param maxDepth maximum nesting of expressions, patterns and type identifiers before the parse
 *     fails with a syntax error instead of exhausting the call stack
 */
public record ParserOptions(int maxDepth) {

  /** System property overriding the default {@link #maxDepth()}. */
  public static final String PROP_MAX_DEPTH = "brouwer.parser.maxDepth";

  public static final int DEFAULT_MAX_DEPTH = 256;

  public ParserOptions {
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
    }
  }

  /** Options from system properties, falling back to the built-in defaults. */
  public static ParserOptions defaults() {
    return new ParserOptions(Integer.getInteger(PROP_MAX_DEPTH, DEFAULT_MAX_DEPTH));
  }

  public ParserOptions withMaxDepth(int depth) {
    return new ParserOptions(depth);
  }
}
