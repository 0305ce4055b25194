package io.brouwer.parser.impl;

/**
 * Bounds the recursion depth of the grammar so that pathological nesting fails with a syntax error
 * instead of a {@link StackOverflowError}.
 */
final class NestingGuard {

  private final Cursor cursor;
  private final int maxDepth;
  private int depth;

  NestingGuard(Cursor cursor, int maxDepth) {
    this.cursor = cursor;
    this.maxDepth = maxDepth;
  }

  /** Enters one nesting level; each call is paired with {@link #exit()} in a finally block. */
  void enter() {
    if (depth >= maxDepth) {
      throw cursor.error("maximum nesting depth of " + maxDepth + " exceeded");
    }
    depth++;
  }

  void exit() {
    depth--;
  }
}
