package io.brouwer.parser.impl;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Tracks the reserved operators that the innermost enclosing bracket is waiting for.
 *
 * <p>Inside {@code [ ]} a {@code |} introduces a comprehension, and inside {@code { }} both {@code
 * |} and {@code =} separate parts of an entry. An expression running into one of those spellings
 * ends there instead of reporting a reserved operator. Parentheses and block bodies start a fresh
 * scope where nothing terminates.
 */
final class BracketScope {

  static final Set<String> NONE = Set.of();
  static final Set<String> SQUARE = Set.of("|");
  static final Set<String> CURLY = Set.of("|", "=");

  private final Deque<Set<String>> scopes = new ArrayDeque<>();

  BracketScope() {
    scopes.push(NONE);
  }

  <T> T within(Set<String> terminators, Supplier<T> body) {
    scopes.push(terminators);
    try {
      return body.get();
    } finally {
      scopes.pop();
    }
  }

  /** The terminators of the innermost scope. */
  Set<String> current() {
    return scopes.peek();
  }

  boolean terminates(String op) {
    return scopes.peek().contains(op);
  }
}
