package io.brouwer.parser.impl;

import java.util.Set;

/** Character classes shared by the cursor and the grammar. */
public final class CharClasses {

  /** Sentinel returned by {@link Cursor#peek()} once the input is exhausted. */
  public static final char EOF = '\0';

  private static final String OPERATOR_CHARS = "?<>=%\\~!@#$|&*/+^-:;";
  private static final String ESCAPABLE_CHARS = "\"'tvnrb0";

  /** Operator spellings that may never appear as a generic operator token. */
  public static final Set<String> RESERVED_OPERATORS =
      Set.of(":", "->", "=>", "<-", "--", "|", "\\", "=", ".", "::");

  private CharClasses() {}

  public static boolean isBlank(char c) {
    return c == ' ' || c == '\t';
  }

  public static boolean isNewline(char c) {
    return c == '\n' || c == '\r';
  }

  public static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  public static boolean isIdentifierStart(char c) {
    return c == '_' || Character.isLetter(c);
  }

  /** Letters, digits and underscore; the keyword boundary check rejects these. */
  public static boolean isIdentifierPart(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }

  public static boolean isOperatorChar(char c) {
    return c != EOF && OPERATOR_CHARS.indexOf(c) >= 0;
  }

  /** Characters accepted after a backslash in character and string literals. */
  public static boolean isEscapable(char c) {
    return c != EOF && ESCAPABLE_CHARS.indexOf(c) >= 0;
  }

  public static boolean isReservedOperator(String op) {
    return RESERVED_OPERATORS.contains(op);
  }

  /** Renders a character for error messages; see {@link Cursor#describeCurrent()} at the end. */
  public static String describe(char c) {
    return switch (c) {
      case EOF -> "'\\0'";
      case '\n' -> "'\\n'";
      case '\r' -> "'\\r'";
      case '\t' -> "'\\t'";
      default -> "'" + c + "'";
    };
  }
}
