package io.brouwer.parser.impl;

import static io.brouwer.parser.impl.CharClasses.EOF;

import io.brouwer.parser.api.BrouwerSyntaxException;
import io.brouwer.parser.api.TextPosition;
import java.util.Objects;

/**
 * Random-access lookahead cursor over a materialized source buffer.
 *
 * <p>A caller takes a {@link Mark} before trying an alternative and {@link #reset(Mark) resets}
 * to it when the alternative turns out to be absent. The matching primitives themselves ({@link
 * #expectChar}, {@link #expectKeyword}, {@link #expectOp}) only move the offset on success, so a
 * failed attempt leaves the upcoming characters exactly as they were.
 *
 * <p>Besides the offset the cursor carries the layout state owned by {@link IndentationEngine}:
 * the blank run that started the current line and the offset at which that line's content begins.
 */
public final class Cursor {

  /**
   * Immutable snapshot of the cursor state.
   *
   * @param offset the input offset
   * @param indentation the current line's indentation
   * @param lineStart offset of the first non-blank character of the current line, or -1
   */
  public record Mark(int offset, String indentation, int lineStart) {}

  private final CharSequence input;
  private int pos;
  private String indentation = "";
  private int lineStart = -1;

  public Cursor(CharSequence input) {
    this.input = Objects.requireNonNull(input, "input");
  }

  // === Character access ===

  /** Returns the current character, or {@link CharClasses#EOF} at the end of input. */
  public char peek() {
    return charAt(pos);
  }

  /** Returns the character {@code ahead} positions past the current one. */
  public char peek(int ahead) {
    return charAt(pos + ahead);
  }

  public boolean atEnd() {
    return pos >= input.length();
  }

  /** Consumes and returns the current character; a no-op returning EOF at the end of input. */
  public char advance() {
    if (atEnd()) {
      return EOF;
    }
    return input.charAt(pos++);
  }

  public int offset() {
    return pos;
  }

  // === Backtracking ===

  public Mark mark() {
    return new Mark(pos, indentation, lineStart);
  }

  public void reset(Mark mark) {
    this.pos = mark.offset();
    this.indentation = mark.indentation();
    this.lineStart = mark.lineStart();
  }

  // === Matching primitives ===

  /** Consumes the current character iff it equals {@code c}. */
  public boolean expectChar(char c) {
    if (atEnd() || input.charAt(pos) != c) {
      return false;
    }
    pos++;
    return true;
  }

  /**
   * Matches {@code keyword} followed by a character that cannot continue an identifier.
   *
   * @return {@code true} if matched; the offset is unchanged otherwise
   */
  public boolean expectKeyword(String keyword) {
    requireNonEmpty(keyword, "keyword");
    if (!lookingAt(keyword)) {
      return false;
    }
    if (CharClasses.isIdentifierPart(charAt(pos + keyword.length()))) {
      return false;
    }
    pos += keyword.length();
    return true;
  }

  /**
   * Matches {@code op} followed by a character that cannot continue an operator, so that {@code
   * <-} never matches the prefix of {@code <--}.
   *
   * @return {@code true} if matched; the offset is unchanged otherwise
   */
  public boolean expectOp(String op) {
    requireNonEmpty(op, "operator");
    if (!lookingAt(op)) {
      return false;
    }
    if (CharClasses.isOperatorChar(charAt(pos + op.length()))) {
      return false;
    }
    pos += op.length();
    return true;
  }

  /** Returns whether the input at the current offset starts with {@code text}. Consumes nothing. */
  public boolean lookingAt(String text) {
    if (pos + text.length() > input.length()) {
      return false;
    }
    for (int i = 0; i < text.length(); i++) {
      if (input.charAt(pos + i) != text.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  /** Skips spaces and tabs. Returns whether anything was skipped. */
  public boolean skipBlanks() {
    int start = pos;
    while (CharClasses.isBlank(peek())) {
      pos++;
    }
    return pos != start;
  }

  /** Returns whether a {@code --} line comment starts at the current offset. */
  public boolean atLineComment() {
    return lookingAt("--") && !CharClasses.isOperatorChar(peek(2));
  }

  /**
   * Consumes a {@code --} line comment up to, not including, the line break.
   *
   * @return whether a comment was consumed
   */
  public boolean skipLineComment() {
    if (!atLineComment()) {
      return false;
    }
    pos += 2;
    while (!atEnd() && !CharClasses.isNewline(peek())) {
      pos++;
    }
    return true;
  }

  // === Layout state ===

  /** The literal blank run that started the current line. */
  public String indentation() {
    return indentation;
  }

  /** Records the indentation of a freshly entered line whose content starts at the offset. */
  void beginLine(String lineIndentation) {
    this.indentation = lineIndentation;
    this.lineStart = pos;
  }

  /** True when nothing has been consumed since the current line's indentation. */
  public boolean atLineStart() {
    return pos == lineStart;
  }

  // === Diagnostics ===

  /** Computes the 1-based line and column of the current offset. */
  public TextPosition position() {
    int line = 1;
    int column = 1;
    for (int i = 0; i < pos && i < input.length(); i++) {
      char c = input.charAt(i);
      if (c == '\n' || (c == '\r' && charAt(i + 1) != '\n')) {
        line++;
        column = 1;
      } else if (c != '\r') {
        column++;
      }
    }
    return new TextPosition(line, column);
  }

  /** Renders the current character for messages, or "end of input" past the last one. */
  public String describeCurrent() {
    return atEnd() ? "end of input" : CharClasses.describe(peek());
  }

  /** Creates a syntax error located at the current offset; the caller throws it. */
  public BrouwerSyntaxException error(String reason) {
    return new BrouwerSyntaxException(reason, position());
  }

  private char charAt(int index) {
    return index < input.length() ? input.charAt(index) : EOF;
  }

  private static void requireNonEmpty(String text, String what) {
    if (text == null || text.isEmpty()) {
      throw new IllegalArgumentException("empty " + what);
    }
  }
}
