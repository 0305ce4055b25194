package io.brouwer.parser.impl;

import static io.brouwer.parser.impl.CharClasses.isBlank;
import static io.brouwer.parser.impl.CharClasses.isNewline;

import io.brouwer.parser.api.LeadingWhitespaceException;
import io.brouwer.parser.ast.Node;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Layout rule: a block body is delimited purely by a deeper, consistent run of leading blanks.
 *
 * <p>Indentation is compared as literal text. A body belongs to its header when the body's blank
 * run is strictly longer than the header's and starts with it; a tab is never equivalent to any
 * number of spaces. Blank lines and comment-only lines do not take part in layout.
 */
public final class IndentationEngine {

  private static final Logger LOG = LoggerFactory.getLogger(IndentationEngine.class);

  private final Cursor cursor;

  public IndentationEngine(Cursor cursor) {
    this.cursor = cursor;
  }

  /**
   * Skips blank and comment lines at the start of the source.
   *
   * @throws LeadingWhitespaceException if the first token is preceded by blanks on its line
   */
  public void rejectLeadingWhitespace() {
    boolean blanksOnLine = false;
    while (true) {
      char c = cursor.peek();
      if (isBlank(c)) {
        blanksOnLine = true;
        cursor.advance();
      } else if (isNewline(c)) {
        blanksOnLine = false;
        cursor.advance();
      } else if (!cursor.skipLineComment()) {
        break;
      }
    }
    if (blanksOnLine && !cursor.atEnd()) {
      throw new LeadingWhitespaceException(
          "source must not start with leading whitespace", cursor.position());
    }
    cursor.beginLine("");
  }

  /**
   * Requires the current top-level line to start in the first column.
   *
   * @throws LeadingWhitespaceException if the line is indented
   */
  public void rejectIndentedTopLevel() {
    if (!cursor.indentation().isEmpty()) {
      throw new LeadingWhitespaceException(
          "line must not start with leading whitespace", cursor.position());
    }
  }

  /**
   * Consumes an optional trailing comment, then one or more line breaks and the blank run of the
   * next non-blank line, which becomes the current indentation. The end of input counts as a line
   * break with empty indentation.
   *
   * <p>If a nested block already consumed the break, the cursor sits at the start of a fresh line
   * and this succeeds without consuming anything.
   *
   * @return whether a line break was found
   */
  public boolean expectNewline() {
    cursor.skipBlanks();
    cursor.skipLineComment();
    if (cursor.atLineStart()) {
      return true;
    }
    if (cursor.atEnd()) {
      cursor.beginLine("");
      return true;
    }
    if (!isNewline(cursor.peek())) {
      return false;
    }
    StringBuilder indent = new StringBuilder();
    while (true) {
      char c = cursor.peek();
      if (isNewline(c)) {
        indent.setLength(0);
        cursor.advance();
      } else if (isBlank(c)) {
        indent.append(c);
        cursor.advance();
      } else if (!cursor.skipLineComment()) {
        break;
      }
    }
    cursor.beginLine(cursor.atEnd() ? "" : indent.toString());
    return true;
  }

  /**
   * Parses an indented block after a construct's header.
   *
   * <p>The line after the header fixes the block indentation; it must extend {@code headerIndent}.
   * Items are parsed while lines keep exactly that indentation. The first line with any other
   * indentation ends the block and stays current for the caller.
   *
   * @param headerIndent indentation of the line holding the header
   * @param item parses one body item, or returns {@code null} when none starts here
   * @param into receives the parsed items
   * @return {@code headerIndent}, so callers can test whether a continuation keyword such as
   *     {@code else} sits at the header's depth
   */
  public String block(String headerIndent, Supplier<Node> item, List<Node> into) {
    if (!expectNewline()) {
      throw cursor.error("expected newline after header");
    }
    String blockIndent = cursor.indentation();
    if (blockIndent.length() <= headerIndent.length() || !blockIndent.startsWith(headerIndent)) {
      throw cursor.error("improper indentation after header");
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Block opened at {} with indentation {}", cursor.position(), blockIndent.length());
    }

    Node first = item.get();
    if (first == null) {
      throw cursor.error("expected at least one item in block");
    }
    into.add(first);
    if (!expectNewline()) {
      throw cursor.error("expected newline after first item of block");
    }

    while (cursor.indentation().equals(blockIndent)) {
      Node next = item.get();
      if (next == null) {
        throw cursor.error("expected item in block");
      }
      into.add(next);
      if (!expectNewline()) {
        throw cursor.error("expected newline after block item");
      }
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Block closed at {}", cursor.position());
    }
    return headerIndent;
  }
}
