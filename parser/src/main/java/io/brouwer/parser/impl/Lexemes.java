package io.brouwer.parser.impl;

import static io.brouwer.parser.ast.NodeKind.*;
import static io.brouwer.parser.impl.CharClasses.isDigit;
import static io.brouwer.parser.impl.CharClasses.isEscapable;
import static io.brouwer.parser.impl.CharClasses.isIdentifierPart;
import static io.brouwer.parser.impl.CharClasses.isIdentifierStart;
import static io.brouwer.parser.impl.CharClasses.isOperatorChar;

import io.brouwer.parser.ast.Node;
import io.brouwer.parser.ast.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Token-level productions: keywords, punctuation, identifiers, type identifiers and literals.
 *
 * <p>Each method skips leading blanks, then either returns a node or returns {@code null} with the
 * cursor exactly where it was before the call.
 */
final class Lexemes {

  private static final Map<String, NodeKind> KEYWORDS =
      Map.ofEntries(
          Map.entry("module", MODULE_KEYWORD),
          Map.entry("exposing", EXPOSING_KEYWORD),
          Map.entry("hiding", HIDING_KEYWORD),
          Map.entry("import", IMPORT_KEYWORD),
          Map.entry("as", AS_KEYWORD),
          Map.entry("fn", FN_KEYWORD),
          Map.entry("case", CASE_KEYWORD),
          Map.entry("if", IF_KEYWORD),
          Map.entry("else", ELSE_KEYWORD),
          Map.entry("try", TRY_KEYWORD),
          Map.entry("catch", CATCH_KEYWORD),
          Map.entry("while", WHILE_KEYWORD),
          Map.entry("for", FOR_KEYWORD),
          Map.entry("in", IN_KEYWORD),
          Map.entry("var", VAR_KEYWORD),
          Map.entry("return", RETURN_KEYWORD));

  private final Cursor cursor;
  private final NestingGuard guard;
  private final BracketScope scope;

  Lexemes(Cursor cursor, NestingGuard guard, BracketScope scope) {
    this.cursor = cursor;
    this.guard = guard;
    this.scope = scope;
  }

  // === Keywords and punctuation ===

  Node keyword(String word) {
    NodeKind kind = KEYWORDS.get(word);
    if (kind == null) {
      throw new IllegalArgumentException("Not a keyword: " + word);
    }
    Cursor.Mark mark = cursor.mark();
    cursor.skipBlanks();
    if (cursor.expectKeyword(word)) {
      return Node.leaf(kind, word);
    }
    cursor.reset(mark);
    return null;
  }

  Node comma() {
    return punct(',', COMMA);
  }

  Node lParen() {
    return punct('(', L_PAREN);
  }

  Node rParen() {
    return punct(')', R_PAREN);
  }

  Node lSquare() {
    return punct('[', L_SQ_BRACKET);
  }

  Node rSquare() {
    return punct(']', R_SQ_BRACKET);
  }

  Node lCurly() {
    return punct('{', L_CURLY_BRACKET);
  }

  Node rCurly() {
    return punct('}', R_CURLY_BRACKET);
  }

  Node backslash() {
    return punct('\\', BACKSLASH);
  }

  Node underscore() {
    Cursor.Mark mark = cursor.mark();
    cursor.skipBlanks();
    if (cursor.peek() == '_' && !isIdentifierPart(cursor.peek(1))) {
      cursor.advance();
      return Node.leaf(UNDERSCORE, "_");
    }
    cursor.reset(mark);
    return null;
  }

  Node equalsSign() {
    return symbol("=", EQUALS);
  }

  Node colon() {
    return symbol(":", COLON);
  }

  Node bar() {
    return symbol("|", BAR);
  }

  Node lArrow() {
    return symbol("<-", L_ARROW);
  }

  Node rArrow() {
    return symbol("->", R_ARROW);
  }

  Node fatArrow() {
    return symbol("=>", FAT_R_ARROW);
  }

  /**
   * Parses {@code element} repeatedly, each occurrence preceded by a comma, appending comma and
   * element to {@code into}. A trailing comma without an element is left unconsumed.
   */
  void commaSeparated(List<Node> into, Supplier<Node> element) {
    while (true) {
      Cursor.Mark beforeComma = cursor.mark();
      Node comma = comma();
      if (comma == null) {
        return;
      }
      Node next = element.get();
      if (next == null) {
        cursor.reset(beforeComma);
        return;
      }
      into.add(comma);
      into.add(next);
    }
  }

  private Node punct(char c, NodeKind kind) {
    Cursor.Mark mark = cursor.mark();
    cursor.skipBlanks();
    if (cursor.expectChar(c)) {
      return Node.leaf(kind, String.valueOf(c));
    }
    cursor.reset(mark);
    return null;
  }

  private Node symbol(String op, NodeKind kind) {
    Cursor.Mark mark = cursor.mark();
    cursor.skipBlanks();
    if (cursor.expectOp(op)) {
      return Node.leaf(kind, op);
    }
    cursor.reset(mark);
    return null;
  }

  // === Identifiers ===

  Node ident() {
    Cursor.Mark mark = cursor.mark();
    cursor.skipBlanks();
    char first = cursor.peek();
    if (!isIdentifierStart(first)) {
      cursor.reset(mark);
      return null;
    }
    // a lone underscore is the wildcard, not an identifier
    if (first == '_' && !isIdentifierPart(cursor.peek(1))) {
      cursor.reset(mark);
      return null;
    }
    StringBuilder sb = new StringBuilder();
    sb.append(cursor.advance());
    while (isIdentifierPart(cursor.peek())) {
      sb.append(cursor.advance());
    }
    String name = sb.toString();
    if (name.equals("NaN") || name.equals("Infinity")) {
      cursor.reset(mark);
      return null;
    }
    return Node.leaf(IDENT, name);
  }

  /** An identifier, a member access chain {@code a.b.c} or a scope chain {@code A::B::c}. */
  Node qualIdent() {
    Node first = ident();
    if (first == null) {
      return null;
    }
    Node chain;
    if (cursor.lookingAt(".")) {
      chain = chain(first, ".", DOT, MEMBER_IDENT, "expected identifier after dot operator");
    } else if (cursor.lookingAt("::")) {
      chain = chain(first, "::", DOUBLE_COLON, SCOPED_IDENT, "expected identifier after ::");
    } else {
      chain = first;
    }
    return Node.of(QUAL_IDENT, chain);
  }

  /** An identifier or a scope chain; member access is not allowed in a namespace. */
  Node namespacedIdent() {
    Node first = ident();
    if (first == null) {
      return null;
    }
    Node chain =
        cursor.lookingAt("::")
            ? chain(first, "::", DOUBLE_COLON, SCOPED_IDENT, "expected identifier after ::")
            : first;
    return Node.of(NAMESPACED_IDENT, chain);
  }

  // separators bind to the preceding identifier without blanks in between
  private Node chain(Node first, String sep, NodeKind sepKind, NodeKind chainKind, String missing) {
    List<Node> children = new ArrayList<>();
    children.add(first);
    while (cursor.expectOp(sep)) {
      Node next = ident();
      if (next == null) {
        throw cursor.error(missing);
      }
      children.add(Node.leaf(sepKind, sep));
      children.add(next);
    }
    return children.size() == 1 ? first : Node.of(chainKind, children);
  }

  /** A named type, a tuple type {@code (A, B)}, a list type {@code [A]} or a dict/set type. */
  Node typeIdent() {
    guard.enter();
    try {
      Node named = namespacedIdent();
      if (named != null) {
        return Node.of(TYPE_IDENT, named);
      }
      Node lp = lParen();
      if (lp != null) {
        return tupleType(lp);
      }
      Node ls = lSquare();
      if (ls != null) {
        Node element = typeIdent();
        if (element == null) {
          throw cursor.error("expected type identifier after [");
        }
        Node rs = rSquare();
        if (rs == null) {
          throw cursor.error("expected closing ] of list type");
        }
        return Node.of(TYPE_IDENT, ls, element, rs);
      }
      Node lc = lCurly();
      if (lc != null) {
        return bracedType(lc);
      }
      return null;
    } finally {
      guard.exit();
    }
  }

  private Node tupleType(Node lp) {
    List<Node> children = new ArrayList<>();
    children.add(lp);
    Node first = typeIdent();
    if (first != null) {
      Node comma = comma();
      if (comma == null) {
        throw cursor.error("expected comma after first type tuple element");
      }
      Node second = typeIdent();
      if (second == null) {
        throw cursor.error("expected 0 or at least 2 elements in type tuple");
      }
      children.add(first);
      children.add(comma);
      children.add(second);
      commaSeparated(children, this::typeIdent);
    }
    Node rp = rParen();
    if (rp == null) {
      throw cursor.error("expected right paren to terminate type tuple");
    }
    children.add(rp);
    return Node.of(TYPE_IDENT, children);
  }

  private Node bracedType(Node lc) {
    List<Node> children = new ArrayList<>();
    children.add(lc);
    Node key = typeIdent();
    if (key == null) {
      throw cursor.error("expected type identifier after {");
    }
    children.add(key);
    Node comma = comma();
    if (comma != null) {
      Node value = typeIdent();
      if (value == null) {
        throw cursor.error("expected type identifier after ,");
      }
      children.add(comma);
      children.add(value);
    }
    Node rc = rCurly();
    if (rc == null) {
      throw cursor.error("expected closing } of dict/set type");
    }
    children.add(rc);
    return Node.of(TYPE_IDENT, children);
  }

  // === Literals ===

  /**
   * An integer or real literal with an optional leading minus. A minus not followed by a number is
   * left for the operator production.
   */
  Node numLit() {
    Cursor.Mark mark = cursor.mark();
    cursor.skipBlanks();
    List<Node> children = new ArrayList<>(2);
    if (cursor.expectOp("-")) {
      children.add(Node.leaf(MINUS, "-"));
      cursor.skipBlanks();
    }
    if (cursor.expectKeyword("NaN")) {
      children.add(Node.leaf(NAN_KEYWORD, "NaN"));
      return Node.of(NUM_LIT, Node.of(REAL_LIT, children));
    }
    if (cursor.expectKeyword("Infinity")) {
      children.add(Node.leaf(INFINITY_KEYWORD, "Infinity"));
      return Node.of(NUM_LIT, Node.of(REAL_LIT, children));
    }
    if (!isDigit(cursor.peek())) {
      cursor.reset(mark);
      return null;
    }
    StringBuilder digits = new StringBuilder();
    while (isDigit(cursor.peek())) {
      digits.append(cursor.advance());
    }
    if (cursor.peek() != '.') {
      children.add(Node.leaf(ABS_INT, digits.toString()));
      return Node.of(NUM_LIT, Node.of(INT_LIT, children));
    }
    digits.append(cursor.advance());
    if (!isDigit(cursor.peek())) {
      throw cursor.error("expected at least one digit after decimal point");
    }
    while (isDigit(cursor.peek())) {
      digits.append(cursor.advance());
    }
    children.add(Node.leaf(ABS_REAL, digits.toString()));
    return Node.of(NUM_LIT, Node.of(REAL_LIT, children));
  }

  Node chrLit() {
    Cursor.Mark mark = cursor.mark();
    cursor.skipBlanks();
    if (!cursor.expectChar('\'')) {
      cursor.reset(mark);
      return null;
    }
    Node ch = literalChar('\'', CHR_CHR);
    if (ch == null) {
      throw cursor.error("unexpected ' or EOF");
    }
    if (!cursor.expectChar('\'')) {
      throw cursor.error("expected ', got: " + cursor.describeCurrent());
    }
    return Node.of(CHR_LIT, Node.leaf(SINGLE_QUOTE, "'"), ch, Node.leaf(SINGLE_QUOTE, "'"));
  }

  Node strLit() {
    Cursor.Mark mark = cursor.mark();
    cursor.skipBlanks();
    if (!cursor.expectChar('"')) {
      cursor.reset(mark);
      return null;
    }
    List<Node> children = new ArrayList<>();
    children.add(Node.leaf(DOUBLE_QUOTE, "\""));
    Node ch;
    while ((ch = literalChar('"', STR_CHR)) != null) {
      children.add(ch);
    }
    if (!cursor.expectChar('"')) {
      throw cursor.error("unterminated string literal");
    }
    children.add(Node.leaf(DOUBLE_QUOTE, "\""));
    return Node.of(STR_LIT, children);
  }

  /** One raw character or backslash escape; {@code null} at the terminator or end of input. */
  private Node literalChar(char terminator, NodeKind kind) {
    if (cursor.atEnd() || cursor.peek() == terminator) {
      return null;
    }
    char c = cursor.advance();
    if (c != '\\') {
      return Node.leaf(kind, String.valueOf(c));
    }
    char escaped = cursor.peek();
    if (cursor.atEnd()) {
      throw cursor.error("invalid escape sequence at end of input");
    }
    if (!isEscapable(escaped)) {
      throw cursor.error("invalid escape sequence \\" + CharClasses.describe(escaped));
    }
    cursor.advance();
    return Node.leaf(kind, "\\" + escaped);
  }

  // === Operators ===

  /** A backtick-quoted identifier used as an infix operator. */
  Node infixed() {
    Cursor.Mark mark = cursor.mark();
    cursor.skipBlanks();
    if (!cursor.expectChar('`')) {
      cursor.reset(mark);
      return null;
    }
    Node name = qualIdent();
    if (name == null) {
      throw cursor.error("expected identifier after `");
    }
    if (!cursor.expectChar('`')) {
      throw cursor.error("expected closing `");
    }
    return Node.of(INFIXED, Node.leaf(BACKTICK, "`"), name, Node.leaf(BACKTICK, "`"));
  }

  /**
   * A maximal run of operator characters. A comment opener or a spelling the enclosing bracket is
   * waiting for is absent; any other reserved spelling is an error.
   */
  Node operator() {
    Cursor.Mark mark = cursor.mark();
    cursor.skipBlanks();
    Cursor.Mark start = cursor.mark();
    StringBuilder sb = new StringBuilder();
    while (isOperatorChar(cursor.peek())) {
      sb.append(cursor.advance());
    }
    String op = sb.toString();
    if (op.isEmpty() || op.equals("--") || scope.terminates(op)) {
      cursor.reset(mark);
      return null;
    }
    if (CharClasses.isReservedOperator(op)) {
      cursor.reset(start);
      throw cursor.error("the operator " + op + " is reserved");
    }
    return Node.leaf(OP, op);
  }
}
