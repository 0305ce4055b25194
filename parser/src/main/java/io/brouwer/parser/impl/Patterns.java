package io.brouwer.parser.impl;

import static io.brouwer.parser.ast.NodeKind.PARAM;
import static io.brouwer.parser.ast.NodeKind.PATTERN;

import io.brouwer.parser.ast.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Destructuring patterns and function parameters.
 *
 * <p>A pattern is parsed either <em>committed</em>, where a malformed bracketed pattern is a syntax
 * error, or <em>tentative</em>, where it is merely absent so that the caller can try another
 * reading of the same text. Assignments and generators parse their left-hand side tentatively
 * because {@code (a, b)} may just as well start a tuple expression.
 */
final class Patterns {

  private final Cursor cursor;
  private final NestingGuard guard;
  private final Lexemes lex;

  Patterns(Cursor cursor, NestingGuard guard, Lexemes lex) {
    this.cursor = cursor;
    this.guard = guard;
    this.lex = lex;
  }

  Node pattern(boolean tentative) {
    guard.enter();
    try {
      Cursor.Mark start = cursor.mark();
      Node simple = simplePattern();
      if (simple != null) {
        return Node.of(PATTERN, simple);
      }
      Node lp = lex.lParen();
      if (lp != null) {
        return tuplePattern(start, lp, tentative);
      }
      Node ls = lex.lSquare();
      if (ls != null) {
        return listPattern(start, ls, tentative);
      }
      Node lc = lex.lCurly();
      if (lc != null) {
        return bracedPattern(start, lc, tentative);
      }
      return null;
    } finally {
      guard.exit();
    }
  }

  private Node simplePattern() {
    Node node = lex.ident();
    if (node == null) {
      node = lex.chrLit();
    }
    if (node == null) {
      node = lex.strLit();
    }
    if (node == null) {
      node = lex.numLit();
    }
    if (node == null) {
      node = lex.underscore();
    }
    return node;
  }

  private Node tuplePattern(Cursor.Mark start, Node lp, boolean tentative) {
    List<Node> children = new ArrayList<>();
    children.add(lp);
    Node first = pattern(tentative);
    if (first != null) {
      Node comma = lex.comma();
      if (comma == null) {
        return fail(start, tentative, "expected comma after first element of pattern tuple");
      }
      Node second = pattern(tentative);
      if (second == null) {
        return fail(start, tentative, "expected 0 or at least 2 elements in pattern tuple");
      }
      children.add(first);
      children.add(comma);
      children.add(second);
      lex.commaSeparated(children, () -> pattern(tentative));
    }
    Node rp = lex.rParen();
    if (rp == null) {
      return fail(start, tentative, "left paren in pattern requires )");
    }
    children.add(rp);
    return Node.of(PATTERN, children);
  }

  private Node listPattern(Cursor.Mark start, Node ls, boolean tentative) {
    List<Node> children = new ArrayList<>();
    children.add(ls);
    Node first = pattern(tentative);
    if (first != null) {
      children.add(first);
      lex.commaSeparated(children, () -> pattern(tentative));
    }
    Node rs = lex.rSquare();
    if (rs == null) {
      return fail(start, tentative, "left square bracket in pattern requires ]");
    }
    children.add(rs);
    return Node.of(PATTERN, children);
  }

  /** {@code {}}, a set pattern {@code {a, b}} or a dict pattern {@code {k = v, ...}}. */
  private Node bracedPattern(Cursor.Mark start, Node lc, boolean tentative) {
    List<Node> children = new ArrayList<>();
    children.add(lc);
    Node firstKey = pattern(tentative);
    if (firstKey != null) {
      Node eq = lex.equalsSign();
      if (eq != null) {
        Node value = pattern(tentative);
        if (value == null) {
          return fail(start, tentative, "expected value pattern after first = of dict pattern");
        }
        children.add(firstKey);
        children.add(eq);
        children.add(value);
        while (true) {
          Cursor.Mark beforeComma = cursor.mark();
          Node comma = lex.comma();
          if (comma == null) {
            break;
          }
          Node key = pattern(tentative);
          if (key == null) {
            cursor.reset(beforeComma);
            break;
          }
          Node nextEq = lex.equalsSign();
          if (nextEq == null) {
            return fail(start, tentative, "expected = after key of dict pattern");
          }
          Node nextValue = pattern(tentative);
          if (nextValue == null) {
            return fail(start, tentative, "expected value pattern after = of dict pattern");
          }
          children.add(comma);
          children.add(key);
          children.add(nextEq);
          children.add(nextValue);
        }
      } else {
        children.add(firstKey);
        lex.commaSeparated(children, () -> pattern(tentative));
        Cursor.Mark afterElements = cursor.mark();
        if (lex.equalsSign() != null) {
          cursor.reset(afterElements);
          return fail(start, tentative, "cannot mix set and dict entries in a pattern");
        }
      }
    }
    Node rc = lex.rCurly();
    if (rc == null) {
      return fail(start, tentative, "left curly bracket in pattern requires }");
    }
    children.add(rc);
    return Node.of(PATTERN, children);
  }

  private Node fail(Cursor.Mark start, boolean tentative, String reason) {
    if (tentative) {
      cursor.reset(start);
      return null;
    }
    throw cursor.error(reason);
  }

  /** A plain pattern, or a typed parameter {@code (pattern: Type)}. */
  Node param() {
    Cursor.Mark start = cursor.mark();
    Node lp = lex.lParen();
    if (lp != null) {
      Node pat = pattern(true);
      Node colon = pat == null ? null : lex.colon();
      if (colon != null) {
        Node type = lex.typeIdent();
        if (type == null) {
          throw cursor.error("expected type");
        }
        Node rp = lex.rParen();
        if (rp == null) {
          throw cursor.error("expected ) after type");
        }
        return Node.of(PARAM, lp, pat, colon, type, rp);
      }
      cursor.reset(start);
    }
    Node pat = pattern(false);
    return pat == null ? null : Node.of(PARAM, pat);
  }
}
