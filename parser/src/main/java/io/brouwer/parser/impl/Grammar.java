package io.brouwer.parser.impl;

import static io.brouwer.parser.ast.NodeKind.*;

import io.brouwer.parser.api.EmptyProgramException;
import io.brouwer.parser.api.ParserOptions;
import io.brouwer.parser.ast.Node;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent grammar for brouwer source files.
 *
 * <p>Every production follows the same contract: it returns the parsed node, or returns {@code
 * null} when its distinguishing prefix is not present (the cursor is then back where it started),
 * or throws {@link io.brouwer.parser.api.BrouwerSyntaxException} once the prefix matched and a
 * required continuation is missing. Alternatives of an expression are tried in a fixed order and
 * the first one that produces a node wins.
 *
 * <p>Several alternatives share a prefix: {@code (e)} and {@code (e, f)}, or the dict, set and
 * comprehension forms behind an opening curly bracket. The same subexpression is therefore
 * requested repeatedly from the same place, so its outcome is memoized per cursor state and
 * bracket scope. Nested brackets then cost polynomial rather than exponential time in their depth.
 *
 * <p>An instance parses a single source and is not reusable.
 */
public final class Grammar {

  /** Everything a subexpression's outcome depends on. */
  private record SubexprKey(Cursor.Mark start, Set<String> terminators) {}

  /** A memoized outcome: the node, or {@code null} for absence, and where the cursor ended. */
  private record SubexprResult(Node node, Cursor.Mark end) {}

  private final Cursor cursor;
  private final IndentationEngine layout;
  private final NestingGuard guard;
  private final BracketScope scope;
  private final Lexemes lex;
  private final Patterns patterns;
  private final List<Supplier<Node>> subexpressions;
  private final Map<SubexprKey, SubexprResult> parsedSubexprs = new HashMap<>();

  public Grammar(Cursor cursor, ParserOptions options) {
    this.cursor = cursor;
    this.layout = new IndentationEngine(cursor);
    this.guard = new NestingGuard(cursor, options.maxDepth());
    this.scope = new BracketScope();
    this.lex = new Lexemes(cursor, guard, scope);
    this.patterns = new Patterns(cursor, guard, lex);
    this.subexpressions =
        List.of(
            this::varBinding,
            this::assignment,
            this::fnDecl,
            this::parened,
            this::returnExpr,
            this::caseExpr,
            this::ifElse,
            this::tryCatch,
            this::whileLoop,
            this::forLoop,
            this::lambda,
            this::tupleLit,
            this::listLit,
            this::listComp,
            this::dictLit,
            this::dictComp,
            this::setLit,
            this::setComp,
            lex::qualIdent,
            lex::infixed,
            lex::numLit,
            lex::chrLit,
            lex::strLit,
            lex::operator);
  }

  /**
   * Parses the whole source.
   *
   * @throws EmptyProgramException if the source holds no module declaration
   */
  public Node parseRoot() {
    layout.rejectLeadingWhitespace();
    Node prog = prog();
    if (prog == null) {
      throw new EmptyProgramException("parse failed");
    }
    return Node.of(ROOT, prog);
  }

  // === Program structure ===

  private Node prog() {
    Node mod = modDecl();
    if (mod == null) {
      return null;
    }
    List<Node> children = new ArrayList<>();
    children.add(mod);
    while (!cursor.atEnd()) {
      layout.rejectIndentedTopLevel();
      Node imp = importDecl();
      if (imp == null) {
        break;
      }
      children.add(imp);
    }
    while (!cursor.atEnd()) {
      layout.rejectIndentedTopLevel();
      Node line = line(true);
      if (line == null) {
        cursor.skipBlanks();
        throw cursor.error("unexpected character " + cursor.describeCurrent());
      }
      children.add(line);
    }
    return Node.of(PROG, children);
  }

  private Node modDecl() {
    Node kw = lex.keyword("module");
    if (kw == null) {
      return null;
    }
    Node name = lex.ident();
    if (name == null) {
      throw cursor.error("expected name of module to be plain identifier");
    }
    List<Node> children = new ArrayList<>();
    children.add(kw);
    children.add(name);
    Node listKw = lex.keyword("exposing");
    if (listKw == null) {
      listKw = lex.keyword("hiding");
    }
    if (listKw != null) {
      Node first = lex.ident();
      if (first == null) {
        throw cursor.error("expected at least one item in module export/hide list");
      }
      children.add(listKw);
      children.add(first);
      lex.commaSeparated(children, lex::ident);
    }
    if (!layout.expectNewline()) {
      throw cursor.error("expected newline after module declaration");
    }
    return Node.of(MOD_DECL, children);
  }

  private Node importDecl() {
    Node kw = lex.keyword("import");
    if (kw == null) {
      return null;
    }
    Node name = lex.ident();
    if (name == null) {
      throw cursor.error("expected module name after import keyword");
    }
    List<Node> children = new ArrayList<>();
    children.add(kw);
    children.add(name);
    Node as = lex.keyword("as");
    if (as != null) {
      Node alias = lex.ident();
      if (alias == null) {
        throw cursor.error("expected namespace alias after as keyword");
      }
      children.add(as);
      children.add(alias);
    } else {
      Node hiding = lex.keyword("hiding");
      if (hiding != null) {
        children.add(hiding);
      }
      Node lp = lex.lParen();
      if (lp == null) {
        throw cursor.error("expected left paren to start import list");
      }
      Node first = lex.ident();
      if (first == null) {
        throw cursor.error("expected at least one import item in import list");
      }
      children.add(lp);
      children.add(first);
      lex.commaSeparated(children, lex::ident);
      Node rp = lex.rParen();
      if (rp == null) {
        throw cursor.error("expected right paren to terminate import list");
      }
      children.add(rp);
    }
    if (!layout.expectNewline()) {
      throw cursor.error("expected newline after import statement");
    }
    return Node.of(IMPORT, children);
  }

  /**
   * An expression forming one line.
   *
   * @param consumeNewline whether this line owns its line break; block items leave it to the
   *     enclosing block
   */
  private Node line(boolean consumeNewline) {
    Node expr = expr();
    if (expr == null) {
      return null;
    }
    if (consumeNewline) {
      layout.expectNewline();
    }
    return Node.of(LINE, expr);
  }

  private Node blockLine() {
    return scope.within(BracketScope.NONE, () -> line(false));
  }

  // === Expressions ===

  Node expr() {
    guard.enter();
    try {
      Node first = subexpr();
      if (first == null) {
        return null;
      }
      List<Node> children = new ArrayList<>();
      children.add(first);
      // a block-bearing subexpression leaves the cursor on the next line
      while (!cursor.atLineStart()) {
        Node next = subexpr();
        if (next == null) {
          break;
        }
        children.add(next);
      }
      return Node.of(EXPR, children);
    } finally {
      guard.exit();
    }
  }

  private Node subexpr() {
    Cursor.Mark start = cursor.mark();
    SubexprKey key = new SubexprKey(start, scope.current());
    SubexprResult result = parsedSubexprs.get(key);
    if (result == null) {
      Node node = firstAlternative();
      result = new SubexprResult(node, cursor.mark());
      parsedSubexprs.put(key, result);
    }
    cursor.reset(result.end());
    return result.node();
  }

  private Node firstAlternative() {
    for (Supplier<Node> alternative : subexpressions) {
      Cursor.Mark mark = cursor.mark();
      Node node = alternative.get();
      if (node != null) {
        return node;
      }
      cursor.reset(mark);
    }
    return null;
  }

  private Node varBinding() {
    Node kw = lex.keyword("var");
    if (kw == null) {
      return null;
    }
    Node pat = patterns.pattern(false);
    if (pat == null) {
      throw cursor.error("expected pattern after var keyword");
    }
    List<Node> children = new ArrayList<>();
    children.add(kw);
    children.add(pat);
    Node colon = lex.colon();
    if (colon != null) {
      Node type = lex.typeIdent();
      if (type == null) {
        throw cursor.error("type of binding must be a valid identifier");
      }
      children.add(colon);
      children.add(type);
    }
    Node eq = lex.equalsSign();
    if (eq == null) {
      throw cursor.error("expected = in var binding");
    }
    Node rhs = expr();
    if (rhs == null) {
      throw cursor.error("right-hand side of assignment must be a valid expression");
    }
    children.add(eq);
    children.add(rhs);
    return Node.of(VAR, children);
  }

  private Node assignment() {
    if (scope.terminates("=")) {
      return null;
    }
    Cursor.Mark start = cursor.mark();
    Node pat = patterns.pattern(true);
    if (pat == null) {
      return null;
    }
    List<Node> children = new ArrayList<>();
    children.add(pat);
    Node colon = lex.colon();
    if (colon != null) {
      Node type = lex.typeIdent();
      if (type == null) {
        throw cursor.error("type of binding must be a valid identifier");
      }
      children.add(colon);
      children.add(type);
    }
    Node eq = lex.equalsSign();
    if (eq == null) {
      cursor.reset(start);
      return null;
    }
    Node rhs = expr();
    if (rhs == null) {
      throw cursor.error("right-hand side of assignment must be a valid expression");
    }
    children.add(eq);
    children.add(rhs);
    return Node.of(ASSIGN, children);
  }

  private Node returnExpr() {
    Node kw = lex.keyword("return");
    if (kw == null) {
      return null;
    }
    Node value = expr();
    if (value == null) {
      throw cursor.error("expected expression to return");
    }
    return Node.of(RETURN, kw, value);
  }

  private Node lambda() {
    Node bs = lex.backslash();
    if (bs == null) {
      return null;
    }
    Node first = patterns.param();
    if (first == null) {
      throw cursor.error("lambda expression requires 1+ args");
    }
    List<Node> children = new ArrayList<>();
    children.add(bs);
    children.add(first);
    lex.commaSeparated(children, patterns::param);
    Node arrow = lex.rArrow();
    if (arrow == null) {
      throw cursor.error("lambda expression requires ->");
    }
    Node body = expr();
    if (body == null) {
      throw cursor.error("lambda body must be expression");
    }
    children.add(arrow);
    children.add(body);
    return Node.of(LAMBDA, children);
  }

  // === Block constructs ===

  private Node fnDecl() {
    String header = cursor.indentation();
    Node kw = lex.keyword("fn");
    if (kw == null) {
      return null;
    }
    Node name = lex.ident();
    if (name == null) {
      throw cursor.error("expected function name");
    }
    List<Node> children = new ArrayList<>();
    children.add(kw);
    children.add(name);
    Node param;
    while ((param = patterns.param()) != null) {
      children.add(param);
    }
    Node arrow = lex.rArrow();
    if (arrow != null) {
      Node type = lex.typeIdent();
      if (type == null) {
        throw cursor.error("expected type after arrow");
      }
      children.add(arrow);
      children.add(type);
    }
    layout.block(header, this::blockLine, children);
    return Node.of(FN_DECL, children);
  }

  private Node caseExpr() {
    String header = cursor.indentation();
    Node kw = lex.keyword("case");
    if (kw == null) {
      return null;
    }
    Node subject = expr();
    if (subject == null) {
      throw cursor.error("expected subject expression for case");
    }
    List<Node> children = new ArrayList<>();
    children.add(kw);
    children.add(subject);
    layout.block(header, this::caseBranch, children);
    return Node.of(CASE, children);
  }

  private Node caseBranch() {
    return scope.within(
        BracketScope.NONE,
        () -> {
          Node pat = patterns.pattern(false);
          if (pat == null) {
            return null;
          }
          Node arrow = lex.fatArrow();
          if (arrow == null) {
            throw cursor.error("expected => while parsing case branch");
          }
          Node body = line(false);
          if (body == null) {
            throw cursor.error("expected expression(s) after =>");
          }
          return Node.of(CASE_BRANCH, pat, arrow, body);
        });
  }

  private Node ifElse() {
    String header = cursor.indentation();
    Node kw = lex.keyword("if");
    if (kw == null) {
      return null;
    }
    Node condition = expr();
    if (condition == null) {
      throw cursor.error("expected expression as if condition");
    }
    List<Node> children = new ArrayList<>();
    children.add(kw);
    children.add(condition);
    String headerIndent = layout.block(header, this::blockLine, children);
    if (!cursor.indentation().equals(headerIndent)) {
      return Node.of(IF_ELSE, children);
    }
    Node elseKw = lex.keyword("else");
    if (elseKw == null) {
      return Node.of(IF_ELSE, children);
    }
    children.add(elseKw);
    Node chained = ifElse();
    if (chained != null) {
      children.add(chained);
    } else {
      layout.block(headerIndent, this::blockLine, children);
    }
    return Node.of(IF_ELSE, children);
  }

  private Node tryCatch() {
    String header = cursor.indentation();
    Node kw = lex.keyword("try");
    if (kw == null) {
      return null;
    }
    List<Node> children = new ArrayList<>();
    children.add(kw);
    String headerIndent = layout.block(header, this::blockLine, children);
    if (!cursor.indentation().equals(headerIndent)) {
      throw cursor.error("try must have corresponding catch on same indent level");
    }
    Node catchKw = lex.keyword("catch");
    if (catchKw == null) {
      throw cursor.error("try must have corresponding catch");
    }
    Node caught = lex.ident();
    if (caught == null) {
      throw cursor.error("catch must name the caught exception");
    }
    children.add(catchKw);
    children.add(caught);
    layout.block(headerIndent, this::blockLine, children);
    return Node.of(TRY, children);
  }

  private Node whileLoop() {
    String header = cursor.indentation();
    Node kw = lex.keyword("while");
    if (kw == null) {
      return null;
    }
    Node condition = expr();
    if (condition == null) {
      throw cursor.error("expected expression as while condition");
    }
    List<Node> children = new ArrayList<>();
    children.add(kw);
    children.add(condition);
    layout.block(header, this::blockLine, children);
    return Node.of(WHILE, children);
  }

  private Node forLoop() {
    String header = cursor.indentation();
    Node kw = lex.keyword("for");
    if (kw == null) {
      return null;
    }
    Node pat = patterns.pattern(false);
    if (pat == null) {
      throw cursor.error("expected pattern as first part of for header");
    }
    Node in = lex.keyword("in");
    if (in == null) {
      throw cursor.error("missing in keyword of for loop");
    }
    Node iterable = expr();
    if (iterable == null) {
      throw cursor.error("for must iterate over an expression");
    }
    List<Node> children = new ArrayList<>();
    children.add(kw);
    children.add(pat);
    children.add(in);
    children.add(iterable);
    layout.block(header, this::blockLine, children);
    return Node.of(FOR, children);
  }

  // === Brackets and collections ===

  private Node parened() {
    Node lp = lex.lParen();
    if (lp == null) {
      return null;
    }
    return scope.within(
        BracketScope.NONE,
        () -> {
          Node inner = expr();
          if (inner == null) {
            return null;
          }
          Node rp = lex.rParen();
          return rp == null ? null : Node.of(PARENED, lp, inner, rp);
        });
  }

  private Node tupleLit() {
    Node lp = lex.lParen();
    if (lp == null) {
      return null;
    }
    return scope.within(
        BracketScope.NONE,
        () -> {
          List<Node> children = new ArrayList<>();
          children.add(lp);
          Node first = expr();
          if (first != null) {
            Node comma = lex.comma();
            if (comma == null) {
              throw cursor.error("expected comma after first tuple element");
            }
            Node second = expr();
            if (second == null) {
              throw cursor.error("expected 0 or at least 2 elements in tuple");
            }
            children.add(first);
            children.add(comma);
            children.add(second);
            lex.commaSeparated(children, this::expr);
          }
          Node rp = lex.rParen();
          if (rp == null) {
            throw cursor.error("expected right paren to terminate tuple");
          }
          children.add(rp);
          return Node.of(TUPLE_LIT, children);
        });
  }

  private Node listLit() {
    Node ls = lex.lSquare();
    if (ls == null) {
      return null;
    }
    return scope.within(
        BracketScope.SQUARE,
        () -> {
          List<Node> children = new ArrayList<>();
          children.add(ls);
          Node first = expr();
          if (first != null) {
            children.add(first);
            lex.commaSeparated(children, this::expr);
          }
          if (lex.bar() != null) {
            return null;
          }
          Node rs = lex.rSquare();
          if (rs == null) {
            throw cursor.error("left square bracket in list literal requires ]");
          }
          children.add(rs);
          return Node.of(LIST_LIT, children);
        });
  }

  private Node listComp() {
    Node ls = lex.lSquare();
    if (ls == null) {
      return null;
    }
    return scope.within(
        BracketScope.SQUARE,
        () -> {
          Node lhs = expr();
          if (lhs == null) {
            throw cursor.error("expected expression on left-hand side of list comprehension");
          }
          Node bar = lex.bar();
          if (bar == null) {
            throw cursor.error("expected | for list comprehension");
          }
          List<Node> children = new ArrayList<>();
          children.add(ls);
          children.add(lhs);
          children.add(bar);
          qualifiers(children);
          Node rs = lex.rSquare();
          if (rs == null) {
            throw cursor.error("expected ] to terminate list comprehension");
          }
          children.add(rs);
          return Node.of(LIST_COMP, children);
        });
  }

  private Node dictLit() {
    Node lc = lex.lCurly();
    if (lc == null) {
      return null;
    }
    return scope.within(
        BracketScope.CURLY,
        () -> {
          Node empty = lex.rCurly();
          if (empty != null) {
            return Node.of(DICT_LIT, lc, empty);
          }
          Node first = dictEntry();
          if (first == null) {
            return null;
          }
          List<Node> children = new ArrayList<>();
          children.add(lc);
          children.add(first);
          lex.commaSeparated(children, this::dictEntry);
          if (lex.bar() != null) {
            return null;
          }
          Node rc = lex.rCurly();
          if (rc == null) {
            throw cursor.error("left curly bracket in dict literal requires }");
          }
          children.add(rc);
          return Node.of(DICT_LIT, children);
        });
  }

  private Node dictComp() {
    Node lc = lex.lCurly();
    if (lc == null) {
      return null;
    }
    return scope.within(
        BracketScope.CURLY,
        () -> {
          Node entry = dictEntry();
          if (entry == null) {
            return null;
          }
          Node bar = lex.bar();
          if (bar == null) {
            throw cursor.error("expected | for dict comprehension");
          }
          List<Node> children = new ArrayList<>();
          children.add(lc);
          children.add(entry);
          children.add(bar);
          qualifiers(children);
          Node rc = lex.rCurly();
          if (rc == null) {
            throw cursor.error("expected } to terminate dict comprehension");
          }
          children.add(rc);
          return Node.of(DICT_COMP, children);
        });
  }

  private Node dictEntry() {
    Cursor.Mark start = cursor.mark();
    Node key = expr();
    if (key == null) {
      return null;
    }
    Node eq = lex.equalsSign();
    if (eq == null) {
      cursor.reset(start);
      return null;
    }
    Node value = expr();
    if (value == null) {
      throw cursor.error("expected expression to be assigned to dict key");
    }
    return Node.of(DICT_ENTRY, key, eq, value);
  }

  private Node setLit() {
    Node lc = lex.lCurly();
    if (lc == null) {
      return null;
    }
    return scope.within(
        BracketScope.CURLY,
        () -> {
          List<Node> children = new ArrayList<>();
          children.add(lc);
          Node first = expr();
          if (first != null) {
            children.add(first);
            lex.commaSeparated(children, this::expr);
          }
          if (lex.bar() != null) {
            return null;
          }
          Node rc = lex.rCurly();
          if (rc == null) {
            throw cursor.error("left curly bracket in set literal requires }");
          }
          children.add(rc);
          return Node.of(SET_LIT, children);
        });
  }

  private Node setComp() {
    Node lc = lex.lCurly();
    if (lc == null) {
      return null;
    }
    return scope.within(
        BracketScope.CURLY,
        () -> {
          Node lhs = expr();
          if (lhs == null) {
            throw cursor.error("expected expression on left-hand side of set comprehension");
          }
          Node bar = lex.bar();
          if (bar == null) {
            throw cursor.error("expected | for set comprehension");
          }
          List<Node> children = new ArrayList<>();
          children.add(lc);
          children.add(lhs);
          children.add(bar);
          qualifiers(children);
          Node rc = lex.rCurly();
          if (rc == null) {
            throw cursor.error("expected } to terminate set comprehension");
          }
          children.add(rc);
          return Node.of(SET_COMP, children);
        });
  }

  private void qualifiers(List<Node> into) {
    Node first = qualifier();
    if (first == null) {
      throw cursor.error("expected generator or condition after |");
    }
    into.add(first);
    lex.commaSeparated(into, this::qualifier);
  }

  private Node qualifier() {
    Node gen = generator();
    return gen != null ? gen : expr();
  }

  private Node generator() {
    Cursor.Mark start = cursor.mark();
    Node pat = patterns.pattern(true);
    if (pat == null) {
      return null;
    }
    Node arrow = lex.lArrow();
    if (arrow == null) {
      cursor.reset(start);
      return null;
    }
    Node source = expr();
    if (source == null) {
      throw cursor.error("expected expression after <-");
    }
    return Node.of(GENERATOR, pat, arrow, source);
  }
}
