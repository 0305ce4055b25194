package io.brouwer.parser.impl;

import static io.brouwer.parser.ast.NodeKind.*;
import static org.junit.jupiter.api.Assertions.*;

import io.brouwer.parser.api.BrouwerSyntaxException;
import io.brouwer.parser.api.EmptyProgramException;
import io.brouwer.parser.api.LeadingWhitespaceException;
import io.brouwer.parser.api.ParserOptions;
import io.brouwer.parser.ast.Node;
import io.brouwer.parser.ast.NodeKind;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GrammarTest {

  private static Node parse(String source) {
    return new Grammar(new Cursor(source), new ParserOptions(256)).parseRoot();
  }

  private static List<Node> lines(String body) {
    return parse("module Main\n" + body).child(0).childrenOf(LINE);
  }

  /** The subexpressions of the only line of {@code body}. */
  private static List<Node> expr(String body) {
    List<Node> lines = lines(body);
    assertEquals(1, lines.size(), () -> "lines: " + lines);
    return lines.get(0).child(0).children();
  }

  private static Node single(String body) {
    List<Node> subexprs = expr(body);
    assertEquals(1, subexprs.size(), () -> "subexpressions: " + subexprs);
    return subexprs.get(0);
  }

  private static String reason(String source) {
    return assertThrows(BrouwerSyntaxException.class, () -> parse(source)).getReason();
  }

  private static Node ident(String name) {
    return Node.of(QUAL_IDENT, Node.leaf(IDENT, name));
  }

  // ==================== Program structure ====================

  @Test
  void assignmentProgram() {
    Node root = parse("module Main\nx = 1\n");
    Node expected =
        Node.of(
            ROOT,
            Node.of(
                PROG,
                Node.of(MOD_DECL, Node.leaf(MODULE_KEYWORD, "module"), Node.leaf(IDENT, "Main")),
                Node.of(
                    LINE,
                    Node.of(
                        EXPR,
                        Node.of(
                            ASSIGN,
                            Node.of(PATTERN, Node.leaf(IDENT, "x")),
                            Node.leaf(EQUALS, "="),
                            Node.of(
                                EXPR,
                                Node.of(NUM_LIT, Node.of(INT_LIT, Node.leaf(ABS_INT, "1")))))))));
    assertEquals(expected, root);
  }

  @Test
  void moduleExportList() {
    Node mod = parse("module Main exposing main, helper\n").child(0).child(0);
    assertEquals(EXPOSING_KEYWORD, mod.child(2).kind());
    assertEquals(List.of("main", "helper"), texts(mod.childrenOf(IDENT)).subList(1, 3));
  }

  @Test
  void moduleWithoutTrailingNewline() {
    assertEquals(1, parse("module Main").child(0).childCount());
  }

  @Test
  void imports() {
    Node prog =
        parse("module Main\nimport List as L\nimport Dict hiding (get, put)\nimport Set (empty)\n")
            .child(0);
    List<Node> imports = prog.childrenOf(IMPORT);
    assertEquals(3, imports.size());
    assertEquals(AS_KEYWORD, imports.get(0).child(2).kind());
    assertEquals(HIDING_KEYWORD, imports.get(1).child(2).kind());
    assertEquals(L_PAREN, imports.get(2).child(2).kind());
  }

  @Test
  void importNeedsListOrAlias() {
    assertEquals("expected left paren to start import list", reason("module Main\nimport List\n"));
  }

  @Test
  void commentsAndBlankLinesAreIgnored() {
    List<Node> lines = lines("-- first\n\nx = 1 -- trailing\n\n   \ny = 2\n-- last");
    assertEquals(2, lines.size());
  }

  @Test
  void noModuleDeclarationIsEmptyProgram() {
    assertThrows(EmptyProgramException.class, () -> parse(""));
    assertThrows(EmptyProgramException.class, () -> parse("-- only a comment\n"));
    assertThrows(EmptyProgramException.class, () -> parse("x = 1\n"));
  }

  @Test
  void indentedTopLevelLine() {
    LeadingWhitespaceException e =
        assertThrows(LeadingWhitespaceException.class, () -> parse("module Main\n  x = 1\n"));
    assertEquals("line must not start with leading whitespace", e.getReason());
  }

  @Test
  void unparsableTopLevelInput() {
    assertEquals("unexpected character ')'", reason("module Main\nx )\n"));
  }

  // ==================== Functions and blocks ====================

  @Test
  void functionWithTypedParameter() {
    Node fn = single("fn f (x: Int) -> Int\n  return x\n");
    assertEquals(FN_DECL, fn.kind());
    assertEquals("f", fn.child(1).text());
    Node param = fn.child(2);
    assertEquals(PARAM, param.kind());
    assertEquals(R_ARROW, fn.child(3).kind());
    assertEquals(TYPE_IDENT, fn.child(4).kind());
    Node body = fn.child(5);
    assertEquals(LINE, body.kind());
    Node ret = body.child(0).child(0);
    assertEquals(RETURN, ret.kind());
    assertEquals(ident("x"), ret.child(1).child(0));
  }

  @Test
  void nestedBlocksReturnToOuterBlock() {
    Node fn = single("fn main\n  while go\n    step\n    more\n  done\n");
    List<Node> body = fn.childrenOf(LINE);
    assertEquals(2, body.size());
    Node loop = body.get(0).child(0).child(0);
    assertEquals(WHILE, loop.kind());
    assertEquals(2, loop.childrenOf(LINE).size());
    assertEquals(ident("done"), body.get(1).child(0).child(0));
  }

  @Test
  void lineAfterBlockIsSeparate() {
    List<Node> lines = lines("fn main\n  run\nx = 1\n");
    assertEquals(2, lines.size());
    assertEquals(FN_DECL, lines.get(0).child(0).child(0).kind());
    assertEquals(1, lines.get(0).child(0).childCount());
    assertEquals(ASSIGN, lines.get(1).child(0).child(0).kind());
  }

  @Test
  void ifElse() {
    Node node = single("if x\n  1\nelse\n  2\n");
    assertEquals(
        List.of(IF_KEYWORD, EXPR, LINE, ELSE_KEYWORD, LINE), kinds(node.children()));
  }

  @Test
  void ifWithoutElse() {
    List<Node> lines = lines("if x\n  1\ny\n");
    assertEquals(2, lines.size());
    assertEquals(3, lines.get(0).child(0).child(0).childCount());
  }

  @Test
  void elseIfChain() {
    Node node = single("if a\n  1\nelse if b\n  2\nelse\n  3\n");
    Node chained = node.child(4);
    assertEquals(IF_ELSE, chained.kind());
    assertEquals(
        List.of(IF_KEYWORD, EXPR, LINE, ELSE_KEYWORD, LINE), kinds(chained.children()));
  }

  @Test
  void elseAtDeeperIndentationIsNotTaken() {
    // the misplaced else is read as an identifier item and its body is left dangling
    String reason = reason("module Main\nfn f\n  if a\n    1\n    else\n      2\n");
    assertEquals("line must not start with leading whitespace", reason);
  }

  @Test
  void tryCatch() {
    Node node = single("try\n  risky\ncatch e\n  handle e\n");
    assertEquals(
        List.of(TRY_KEYWORD, LINE, CATCH_KEYWORD, IDENT, LINE), kinds(node.children()));
  }

  @Test
  void tryWithoutCatch() {
    assertEquals("try must have corresponding catch", reason("module Main\ntry\n  risky\n"));
  }

  @Test
  void forLoop() {
    Node node = single("for (k, v) in pairs\n  print k\n");
    assertEquals(FOR, node.kind());
    assertEquals(PATTERN, node.child(1).kind());
    assertEquals(IN_KEYWORD, node.child(2).kind());
  }

  @Test
  void forLoopNeedsIn() {
    assertEquals("missing in keyword of for loop", reason("module Main\nfor x of xs\n  x\n"));
  }

  @Test
  void caseBranches() {
    Node node = single("case shape\n  (w, h) => w * h\n  _ => 0\n");
    List<Node> branches = node.childrenOf(CASE_BRANCH);
    assertEquals(2, branches.size());
    assertEquals(FAT_R_ARROW, branches.get(0).child(1).kind());
    assertEquals(3, branches.get(0).child(2).child(0).childCount());
  }

  @Test
  void caseBranchNeedsArrow() {
    assertEquals(
        "expected => while parsing case branch", reason("module Main\ncase x\n  1 -> 2\n"));
  }

  @Test
  void blockIndentationMustDeepen() {
    assertEquals("improper indentation after header", reason("module Main\nfn f\nx\n"));
  }

  @Test
  void tabBlockUnderSpaceHeaderIsRejected() {
    String source = "module Main\nfn f\n  while x\n\t\ty\n";
    assertEquals("improper indentation after header", reason(source));
  }

  // ==================== Expressions ====================

  @Test
  void missingRightHandSide() {
    assertEquals(
        "right-hand side of assignment must be a valid expression", reason("module Main\nx = \n"));
  }

  @Test
  void bareArrowIsReserved() {
    assertEquals("the operator -> is reserved", reason("module Main\nx -> y\n"));
  }

  @Test
  void equalityIsNotAssignment() {
    List<Node> subexprs = expr("x == y\n");
    assertEquals(List.of(QUAL_IDENT, OP, QUAL_IDENT), kinds(subexprs));
  }

  @Test
  void subtractionOfIdentifiers() {
    assertEquals(Node.leaf(OP, "-"), expr("x - y\n").get(1));
  }

  @Test
  void typedAssignmentAndVar() {
    Node assign = single("x: [Int] = xs\n");
    assertEquals(List.of(PATTERN, COLON, TYPE_IDENT, EQUALS, EXPR), kinds(assign.children()));

    Node binding = single("var n = 0\n");
    assertEquals(List.of(VAR_KEYWORD, PATTERN, EQUALS, EXPR), kinds(binding.children()));
  }

  @Test
  void tupleDestructuringAssignment() {
    Node assign = single("(a, b) = pair\n");
    assertEquals(ASSIGN, assign.kind());
    assertEquals(5, assign.child(0).childCount());
  }

  @Test
  void parenthesizedExpressionIsNotAPattern() {
    List<Node> subexprs = expr("(x) + 1\n");
    assertEquals(PARENED, subexprs.get(0).kind());
    assertEquals(Node.leaf(OP, "+"), subexprs.get(1));
  }

  @Test
  void tuples() {
    assertEquals(TUPLE_LIT, single("()\n").kind());
    Node tuple = single("(1, f x, \"s\")\n");
    assertEquals(TUPLE_LIT, tuple.kind());
    assertEquals(7, tuple.childCount());
  }

  @Test
  void lambda() {
    Node lambda = single("\\x, (y: Int) -> x + y\n");
    assertEquals(
        List.of(BACKSLASH, PARAM, COMMA, PARAM, R_ARROW, EXPR), kinds(lambda.children()));
  }

  @Test
  void lambdaNeedsArrow() {
    assertEquals("lambda expression requires ->", reason("module Main\n\\x x\n"));
  }

  @Test
  void infixedCall() {
    List<Node> subexprs = expr("a `div` b\n");
    assertEquals(INFIXED, subexprs.get(1).kind());
  }

  @Test
  void callWithArguments() {
    assertEquals(
        List.of(QUAL_IDENT, QUAL_IDENT, NUM_LIT, STR_LIT, CHR_LIT),
        kinds(expr("print a.b 1.5 \"s\" 'c'\n")));
  }

  // ==================== Collections ====================

  @Test
  void listLiteral() {
    Node list = single("[1, 2, 3]\n");
    assertEquals(LIST_LIT, list.kind());
    assertEquals(7, list.childCount());
    assertEquals(2, single("[]\n").childCount());
  }

  @Test
  void listComprehension() {
    Node comp = single("[x * 2 | x <- xs, x > 1]\n");
    assertEquals(LIST_COMP, comp.kind());
    assertEquals(
        List.of(L_SQ_BRACKET, EXPR, BAR, GENERATOR, COMMA, EXPR, R_SQ_BRACKET),
        kinds(comp.children()));
  }

  @Test
  void listComprehensionWithTupleGenerator() {
    Node comp = single("[k | (k, v) <- pairs]\n");
    Node gen = comp.child(3);
    assertEquals(GENERATOR, gen.kind());
    assertEquals(L_ARROW, gen.child(1).kind());
  }

  @Test
  void dictLiteral() {
    Node dict = single("{\"a\" = 1, \"b\" = 2}\n");
    assertEquals(DICT_LIT, dict.kind());
    assertEquals(2, dict.childrenOf(DICT_ENTRY).size());
    assertEquals(DICT_LIT, single("{}\n").kind());
  }

  @Test
  void dictComprehension() {
    Node comp = single("{k = v | (k, v) <- pairs}\n");
    assertEquals(DICT_COMP, comp.kind());
    assertEquals(DICT_ENTRY, comp.child(1).kind());
  }

  @Test
  void setLiteralAndComprehension() {
    assertEquals(SET_LIT, single("{1, 2}\n").kind());
    Node comp = single("{x | x <- xs}\n");
    assertEquals(SET_COMP, comp.kind());
  }

  @Test
  void equalsInsideBracketsStillCompares() {
    Node set = single("{a == b}\n");
    assertEquals(SET_LIT, set.kind());
    assertEquals(3, set.child(1).childCount());
  }

  @Test
  void dictValueCanBeParenthesizedAssignment() {
    Node dict = single("{k = (v = 1)}\n");
    Node value = dict.child(1).child(2).child(0);
    assertEquals(PARENED, value.kind());
    assertEquals(ASSIGN, value.child(1).child(0).kind());
  }

  @Test
  void unclosedList() {
    assertEquals(
        "left square bracket in list literal requires ]", reason("module Main\n[1, 2\n"));
  }

  @Test
  void singleElementTuple() {
    assertEquals("expected comma after first tuple element", reason("module Main\n(1 2\n"));
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = ';',
      quoteCharacter = '"',
      value = {
        "x = 1.;expected at least one digit after decimal point",
        "x = -1.;expected at least one digit after decimal point",
        "x = 'ab';expected ', got: 'b'",
        "fn;expected function name",
        "return;expected expression to return",
        "while;expected expression as while condition",
        "[1 | ];expected generator or condition after |"
      })
  void hardErrors(String line, String expected) {
    assertEquals(expected, reason("module Main\n" + line + "\n"));
  }

  // ==================== Limits ====================

  @Test
  void nestingDepthIsBounded() {
    String deep = "(".repeat(40) + "x" + ")".repeat(40);
    Grammar grammar = new Grammar(new Cursor("module Main\n" + deep + "\n"), new ParserOptions(16));
    BrouwerSyntaxException e = assertThrows(BrouwerSyntaxException.class, grammar::parseRoot);
    assertEquals("maximum nesting depth of 16 exceeded", e.getReason());
  }

  @Test
  void moderateNestingParses() {
    String nested = "(".repeat(10) + "x" + ")".repeat(10);
    assertEquals(PARENED, single(nested + "\n").kind());
  }

  @Test
  void deeplyNestedSetsParseQuickly() {
    String nested = "{".repeat(40) + "x" + "}".repeat(40);
    Node set = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> single(nested + "\n"));
    assertEquals(SET_LIT, set.kind());
  }

  @Test
  void deeplyNestedTuplesParseQuickly() {
    String nested = "x";
    for (int i = 0; i < 40; i++) {
      nested = "(" + nested + ", 1)";
    }
    String source = nested + "\n";
    Node tuple = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> single(source));
    assertEquals(TUPLE_LIT, tuple.kind());
  }

  @Test
  void nulCharacterIsNotEndOfInput() {
    assertEquals("unexpected character '\\0'", reason("module Main\nx \0\n"));
  }

  private static List<NodeKind> kinds(List<Node> nodes) {
    return nodes.stream().map(Node::kind).toList();
  }

  private static List<String> texts(List<Node> nodes) {
    return nodes.stream().map(Node::text).toList();
  }
}
