package io.brouwer.parser.ast;

import java.io.PrintStream;

/**
 * Depth-first AST dump: one node per line, indented two spaces per depth, kind name followed by
 * the quoted text for leaves.
 */
public final class AstPrinter {

  private static final String INDENT = "  ";

  private AstPrinter() {}

  public static void print(Node root, PrintStream out) {
    out.print(render(root));
  }

  public static String render(Node root) {
    StringBuilder sb = new StringBuilder();
    render(root, 0, sb);
    return sb.toString();
  }

  private static void render(Node node, int depth, StringBuilder sb) {
    sb.append(INDENT.repeat(depth)).append(node.kind().displayName());
    if (node.isLeaf()) {
      sb.append(" \"").append(node.text()).append('"');
    }
    sb.append('\n');
    for (Node child : node.children()) {
      render(child, depth + 1, sb);
    }
  }
}
