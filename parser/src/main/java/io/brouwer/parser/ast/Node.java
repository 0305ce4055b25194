package io.brouwer.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable AST element.
 *
 * <p>A node is either a <em>leaf</em> carrying non-empty literal text (identifiers, literal
 * characters, keywords, punctuation) or an <em>interior</em> node with empty text and at least one
 * child. Children are owned exclusively by their parent, so a tree built by the grammar is never
 * shared or cyclic.
 *
 * @param kind the grammar symbol
 * @param text the literal text of a leaf, empty for interior nodes
 * @param children the ordered children, empty for leaves
 */
public record Node(NodeKind kind, String text, List<Node> children) {

  public Node {
    Objects.requireNonNull(kind, "kind");
    text = text == null ? "" : text;
    children = children == null ? List.of() : List.copyOf(children);
    if (!text.isEmpty() && !children.isEmpty()) {
      throw new IllegalArgumentException(kind.displayName() + " leaf may not have children");
    }
    if (text.isEmpty() && children.isEmpty()) {
      throw new IllegalArgumentException(kind.displayName() + " needs text or children");
    }
  }

  public static Node leaf(NodeKind kind, String text) {
    return new Node(kind, text, List.of());
  }

  public static Node of(NodeKind kind, List<Node> children) {
    return new Node(kind, "", children);
  }

  public static Node of(NodeKind kind, Node... children) {
    return new Node(kind, "", List.of(children));
  }

  public boolean isLeaf() {
    return !text.isEmpty();
  }

  public Node child(int index) {
    return children.get(index);
  }

  public int childCount() {
    return children.size();
  }

  /** Returns the children of the given kind, in order. */
  public List<Node> childrenOf(NodeKind childKind) {
    List<Node> result = new ArrayList<>();
    for (Node child : children) {
      if (child.kind == childKind) {
        result.add(child);
      }
    }
    return result;
  }

  /** Returns the first child of the given kind, or {@code null}. */
  public Node firstChild(NodeKind childKind) {
    for (Node child : children) {
      if (child.kind == childKind) {
        return child;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    if (isLeaf()) {
      return kind.displayName() + " \"" + text + "\"";
    }
    StringBuilder sb = new StringBuilder(kind.displayName()).append('(');
    for (int i = 0; i < children.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(children.get(i));
    }
    return sb.append(')').toString();
  }
}
