package deparse;

import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * A node of the parse tree built over a token stream. Nodes are immutable: relabeling or replacing
 * a child produces a new node.
 */
public abstract class Node {
  private final String kind;

  protected Node(String kind) {
    this.kind = kind;
  }

  public final String kind() {
    return kind;
  }

  public final boolean is(String kind) {
    return this.kind.equals(kind);
  }

  public final boolean isAny(String... kinds) {
    for (String k : kinds) {
      if (kind.equals(k)) return true;
    }
    return false;
  }

  public final boolean isIn(Set<String> kinds) {
    return kinds.contains(kind);
  }

  public final boolean kindStartsWith(String prefix) {
    return kind.startsWith(prefix);
  }

  public abstract boolean isTerminal();

  public abstract ImmutableList<Node> children();

  public final int size() {
    return children().size();
  }

  public final boolean isEmpty() {
    return children().isEmpty();
  }

  public final Node child(int index) {
    ImmutableList<Node> children = children();
    int i = index < 0 ? children.size() + index : index;
    if (i < 0 || i >= children.size()) {
      throw new IndexOutOfBoundsException(
          String.format("%s has %d children; no child %d", kind, children.size(), index));
    }
    return children.get(i);
  }

  public final ImmutableList<Node> slice(int from, int to) {
    int size = size();
    int start = clampIndex(from, size);
    int end = clampIndex(to, size);
    return start >= end ? ImmutableList.of() : children().subList(start, end);
  }

  static int clampIndex(int index, int size) {
    int i = index < 0 ? size + index : index;
    return Math.max(0, Math.min(i, size));
  }

  public abstract Node withKind(String kind);

  public abstract Optional<Token> firstToken();

  public abstract Optional<Integer> lineStart();

  public abstract boolean isNone();

  @Override
  public String toString() {
    return TreeFormatter.plain().format(this);
  }
}
