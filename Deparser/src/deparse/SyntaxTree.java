package deparse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

public final class SyntaxTree extends Node {
  private final ImmutableList<Node> children;
  private final Optional<String> transformedBy;

  private SyntaxTree(String kind, ImmutableList<Node> children, Optional<String> transformedBy) {
    super(kind);
    this.children = children;
    this.transformedBy = transformedBy;
  }

  public static SyntaxTree of(String kind, Node... children) {
    return new SyntaxTree(kind, ImmutableList.copyOf(children), Optional.empty());
  }

  public static SyntaxTree of(String kind, Iterable<? extends Node> children) {
    return new SyntaxTree(kind, ImmutableList.copyOf(children), Optional.empty());
  }

  @Override
  public boolean isTerminal() {
    return false;
  }

  @Override
  public ImmutableList<Node> children() {
    return children;
  }

  public Optional<String> transformedBy() {
    return transformedBy;
  }

  public SyntaxTree markTransformed(String by) {
    return new SyntaxTree(kind(), children, Optional.of(by));
  }

  @Override
  public SyntaxTree withKind(String kind) {
    return new SyntaxTree(kind, children, transformedBy);
  }

  public SyntaxTree withChild(int index, Node replacement) {
    int i = index < 0 ? children.size() + index : index;
    Preconditions.checkElementIndex(i, children.size());
    List<Node> copy = new ArrayList<>(children);
    copy.set(i, replacement);
    return new SyntaxTree(kind(), ImmutableList.copyOf(copy), transformedBy);
  }

  public SyntaxTree withChildren(Iterable<? extends Node> newChildren) {
    return new SyntaxTree(kind(), ImmutableList.copyOf(newChildren), transformedBy);
  }

  @Override
  public Optional<Token> firstToken() {
    for (Node child : children) {
      Optional<Token> token = child.firstToken();
      if (token.isPresent()) return token;
    }
    return Optional.empty();
  }

  @Override
  public Optional<Integer> lineStart() {
    return Optional.empty();
  }

  @Override
  public boolean isNone() {
    return children.size() == 1 && children.get(0).isNone();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SyntaxTree)) return false;
    SyntaxTree that = (SyntaxTree) o;
    return kind().equals(that.kind()) && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind(), children);
  }
}
