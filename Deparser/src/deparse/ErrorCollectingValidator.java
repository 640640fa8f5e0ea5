package deparse;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ForOverride;

abstract class ErrorCollectingValidator {
  private final List<String> errors = new ArrayList<>();

  ImmutableList<String> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(String error) {
    errors.add(error);
  }

  protected static String commentedTree(String heading, Node node) {
    List<String> lines = Splitter.on('\n').splitToList(TreeFormatter.plain().format(node));
    return "\n# " + heading + ":\n#\t" + Joiner.on("\n# ").join(lines);
  }

  protected void takeErrors(ErrorCollectingValidator other) {
    errors.addAll(other.errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  final void accept(Node node) {
    visit(node, false);
  }

  private void visit(Node node, boolean inLoop) {
    boolean loop = inLoop || isLoop(node);
    check(node, loop);
    for (Node child : node.children()) {
      visit(child, loop);
    }
  }

  private static boolean isLoop(Node node) {
    return node.kindStartsWith("for")
        || node.kindStartsWith("while")
        || node.kindStartsWith("async_for");
  }

  @ForOverride
  protected void check(Node node, boolean inLoop) {}
}
