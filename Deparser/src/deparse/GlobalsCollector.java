package deparse;

import java.util.Set;
import java.util.TreeSet;

import com.google.common.collect.ImmutableSortedSet;

final class GlobalsCollector {
  private final Set<String> globals = new TreeSet<>();
  private final Set<String> nonlocals = new TreeSet<>();
  private final CodeObject code;

  private GlobalsCollector(CodeObject code) {
    this.code = code;
  }

  static GlobalsCollector collect(Node tree, CodeObject code) {
    GlobalsCollector collector = new GlobalsCollector(code);
    collector.visit(tree);
    return collector;
  }

  ImmutableSortedSet<String> globals() {
    return ImmutableSortedSet.copyOf(globals);
  }

  ImmutableSortedSet<String> nonlocals() {
    return ImmutableSortedSet.copyOf(nonlocals);
  }

  private void visit(Node node) {
    if (node instanceof Token) {
      Token token = (Token) node;
      if (token.isAny("STORE_GLOBAL", "DELETE_GLOBAL")) {
        globals.add(token.pattr());
      } else if (token.isAny("STORE_DEREF", "DELETE_DEREF")
          && code.freeVars().contains(token.pattr())
          && !token.pattr().equals(code.name())
          && !code.isLambda()) {
        nonlocals.add(token.pattr());
      }
      return;
    }
    for (Node child : node.children()) {
      visit(child);
    }
  }
}
