package deparse;

import java.util.Arrays;
import java.util.List;

final class Nodes {
  static Node unwrap(Node node, String... wrappers) {
    List<String> kinds = Arrays.asList(wrappers);
    while (node.size() == 1 && kinds.contains(node.kind())) {
      node = node.child(0);
    }
    return node;
  }

  // True when node is a token carrying a code object.
  static boolean isCode(Node node) {
    return node instanceof Token && ((Token) node).codeAttr().isPresent();
  }

  static CodeObject code(Node node) {
    return ((Token) node)
        .codeAttr()
        .orElseThrow(() -> new TemplateException(node.kind() + " does not carry a code object"));
  }

  static Token token(Node node) {
    if (node instanceof Token) return (Token) node;
    throw new TemplateException("expected a token, got '" + node.kind() + "'");
  }

  private Nodes() {}
}
