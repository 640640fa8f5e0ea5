package deparse;

import java.util.Optional;

final class TreeFormatter {
  private static final String INDENT = "    ";
  private static final TreeFormatter PLAIN = new TreeFormatter(Optional.empty());

  private final Optional<TemplateTable> templates;

  private TreeFormatter(Optional<TemplateTable> templates) {
    this.templates = templates;
  }

  static TreeFormatter plain() {
    return PLAIN;
  }

  static TreeFormatter withTemplates(TemplateTable templates) {
    return new TreeFormatter(Optional.of(templates));
  }

  static String describeToken(Token token) {
    StringBuilder sb = new StringBuilder();
    token.lineStart().ifPresent(line -> sb.append(String.format("L.%3d  ", line)));
    sb.append(String.format("%4d  %s", token.offset(), token.kind()));
    if (token.hasAttr() || token.hasPattr()) {
      Object shown = token.hasPattr() ? token.pattr() : token.attr();
      sb.append("  ").append(shown instanceof String ? PythonLiterals.repr(shown) : shown);
    }
    return sb.toString();
  }

  String format(Node node) {
    StringBuilder sb = new StringBuilder();
    format(node, "", -1, sb);
    return sb.toString();
  }

  private void format(Node node, String indent, int siblingNumber, StringBuilder sb) {
    sb.append(indent);
    if (siblingNumber >= 0) {
      sb.append(String.format("%2d. ", siblingNumber));
    }
    if (node instanceof Token) {
      sb.append(describeToken((Token) node));
      annotate(node, sb);
      return;
    }

    SyntaxTree tree = (SyntaxTree) node;
    sb.append(tree.kind());
    boolean enumerate = tree.size() > 1;
    if (enumerate) {
      sb.append(" (").append(tree.size()).append(')');
    }
    tree.transformedBy().ifPresent(by -> sb.append(" (transformed by ").append(by).append(')'));
    annotate(tree, sb);

    int i = 0;
    for (Node child : tree.children()) {
      sb.append('\n');
      format(child, indent + INDENT, enumerate ? i : -1, sb);
      i++;
    }
  }

  private void annotate(Node node, StringBuilder sb) {
    if (!templates.isPresent()) return;
    Integer precedence = Precedence.TABLE.get(node.kind());
    if (precedence != null) {
      sb.append(", precedence ").append(precedence);
    }
    templates.get().templateFor(node).ifPresent(t -> sb.append(": ").append(t));
  }
}
