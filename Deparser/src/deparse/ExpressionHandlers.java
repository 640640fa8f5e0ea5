package deparse;

import java.util.List;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

final class ExpressionHandlers {
  private static final int LINE_LENGTH = 80;

  private final SourceWalker walker;
  private final RenderState state;

  ExpressionHandlers(SourceWalker walker) {
    this.walker = walker;
    this.state = walker.state();
  }

  void register(ImmutableMap.Builder<String, NodeHandler> handlers) {
    handlers.put("expr", this::expr);
    handlers.put("return_expr_or_cond", this::expr);
    handlers.put("return_expr", this::returnExpr);
    handlers.put("bin_op", this::binOp);
    handlers.put("slice2", this::slice2);
    handlers.put("slice3", this::slice3);
    handlers.put("yield", this::yield);
    handlers.put("str", node -> walker.write(Nodes.token(node.child(0)).pattr()));
    handlers.put("LOAD_CONST", this::constant);
    handlers.put("LOAD_STR", this::constant);
    handlers.put("attribute", this::attribute);
    handlers.put("store", this::store);
    handlers.put("subscript", this::subscript);
    handlers.put("store_subscript", this::subscript);
    handlers.put("delete_subscript", this::subscript);
    handlers.put("unpack", this::unpack);
    handlers.put("unpack_w_parens", this::unpack);
    handlers.put("assign2", this::parallelAssign);
    handlers.put("assign3", this::parallelAssign);
    handlers.put("except_cond2", this::exceptAs);
    handlers.put("alias", this::alias);
    handlers.put("call_kw36", this::callWithKeywords);
  }

  void expr(Node node) throws ParserException {
    Node first = node.child(0);
    Node operator = first.kindStartsWith("bin_op") ? first.child(-1).child(0) : first;
    int precedence = Precedence.of(operator.kind());
    if (operator.is("LOAD_CONST")
        && PythonLiterals.repr(((Token) operator).attr()).startsWith("-")) {
      precedence = Precedence.UNARY;
    }

    int outer = state.precedence();
    try (RenderState.Restorer r = state.withPrecedence(precedence)) {
      if (outer < precedence) {
        walker.write("(");
        walker.preorder(first);
        walker.write(")");
      } else {
        walker.preorder(first);
      }
    }
  }

  private void returnExpr(Node node) throws ParserException {
    if (node.size() == 1 && node.child(0).is("expr")) {
      try (RenderState.Restorer r = state.withPrecedence(Precedence.YIELD - 1)) {
        expr(node.child(0));
      }
    } else {
      expr(node);
    }
  }

  // The right operand gets one less so that equal-strength operators there are parenthesized.
  private void binOp(Node node) throws ParserException {
    walker.preorder(node.child(0));
    walker.write(" ");
    walker.preorder(node.child(-1));
    walker.write(" ");
    try (RenderState.Restorer r = state.withPrecedence(state.precedence() - 1)) {
      walker.preorder(node.child(1));
    }
  }

  private void slice2(Node node) throws ParserException {
    try (RenderState.Restorer r = state.withPrecedence(Precedence.NO_PARENTHESIS_EVER)) {
      bound(node.child(0));
      walker.write(":");
      bound(node.child(1));
    }
  }

  private void slice3(Node node) throws ParserException {
    try (RenderState.Restorer r = state.withPrecedence(Precedence.NO_PARENTHESIS_EVER)) {
      bound(node.child(0));
      walker.write(":");
      bound(node.child(1));
      walker.write(":");
      bound(node.child(2));
    }
  }

  private void bound(Node node) throws ParserException {
    if (!node.isNone()) {
      walker.preorder(node);
    }
  }

  private void yield(Node node) throws ParserException {
    if (node.size() == 2 && node.child(0).isNone() && node.child(1).is("YIELD_VALUE")) {
      walker.write("yield");
    } else {
      walker.defaultRender(node);
    }
  }

  private void constant(Node node) {
    Object value = Nodes.token(node).attr();
    if (value instanceof List) {
      tuple((List<?>) value);
    } else {
      walker.write(PythonLiterals.repr(value));
    }
  }

  private void tuple(List<?> items) {
    int column = state.scope().buffer().column() + 1;
    String continuation = " ".repeat(column);
    walker.write("(");
    String separator = "";
    for (Object item : items) {
      walker.write(separator);
      column += separator.length();
      String repr = PythonLiterals.repr(item);
      column += repr.length();
      walker.write(repr);
      if (column > LINE_LENGTH) {
        column = 0;
        separator = ",\n" + continuation;
      } else {
        separator = ", ";
      }
    }
    if (items.size() == 1) {
      walker.write(",");
    }
    walker.write(")");
  }

  // A constant base needs parentheses before an attribute: (1).real
  private void attribute(Node node) throws ParserException {
    Node base = node.child(0);
    if (base.is("LOAD_CONST") || (base.is("expr") && base.child(0).is("LOAD_CONST"))) {
      walker.defaultRender(node.withKind("attribute_w_parens"));
    } else {
      walker.defaultRender(node);
    }
  }

  private void store(Node node) throws ParserException {
    Node base = node.child(0);
    if (node.size() > 1
        && base.is("expr")
        && base.child(0).is("LOAD_CONST")
        && node.child(1).is("STORE_ATTR")) {
      walker.defaultRender(node.withKind("store_w_parens"));
    } else {
      walker.defaultRender(node);
    }
  }

  // A tuple index is written without its parentheses: a[1, 2]
  private void subscript(Node node) throws ParserException {
    Node index = node.child(-2);
    if (!index.isEmpty() && index instanceof SyntaxTree) {
      Node built = index.child(0);
      if (built.isAny("build_list", "tuple")
          && !built.isEmpty()
          && built.child(-1).kindStartsWith("BUILD_TUPLE")
          && !built.child(-1).is("BUILD_TUPLE_0")) {
        SyntaxTree newIndex = ((SyntaxTree) index).withChild(0, built.withKind("build_tuple2"));
        node = ((SyntaxTree) node).withChild(-2, newIndex);
      }
    }
    walker.defaultRender(node);
  }

  private void unpack(Node node) throws ParserException {
    Token unpacker = Nodes.token(node.child(0));
    if (unpacker.kindStartsWith("UNPACK_EX")) {
      starredUnpack(node, unpacker);
      return;
    }
    if (unpacker.is("UNPACK_SEQUENCE_0")) {
      walker.write("[]");
      return;
    }
    SyntaxTree tree = (SyntaxTree) node;
    for (int i = 1; i < tree.size(); i++) {
      tree = tree.withChild(i, withParenthesizedUnpack(tree.child(i), 0));
    }
    walker.defaultRender(tree);
  }

  // a, *b, c: the operand holds the number of targets before and after the star.
  private void starredUnpack(Node node, Token unpacker) throws ParserException {
    ImmutableList<Object> counts = unpacker.listAttr();
    int before = (Integer) counts.get(0);
    int after = (Integer) counts.get(1);
    Verify.verify(
        node.size() == before + after + 2,
        "%s expects %s targets, found %s",
        unpacker.kind(),
        before + after + 1,
        node.size() - 1);
    String separator = "";
    for (int i = 1; i < node.size(); i++) {
      walker.write(separator);
      if (i == before + 1) {
        walker.write("*");
      }
      walker.preorder(node.child(i));
      separator = ", ";
    }
  }

  private void parallelAssign(Node node) throws ParserException {
    SyntaxTree tree = (SyntaxTree) node;
    tree = tree.withChild(-2, withParenthesizedUnpack(tree.child(-2), 0));
    tree = tree.withChild(-1, withParenthesizedUnpack(tree.child(-1), 0));
    walker.defaultRender(tree);
  }

  private void exceptAs(Node node) throws ParserException {
    SyntaxTree tree = (SyntaxTree) node;
    walker.defaultRender(tree.withChild(-2, withParenthesizedUnpack(tree.child(-2), 0)));
  }

  private static Node withParenthesizedUnpack(Node parent, int index) {
    if (parent instanceof SyntaxTree && parent.size() > index && parent.child(index).is("unpack")) {
      Node unpack = parent.child(index).withKind("unpack_w_parens");
      return ((SyntaxTree) parent).withChild(index, unpack);
    }
    return parent;
  }

  private void alias(Node node) {
    String importName = Nodes.token(node.child(0)).pattr();
    Token store = Nodes.token(node.child(-1).child(-1));
    Verify.verify(store.kindStartsWith("STORE_"), "alias target is %s", store.kind());
    String storeName = store.pattr();
    walker.write(importName);
    if (!importName.equals(storeName) && !importName.startsWith(storeName + ".")) {
      walker.write(" as " + storeName);
    }
  }

  private void callWithKeywords(Node node) throws ParserException {
    try (RenderState.Restorer r = state.withPrecedence(Precedence.NO_PARENTHESIS_EVER)) {
      walker.preorder(node.child(0));
    }
    walker.write("(");
    ImmutableList<Object> keywords = Nodes.token(node.child(-2)).listAttr();
    int n = node.size();
    int firstKeyword = n - 2 - keywords.size();
    Verify.verify(
        firstKeyword >= 1,
        "%s has %s keywords but only %s children",
        node.kind(),
        keywords.size(),
        n);

    String separator = "";
    int line = state.lineNumber();
    for (int i = 1; i < n - 2; i++) {
      walker.write(separator);
      if (i >= firstKeyword) {
        walker.write(keywords.get(i - firstKeyword) + "=");
      }
      walker.preorder(node.child(i));
      if (line != state.lineNumber()) {
        separator = ",\n" + walker.indent() + "  ";
      } else {
        separator = ", ";
      }
      line = state.lineNumber();
    }
    walker.write(")");
  }
}
