package deparse;

import com.google.common.collect.ImmutableMap;

final class StatementHandlers {
  private final SourceWalker walker;
  private final RenderState state;

  StatementHandlers(SourceWalker walker) {
    this.walker = walker;
    this.state = walker.state();
  }

  void register(ImmutableMap.Builder<String, NodeHandler> handlers) {
    handlers.put("return", this::returnStatement);
    handlers.put("return_if_stmt", this::returnIf);
    handlers.put("return_expr_lambda", node -> walker.preorder(node.child(0)));
    handlers.put("return_call_lambda", this::returnCallLambda);
    handlers.put("ifelsestmtr", this::ifElseReturns);
    handlers.put("elifelsestmtr", this::elifElseReturns);
  }

  private void returnStatement(Node node) throws ParserException {
    if (walker.isLambda()) {
      walker.preorder(node.child(0));
      return;
    }
    writeReturn(node);
  }

  private void returnIf(Node node) throws ParserException {
    if (walker.isLambda()) {
      walker.write(" return ");
      walker.preorder(node.child(0));
      return;
    }
    writeReturn(node);
  }

  private void returnCallLambda(Node node) throws ParserException {
    if (walker.isLambda()) {
      walker.preorder(node.child(0));
    } else {
      writeReturn(node);
    }
  }

  private void writeReturn(Node node) throws ParserException {
    walker.write(walker.indent(), "return");
    if (walker.returnNone() || !isReturnNone(node)) {
      walker.write(" ");
      walker.preorder(node.child(0));
    }
    walker.println();
  }

  static boolean isReturnNone(Node node) {
    Node value = node.child(0);
    return value.is("return_expr") && value.size() == 1 && value.child(0).isNone();
  }

  // Flattening of if-return chains

  private static boolean isIfReturn(Node statement) {
    if (statement.isEmpty()) return false;
    Node inner = statement.child(0);
    return inner.is("ifstmt")
        && inner.size() > 1
        && !inner.child(1).isEmpty()
        && inner.child(1).child(0).is("return_if_stmts");
  }

  private static Node asElif(Node statement) {
    return ((SyntaxTree) statement).withChild(0, statement.child(0).withKind("elifstmt"));
  }

  private void ifElseReturns(Node node) throws ParserException {
    int returnsIndex = 2;
    if (node.child(2).is("COME_FROM")) {
      returnsIndex = 3;
      node = node.withKind("ifelsestmtr2");
    }
    Node returns = node.child(returnsIndex);
    if (returns.size() != 2) {
      walker.defaultRender(node);
      return;
    }
    Node statements = returns.child(0);
    boolean leadingIfReturn = !statements.isEmpty() && isIfReturn(statements.child(0));
    boolean trailingIfReturn = !statements.isEmpty() && isIfReturn(statements.child(-1));
    if (!leadingIfReturn && !trailingIfReturn) {
      walker.defaultRender(node);
      return;
    }

    walker.write(walker.indent(), "if ");
    walker.preorder(node.child(0));
    walker.println(":");
    state.indentMore(RenderState.TAB);
    walker.preorder(node.child(1));
    state.indentLess(RenderState.TAB);

    boolean ifReturnAtEnd = statements.size() >= 3 && trailingIfReturn;
    boolean pastElse = false;
    boolean previousIsIfReturn = true;
    for (Node statement : statements.children()) {
      if (isIfReturn(statement)) {
        if (previousIsIfReturn) {
          statement = asElif(statement);
        }
        previousIsIfReturn = true;
      } else {
        previousIsIfReturn = false;
        if (!pastElse && !ifReturnAtEnd) {
          walker.println(walker.indent(), "else:");
          state.indentMore(RenderState.TAB);
          pastElse = true;
        }
      }
      walker.preorder(statement);
    }
    if (!pastElse || ifReturnAtEnd) {
      walker.println(walker.indent(), "else:");
      state.indentMore(RenderState.TAB);
    }
    walker.preorder(returns.child(1));
    state.indentLess(RenderState.TAB);
  }

  private void elifElseReturns(Node node) throws ParserException {
    int returnsIndex = 2;
    if (node.child(2).is("COME_FROM")) {
      returnsIndex = 3;
      node = node.withKind("elifelsestmtr2");
    }
    Node returns = node.child(returnsIndex);
    if (returns.size() != 2) {
      walker.defaultRender(node);
      return;
    }
    for (Node statement : returns.child(0).children()) {
      if (!isIfReturn(statement)) {
        walker.defaultRender(node);
        return;
      }
    }

    walker.write(walker.indent(), "elif ");
    walker.preorder(node.child(0));
    walker.println(":");
    state.indentMore(RenderState.TAB);
    walker.preorder(node.child(1));
    state.indentLess(RenderState.TAB);

    for (Node statement : returns.child(0).children()) {
      walker.preorder(asElif(statement));
    }
    walker.println(walker.indent(), "else:");
    state.indentMore(RenderState.TAB);
    walker.preorder(returns.child(1));
    state.indentLess(RenderState.TAB);
  }
}
