package deparse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

final class ClassMaker {
  private final SourceWalker walker;
  private final RenderState state;

  ClassMaker(SourceWalker walker) {
    this.walker = walker;
    this.state = walker.state();
  }

  void register(ImmutableMap.Builder<String, NodeHandler> handlers) {
    handlers.put("classdef", this::classDef);
    handlers.put("classdefdeco2", this::classDef);
  }

  // build_class ::= LOAD_BUILD_CLASS mkfunc expr(name) [bases and keywords] CALL_FUNCTION_*
  private void classDef(Node node) throws ParserException {
    Node buildClass = node.is("classdefdeco2") ? node : node.child(0);
    Node function = buildClass.child(1);
    CodeObject code = Nodes.code(function.child(FunctionMaker.codeIndex(function)));
    String name = className(buildClass).orElse(code.name());

    walker.write(node.is("classdefdeco2") ? "\n" : "\n\n");
    walker.write(walker.indent(), "class ", name);
    writeBases(buildClass);
    walker.println(":");

    state.indentMore(RenderState.TAB);
    try {
      body(code);
    } finally {
      state.indentLess(RenderState.TAB);
    }
    walker.write(state.depth() > 1 ? "\n\n" : "\n\n\n");
  }

  private static Optional<String> className(Node buildClass) {
    if (buildClass.size() < 3) return Optional.empty();
    Node name = Nodes.unwrap(buildClass.child(2), "expr");
    if (name instanceof Token && ((Token) name).attr() instanceof String) {
      return Optional.of((String) ((Token) name).attr());
    }
    return Optional.empty();
  }

  private void writeBases(Node buildClass) throws ParserException {
    Token call = Nodes.token(buildClass.child(-1));
    int end = buildClass.size() - 1;
    ImmutableList<Object> keywords = ImmutableList.of();
    if (call.kindStartsWith("CALL_FUNCTION_KW")) {
      end--;
      keywords = Nodes.token(buildClass.child(end)).listAttr();
    }
    int firstKeyword = end - keywords.size();

    List<String> arguments = new ArrayList<>();
    try (RenderState.Restorer r = state.withPrecedence(Precedence.YIELD - 1)) {
      for (int i = 3; i < end; i++) {
        String value = walker.traverse(buildClass.child(i));
        arguments.add(i >= firstKeyword ? keywords.get(i - firstKeyword) + "=" + value : value);
      }
    }
    if (!arguments.isEmpty()) {
      walker.write("(", String.join(", ", arguments), ")");
    }
  }

  private void body(CodeObject code) throws ParserException {
    Optional<SyntaxTree> built = walker.buildNested(code, false);
    if (!built.isPresent()) {
      walker.write(walker.indent());
      walker.writeUnparsed(code);
      walker.println();
      return;
    }
    SyntaxTree tree = built.get();
    List<Node> statements = new ArrayList<>(tree.children());
    if (walker.options().hidesInternal()) {
      if (!statements.isEmpty() && assignsFrom(statements.get(0), "__module__", "__name__")) {
        statements.remove(0);
      }
      if (!statements.isEmpty() && assignsString(statements.get(0), "__qualname__")) {
        statements.remove(0);
      }
    }
    // The docstring assignment follows the bootstrap assignments.
    SyntaxTree body = TreeBuilder.markDocstring(SyntaxTree.of(tree.kind(), statements));
    if (!body.isEmpty() && body.child(0).is("docstring")) {
      walker.println(walker.traverse(body.child(0)));
      body = SyntaxTree.of(body.kind(), body.slice(1, body.size()));
    }
    FunctionMaker.declareScopes(walker, body, code);
    walker.genSource(body, code.name(), false, false);
  }

  // __module__ = __name__
  private static boolean assignsFrom(Node statement, String target, String source) {
    Optional<Node> value = assignedValue(statement, target);
    if (!value.isPresent()) return false;
    Node load = Nodes.unwrap(value.get(), "expr");
    return load.is("LOAD_NAME") && ((Token) load).pattr().equals(source);
  }

  // __qualname__ = 'Outer.<locals>.Inner'
  private static boolean assignsString(Node statement, String target) {
    Optional<Node> value = assignedValue(statement, target);
    if (!value.isPresent()) return false;
    Node load = Nodes.unwrap(value.get(), "expr");
    return load.isAny("LOAD_STR", "LOAD_CONST") && ((Token) load).attr() instanceof String;
  }

  private static Optional<Node> assignedValue(Node statement, String target) {
    Node assign = Nodes.unwrap(statement, "sstmt", "stmt");
    if (!assign.is("assign") || assign.size() != 2) return Optional.empty();
    Node store = assign.child(1);
    if (!store.is("store") || store.size() != 1 || !store.child(0).is("STORE_NAME")) {
      return Optional.empty();
    }
    if (!((Token) store.child(0)).pattr().equals(target)) return Optional.empty();
    return Optional.of(assign.child(0));
  }
}
