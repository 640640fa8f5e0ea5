package deparse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

final class FunctionMaker {
  // MAKE_FUNCTION operand bits, in the order their operands were pushed.
  static final int DEFAULTS = 0x01;
  static final int KW_DEFAULTS = 0x02;
  static final int ANNOTATIONS = 0x04;
  static final int CLOSURE = 0x08;

  private static final String RETURN_ANNOTATION = "return";

  private final SourceWalker walker;
  private final RenderState state;

  FunctionMaker(SourceWalker walker) {
    this.walker = walker;
    this.state = walker.state();
  }

  void register(ImmutableMap.Builder<String, NodeHandler> handlers) {
    handlers.put("mkfunc", this::function);
    handlers.put("lambda_body", this::lambda);
  }

  static final class FunctionParts {
    final CodeObject code;
    final List<String> defaults = new ArrayList<>();
    final Map<String, String> kwDefaults = new LinkedHashMap<>();
    final Map<String, String> annotations = new LinkedHashMap<>();

    FunctionParts(CodeObject code) {
      this.code = code;
    }
  }

  private void function(Node node) throws ParserException {
    FunctionParts parts = parts(node);
    CodeObject code = parts.code;
    walker.write(code.name());
    state.indentMore(RenderState.TAB);
    try {
      walker.write("(", parameters(parts), ")");
      if (parts.annotations.containsKey(RETURN_ANNOTATION)) {
        walker.write(" -> ", parts.annotations.get(RETURN_ANNOTATION));
      }
      walker.println(":");
      body(code);
      walker.write(state.depth() > 1 ? "\n\n" : "\n\n\n");
    } finally {
      state.indentLess(RenderState.TAB);
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
    if (!tree.isEmpty() && tree.child(0).is("docstring")) {
      walker.println(walker.traverse(tree.child(0)));
      tree = SyntaxTree.of(tree.kind(), tree.slice(1, tree.size()));
    }
    declareScopes(walker, tree, code);
    walker.genSource(tree, code.name(), false, code.names().contains("None"));
  }

  static void declareScopes(SourceWalker walker, Node tree, CodeObject code) {
    GlobalsCollector collector = GlobalsCollector.collect(tree, code);
    for (String name : collector.globals()) {
      walker.println(walker.indent(), "global ", name);
    }
    for (String name : collector.nonlocals()) {
      walker.println(walker.indent(), "nonlocal ", name);
    }
  }

  private void lambda(Node node) throws ParserException {
    FunctionParts parts = parts(node);
    String parameters = parameters(parts);
    walker.write("lambda", parameters.isEmpty() ? "" : " " + parameters, ": ");

    Optional<SyntaxTree> built = walker.buildNested(parts.code, true);
    if (!built.isPresent()) {
      walker.writeUnparsed(parts.code);
      return;
    }
    try (RenderState.Restorer r = state.withPrecedence(Precedence.DEFAULT)) {
      walker.genSource(built.get(), parts.code.name(), true, false);
    }
  }

  FunctionParts parts(Node node) throws ParserException {
    int codeIndex = codeIndex(node);
    FunctionParts parts = new FunctionParts(Nodes.code(node.child(codeIndex)));
    int flags = Nodes.token(node.child(-1)).intAttr().orElse(0);
    if (Integer.bitCount(flags & (DEFAULTS | KW_DEFAULTS | ANNOTATIONS | CLOSURE)) > codeIndex) {
      throw new TemplateException(
          String.format("%s: MAKE_FUNCTION flags %#x need more operands", node.kind(), flags));
    }

    int next = 0;
    if ((flags & DEFAULTS) != 0) {
      parts.defaults.addAll(sequenceValues(node.child(next++)));
    }
    if ((flags & KW_DEFAULTS) != 0) {
      parts.kwDefaults.putAll(mappingValues(node.child(next++)));
    }
    if ((flags & ANNOTATIONS) != 0) {
      parts.annotations.putAll(mappingValues(node.child(next++)));
    }
    return parts;
  }

  // The last child carrying a code object; the qualified name and opcode follow it.
  static int codeIndex(Node node) {
    for (int i = node.size() - 1; i >= 0; i--) {
      if (Nodes.isCode(node.child(i))) return i;
    }
    throw new TemplateException(node.kind() + " has no code object");
  }

  private List<String> sequenceValues(Node node) throws ParserException {
    Node value = Nodes.unwrap(node, "expr");
    List<String> values = new ArrayList<>();
    if (value instanceof Token) {
      for (Object item : ((Token) value).listAttr()) {
        values.add(PythonLiterals.repr(item));
      }
      return values;
    }
    if (!value.isEmpty() && value.child(-1).kindStartsWith("BUILD_TUPLE")) {
      for (Node item : value.slice(0, -1)) {
        values.add(render(item));
      }
      return values;
    }
    throw TemplateException.unexpectedChild(node, 0, "tuple", value);
  }

  private Map<String, String> mappingValues(Node node) throws ParserException {
    Node value = Nodes.unwrap(node, "expr");
    Map<String, String> values = new LinkedHashMap<>();
    if (value.size() >= 2 && value.child(-1).kindStartsWith("BUILD_CONST_KEY_MAP")) {
      ImmutableList<Object> keys = Nodes.token(value.child(-2)).listAttr();
      for (int i = 0; i < keys.size(); i++) {
        values.put(String.valueOf(keys.get(i)), render(value.child(i)));
      }
      return values;
    }
    if (!value.isEmpty() && value.child(0).kindStartsWith("kvlist")) {
      Node list = value.child(0);
      int length = list.child(-1).kindStartsWith("BUILD_MAP") ? list.size() - 1 : list.size();
      for (int i = 0; i + 1 < length; i += 2) {
        Token key = Nodes.token(Nodes.unwrap(list.child(i), "expr"));
        values.put(String.valueOf(key.attr()), render(list.child(i + 1)));
      }
      return values;
    }
    throw TemplateException.unexpectedChild(node, 0, "dict", value);
  }

  private String render(Node node) throws ParserException {
    try (RenderState.Restorer r = state.withPrecedence(Precedence.YIELD - 1)) {
      return walker.traverse(node);
    }
  }

  static String parameters(FunctionParts parts) {
    CodeObject code = parts.code;
    List<String> params = new ArrayList<>();
    ImmutableList<String> names = code.varNames();
    int positional = code.argCount();
    int firstDefault = positional - parts.defaults.size();

    for (int i = 0; i < positional; i++) {
      StringBuilder param = new StringBuilder(annotated(names.get(i), parts));
      if (i >= firstDefault) {
        param.append(parts.annotations.containsKey(names.get(i)) ? " = " : "=");
        param.append(parts.defaults.get(i - firstDefault));
      }
      params.add(param.toString());
      if (code.posOnlyArgCount() > 0 && i == code.posOnlyArgCount() - 1) {
        params.add("/");
      }
    }

    int next = positional + code.kwOnlyArgCount();
    if (code.hasFlag(CodeObject.CO_VARARGS)) {
      params.add("*" + annotated(names.get(next), parts));
      next++;
    } else if (code.kwOnlyArgCount() > 0) {
      params.add("*");
    }

    for (int i = positional; i < positional + code.kwOnlyArgCount(); i++) {
      String name = names.get(i);
      StringBuilder param = new StringBuilder(annotated(name, parts));
      if (parts.kwDefaults.containsKey(name)) {
        param.append(parts.annotations.containsKey(name) ? " = " : "=");
        param.append(parts.kwDefaults.get(name));
      }
      params.add(param.toString());
    }

    if (code.hasFlag(CodeObject.CO_VARKEYWORDS)) {
      params.add("**" + annotated(names.get(next), parts));
    }
    return Joiner.on(", ").join(params);
  }

  private static String annotated(String name, FunctionParts parts) {
    String annotation = parts.annotations.get(name);
    return annotation == null ? name : name + ": " + annotation;
  }
}
