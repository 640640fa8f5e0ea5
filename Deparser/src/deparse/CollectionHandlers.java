package deparse;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

final class CollectionHandlers {
  private static final String CONTINUATION =
      RenderState.INDENT_PER_LEVEL.substring(0, RenderState.INDENT_PER_LEVEL.length() - 1);

  private final SourceWalker walker;
  private final RenderState state;

  CollectionHandlers(SourceWalker walker) {
    this.walker = walker;
    this.state = walker.state();
  }

  void register(ImmutableMap.Builder<String, NodeHandler> handlers) {
    handlers.put("dict", this::dict);
    handlers.put("list", this::sequence);
    handlers.put("set", this::sequence);
    handlers.put("tuple", this::sequence);
    handlers.put("build_set", this::sequence);
  }

  static ImmutableList<Node> flatten(List<Node> elements) {
    ImmutableList.Builder<Node> flat = ImmutableList.builder();
    for (Node element : elements) {
      if (element.is("expr1024")) {
        for (Node group : element.children()) {
          Verify.verify(group.is("expr32"), "expr1024 holds %s", group.kind());
          flat.addAll(group.children());
        }
      } else if (element.is("expr32")) {
        for (Node expr : element.children()) {
          Verify.verify(expr.is("expr"), "expr32 holds %s", expr.kind());
          flat.add(expr);
        }
      } else {
        flat.add(element);
      }
    }
    return flat.build();
  }

  private void sequence(Node node) throws ParserException {
    Node last = node.child(-1);
    List<Node> elements = node.size() == 1 ? ImmutableList.of() : node.slice(0, -1);

    String end;
    if (last.kindStartsWith("BUILD_LIST")) {
      walker.write("[");
      end = "]";
    } else if (last.kindStartsWith("BUILD_MAP_UNPACK")) {
      walker.write("{*");
      end = "}";
    } else if (last.kindStartsWith("BUILD_SET")) {
      walker.write("{");
      end = "}";
    } else if (last.kindStartsWith("BUILD_TUPLE") || node.is("tuple")) {
      // A tuple of slices is a subscript and must stay bare: a[1:2, 3]
      if (hasSliceElement(node)) {
        end = "";
      } else {
        walker.write("(");
        end = ")";
      }
    } else if (last.kindStartsWith("ROT_TWO")) {
      walker.write("(");
      end = ")";
    } else {
      throw new TemplateException(
          node.kind() + " must end in a list, tuple, set or unpack builder, not " + last.kind());
    }

    try (RenderState.Restorer r = state.withPrecedence(Precedence.YIELD - 1)) {
      state.indentMore(RenderState.INDENT_PER_LEVEL);
      StringBuilder separator = new StringBuilder();
      for (Node element : flatten(elements)) {
        if (element.isAny("ROT_THREE", "EXTENDED_ARG")) continue;
        int line = state.lineNumber();
        String value = walker.traverse(element);
        if (line != state.lineNumber()) {
          separator.append('\n').append(walker.indent()).append(CONTINUATION);
        } else if (separator.length() > 0) {
          separator.append(' ');
        }
        walker.write(separator.toString(), value);
        separator.setLength(0);
        separator.append(',');
      }
      if (last instanceof Token
          && last.kindStartsWith("BUILD_TUPLE")
          && ((Token) last).intAttr().orElse(-1) == 1) {
        walker.write(",");
      }
      walker.write(end);
      state.indentLess(RenderState.INDENT_PER_LEVEL);
    }
  }

  private static boolean hasSliceElement(Node node) {
    for (Node element : node.children()) {
      Node n = element.is("arg") && !element.isEmpty() ? element.child(0) : element;
      if (n.is("expr") && !n.isEmpty() && n.child(0).kindStartsWith("slice")) {
        return true;
      }
    }
    return false;
  }

  private void dict(Node node) throws ParserException {
    boolean braces = !node.child(0).is("dict_entry");
    try (RenderState.Restorer r = state.withPrecedence(Precedence.NO_PARENTHESIS_EVER)) {
      state.indentMore(RenderState.INDENT_PER_LEVEL);
      if (braces) {
        walker.write("{");
      }

      String separator = CONTINUATION;
      if (node.child(0).kindStartsWith("kvlist")) {
        separator = keyValueList(node.child(0), separator);
      } else if (node.child(-1).kindStartsWith("BUILD_CONST_KEY_MAP")) {
        separator = constantKeyMap(node, separator);
      } else if (node.child(0).kindStartsWith("dict_entry")) {
        walker.expand(
            Template.of("%C", Template.range(0, node.child(0).size(), ", **")), node.child(0));
        separator = "";
      } else if (node.child(-1).kindStartsWith("BUILD_MAP_UNPACK")) {
        int count = Nodes.token(node.child(-1)).intAttr().orElse(node.size() - 1);
        walker.expand(Template.of("**%C", Template.range(0, count, ", **")), node);
        separator = "";
      }

      if (separator.startsWith(",\n")) {
        walker.write(separator.substring(1));
      }
      if (braces) {
        walker.write("}");
      }
      state.indentLess(RenderState.INDENT_PER_LEVEL);
    }
  }

  private String keyValueList(Node list, String separator) throws ParserException {
    List<Node> items = new ArrayList<>(list.children());
    int length = items.size();
    if (list.child(-1).kindStartsWith("BUILD_MAP")) {
      length--;
    }
    int line = state.lineNumber();
    for (int i = 0; i + 1 < length; i += 2) {
      walker.write(separator);
      String name = walker.traverseAt(items.get(i), "");
      if (i > 0) {
        if (line != state.lineNumber()) {
          walker.write("\n" + walker.indent() + CONTINUATION + CONTINUATION);
        }
      }
      line = state.lineNumber();
      walker.write(name, ": ");
      String valueIndent = walker.indent() + " ".repeat(name.length() + 2);
      walker.write(walker.traverseAt(items.get(i + 1), valueIndent));
      separator = ", ";
      if (line != state.lineNumber()) {
        separator += "\n" + walker.indent() + CONTINUATION;
        line = state.lineNumber();
      }
    }
    return separator;
  }

  private String constantKeyMap(Node node, String separator) throws ParserException {
    ImmutableList<Object> keys = Nodes.token(node.child(-2)).listAttr();
    ImmutableList<Node> values = node.slice(0, -2);
    Verify.verify(
        keys.size() == values.size(), "%s keys for %s values", keys.size(), values.size());
    for (int i = 0; i < keys.size(); i++) {
      walker.write(separator, PythonLiterals.repr(keys.get(i)), ": ");
      int line = state.lineNumber();
      Node value = values.get(i);
      walker.write(walker.traverse(value.is("expr") ? value.child(0) : value));
      separator = ", ";
      if (line != state.lineNumber()) {
        separator = ",\n" + walker.indent() + CONTINUATION;
      }
    }
    return separator;
  }
}
