package deparse;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A format string compiled into directives. Literal text is copied out; {@code %} introduces a
 * marker, optionally prefixed by {@code [N]} to apply it to child N:
 *
 * <ul>
 *   <li>{@code %c} render a child, optionally checking its kind
 *   <li>{@code %p} render a child with a precedence installed
 *   <li>{@code %C} render a range of children joined by a separator
 *   <li>{@code %P} same, with a precedence installed
 *   <li>{@code %D} same as {@code %C} but empty subtrees are skipped along with their separator
 *   <li>{@code %,} a trailing comma for one-element unpacking
 *   <li>{@code %|} the current indent, {@code %+} indent more, {@code %-} indent less
 *   <li>{@code %{attr}} write a node attribute; {@code %{%c}} apply a nested marker
 *   <li>{@code %%} a percent sign
 * </ul>
 */
final class Template {
  private final String format;
  private final ImmutableList<Arg> args;
  private final ImmutableList<Directive> directives;

  private Template(String format, ImmutableList<Arg> args) {
    this.format = format;
    this.args = args;
    List<Arg> remaining = new ArrayList<>(args);
    this.directives = compile(format, remaining);
    Preconditions.checkArgument(
        remaining.isEmpty(), "template '%s' has %s unused arguments", format, remaining.size());
  }

  static Template of(String format, Object... args) {
    ImmutableList.Builder<Arg> list = ImmutableList.builder();
    for (Object arg : args) {
      if (arg instanceof Integer) {
        list.add(child((Integer) arg));
      } else if (arg instanceof Arg) {
        list.add((Arg) arg);
      } else {
        throw new IllegalArgumentException(
            "bad template argument " + arg + " for '" + format + "'");
      }
    }
    return new Template(format, list.build());
  }

  static ChildArg child(int index) {
    return new ChildArg(index, ImmutableSet.of(), OptionalInt.empty());
  }

  static ChildArg child(int index, String... kinds) {
    return new ChildArg(index, ImmutableSet.copyOf(kinds), OptionalInt.empty());
  }

  static ChildArg prec(int index, int precedence) {
    return new ChildArg(index, ImmutableSet.of(), OptionalInt.of(precedence));
  }

  static ChildArg prec(int index, String kind, int precedence) {
    return new ChildArg(index, ImmutableSet.of(kind), OptionalInt.of(precedence));
  }

  static RangeArg range(int low, int high, String separator) {
    return new RangeArg(low, high, separator, OptionalInt.empty());
  }

  static RangeArg range(int low, int high, String separator, int precedence) {
    return new RangeArg(low, high, separator, OptionalInt.of(precedence));
  }

  String format() {
    return format;
  }

  void expand(SourceWalker walker, Node node) throws ParserException {
    for (Directive directive : directives) {
      Node target = node;
      if (directive.selector.isPresent()) {
        target = node.child(directive.selector.getAsInt());
      }
      directive.apply(walker, target);
    }
  }

  @Override
  public String toString() {
    String quoted = "'" + format.replace("\n", "\\n") + "'";
    return args.isEmpty() ? quoted : "(" + quoted + ", " + Joiner.on(", ").join(args) + ")";
  }

  // Compilation

  private static ImmutableList<Directive> compile(String format, List<Arg> remaining) {
    ImmutableList.Builder<Directive> directives = ImmutableList.builder();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < format.length()) {
      char c = format.charAt(i);
      if (c != '%') {
        literal.append(c);
        i++;
        continue;
      }
      i++;
      Preconditions.checkArgument(i < format.length(), "dangling % in '%s'", format);

      OptionalInt selector = OptionalInt.empty();
      if (format.charAt(i) == '[') {
        int close = format.indexOf(']', i);
        Preconditions.checkArgument(close > i, "unclosed [ in '%s'", format);
        selector = OptionalInt.of(Integer.parseInt(format.substring(i + 1, close)));
        i = close + 1;
        Preconditions.checkArgument(i < format.length(), "dangling selector in '%s'", format);
      }

      char type = format.charAt(i);
      if (type == '%' && !selector.isPresent()) {
        literal.append('%');
        i++;
        continue;
      }

      if (literal.length() > 0) {
        directives.add(new LiteralDirective(literal.toString()));
        literal.setLength(0);
      }

      if (type == '{') {
        int close = format.indexOf('}', i);
        Preconditions.checkArgument(close > i, "unclosed { in '%s'", format);
        String expr = format.substring(i + 1, close);
        i = close + 1;
        if (expr.startsWith("%")) {
          Template nested = new Template(expr, ImmutableList.of(takeArg(format, remaining)));
          directives.add(new NestedDirective(selector, nested));
        } else {
          directives.add(new AttributeDirective(selector, expr));
        }
        continue;
      }

      i++;
      directives.add(markerDirective(format, type, selector, remaining));
    }
    if (literal.length() > 0) {
      directives.add(new LiteralDirective(literal.toString()));
    }
    return directives.build();
  }

  private static Directive markerDirective(
      String format, char type, OptionalInt selector, List<Arg> remaining) {
    switch (type) {
      case '|':
        return new IndentDirective(selector);
      case '+':
        return new IndentMoreDirective(selector);
      case '-':
        return new IndentLessDirective(selector);
      case ',':
        return new TrailingCommaDirective(selector);
      case 'c':
        return new ChildDirective(selector, childArg(format, type, remaining));
      case 'p':
        {
          ChildArg arg = childArg(format, type, remaining);
          Preconditions.checkArgument(
              arg.precedence.isPresent(), "%p in '%s' needs a precedence", format);
          return new ChildDirective(selector, arg);
        }
      case 'C':
      case 'D':
        return new RangeDirective(selector, rangeArg(format, type, remaining), type == 'D');
      case 'P':
        {
          RangeArg arg = rangeArg(format, type, remaining);
          Preconditions.checkArgument(
              arg.precedence.isPresent(), "%P in '%s' needs a precedence", format);
          return new RangeDirective(selector, arg, false);
        }
      case '%':
        return new LiteralDirective("%");
      default:
        throw new IllegalArgumentException("unknown marker %" + type + " in '" + format + "'");
    }
  }

  private static Arg takeArg(String format, List<Arg> remaining) {
    Preconditions.checkArgument(!remaining.isEmpty(), "template '%s' is missing arguments", format);
    return remaining.remove(0);
  }

  private static ChildArg childArg(String format, char type, List<Arg> remaining) {
    Arg arg = takeArg(format, remaining);
    Preconditions.checkArgument(
        arg instanceof ChildArg, "%%s in '%s' needs a child argument, got %s", type, format, arg);
    return (ChildArg) arg;
  }

  private static RangeArg rangeArg(String format, char type, List<Arg> remaining) {
    Arg arg = takeArg(format, remaining);
    Preconditions.checkArgument(
        arg instanceof RangeArg, "%%s in '%s' needs a range argument, got %s", type, format, arg);
    return (RangeArg) arg;
  }

  // Arguments

  abstract static class Arg {}

  static final class ChildArg extends Arg {
    private final int index;
    private final ImmutableSet<String> kinds;
    private final OptionalInt precedence;

    private ChildArg(int index, ImmutableSet<String> kinds, OptionalInt precedence) {
      this.index = index;
      this.kinds = kinds;
      this.precedence = precedence;
    }

    Node select(Node node) {
      Node child = node.child(index);
      if (!kinds.isEmpty() && !child.isIn(kinds)) {
        throw TemplateException.unexpectedChild(
            node, index, kinds.size() == 1 ? kinds.iterator().next() : kinds, child);
      }
      return child;
    }

    @Override
    public String toString() {
      List<Object> parts = new ArrayList<>();
      parts.add(index);
      if (!kinds.isEmpty()) parts.add(kinds.size() == 1 ? kinds.iterator().next() : kinds);
      precedence.ifPresent(parts::add);
      return parts.size() == 1 ? String.valueOf(index) : "(" + Joiner.on(", ").join(parts) + ")";
    }
  }

  static final class RangeArg extends Arg {
    private final int low;
    private final int high;
    private final String separator;
    private final OptionalInt precedence;

    private RangeArg(int low, int high, String separator, OptionalInt precedence) {
      this.low = low;
      this.high = high;
      this.separator = separator;
      this.precedence = precedence;
    }

    @Override
    public String toString() {
      String high = this.high == Integer.MAX_VALUE ? "max" : String.valueOf(this.high);
      String base = "(" + low + ", " + high + ", '" + separator + "'";
      return precedence.isPresent() ? base + ", " + precedence.getAsInt() + ")" : base + ")";
    }
  }

  // Directives

  private abstract static class Directive {
    final OptionalInt selector;

    Directive(OptionalInt selector) {
      this.selector = selector;
    }

    abstract void apply(SourceWalker walker, Node node) throws ParserException;
  }

  private static final class LiteralDirective extends Directive {
    private final String text;

    LiteralDirective(String text) {
      super(OptionalInt.empty());
      this.text = text;
    }

    @Override
    void apply(SourceWalker walker, Node node) {
      walker.write(text);
    }
  }

  private static final class IndentDirective extends Directive {
    IndentDirective(OptionalInt selector) {
      super(selector);
    }

    @Override
    void apply(SourceWalker walker, Node node) {
      walker.state().advanceLine();
      walker.write(walker.indent());
    }
  }

  private static final class IndentMoreDirective extends Directive {
    IndentMoreDirective(OptionalInt selector) {
      super(selector);
    }

    @Override
    void apply(SourceWalker walker, Node node) {
      walker.state().advanceLine();
      walker.state().indentMore(RenderState.TAB);
    }
  }

  private static final class IndentLessDirective extends Directive {
    IndentLessDirective(OptionalInt selector) {
      super(selector);
    }

    @Override
    void apply(SourceWalker walker, Node node) {
      walker.state().advanceLine();
      walker.state().indentLess(RenderState.TAB);
    }
  }

  private static final class TrailingCommaDirective extends Directive {
    TrailingCommaDirective(OptionalInt selector) {
      super(selector);
    }

    @Override
    void apply(SourceWalker walker, Node node) {
      if (node.isAny("unpack", "unpack_w_parens")
          && node.child(0) instanceof Token
          && ((Token) node.child(0)).intAttr().orElse(-1) == 1) {
        walker.write(",");
      }
    }
  }

  private static final class ChildDirective extends Directive {
    private final ChildArg arg;

    ChildDirective(OptionalInt selector, ChildArg arg) {
      super(selector);
      this.arg = arg;
    }

    @Override
    void apply(SourceWalker walker, Node node) throws ParserException {
      Node child = arg.select(node);
      if (arg.precedence.isPresent()) {
        try (RenderState.Restorer r = walker.state().withPrecedence(arg.precedence.getAsInt())) {
          walker.preorder(child);
        }
      } else {
        walker.preorder(child);
      }
    }
  }

  private static final class RangeDirective extends Directive {
    private final RangeArg arg;
    private final boolean skipEmpty;

    RangeDirective(OptionalInt selector, RangeArg arg, boolean skipEmpty) {
      super(selector);
      this.arg = arg;
      this.skipEmpty = skipEmpty;
    }

    @Override
    void apply(SourceWalker walker, Node node) throws ParserException {
      int precedence = arg.precedence.orElse(walker.state().precedence());
      try (RenderState.Restorer r = walker.state().withPrecedence(precedence)) {
        ImmutableList<Node> children = node.slice(arg.low, arg.high);
        int remaining = children.size();
        for (Node child : children) {
          remaining--;
          if (skipEmpty && !child.isTerminal() && child.isEmpty()) continue;
          walker.preorder(child);
          if (remaining > 0) {
            walker.write(arg.separator);
          }
        }
      }
    }
  }

  private static final class AttributeDirective extends Directive {
    private final String path;

    AttributeDirective(OptionalInt selector, String path) {
      super(selector);
      this.path = path;
    }

    @Override
    void apply(SourceWalker walker, Node node) {
      walker.write(attribute(node, path));
    }

    private static String attribute(Node node, String path) {
      if (path.equals("kind")) return node.kind();
      if (!(node instanceof Token)) {
        throw new TemplateException(
            String.format(
                "%s has no attribute '%s'; only tokens carry operands", node.kind(), path));
      }
      Token token = (Token) node;
      switch (path) {
        case "pattr":
          return token.pattr();
        case "attr":
          return token.hasAttr() ? String.valueOf(token.attr()) : "None";
        case "offset":
          return String.valueOf(token.offset());
        case "linestart":
          return token.lineStart().map(String::valueOf).orElse("None");
        default:
          throw new TemplateException(
              String.format("unknown attribute '%s' on %s", path, node.kind()));
      }
    }
  }

  private static final class NestedDirective extends Directive {
    private final Template nested;

    NestedDirective(OptionalInt selector, Template nested) {
      super(selector);
      this.nested = nested;
    }

    @Override
    void apply(SourceWalker walker, Node node) throws ParserException {
      nested.expand(walker, node);
    }
  }
}
