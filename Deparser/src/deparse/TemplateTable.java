package deparse;

import static deparse.Template.child;
import static deparse.Template.prec;
import static deparse.Template.range;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

final class TemplateTable {
  private static final Logger logger = LoggerFactory.getLogger(TemplateTable.class);

  enum Lookup {
    DIRECT,
    LAST_CHILD;
  }

  private static final int MAX = Integer.MAX_VALUE;

  private static final ImmutableSet<String> KEYED_BY_LAST_CHILD =
      ImmutableSet.of("stmt", "call", "delete", "store");

  private static final ImmutableMap<String, Template> BY_LAST_CHILD =
      ImmutableMap.<String, Template>builder()
          .put("DELETE_ATTR", Template.of("%|del %c.%[-1]{pattr}\n", 0))
          .put("STORE_ATTR", Template.of("%c.%[1]{pattr}", 0))
          .put(
              "STORE_SUBSCR",
              Template.of(
                  "%p[%c]", prec(0, "expr", Precedence.SUBSCRIPT), child(1, "expr")))
          .put(
              "DELETE_SUBSCR",
              Template.of(
                  "%|del %p[%c]\n", prec(0, "expr", Precedence.SUBSCRIPT), child(1, "expr")))
          .build();

  private static final ImmutableMap<String, Template> DIRECT = directTemplates();

  private final Map<String, Template> customized = new HashMap<>();

  static Lookup lookupFor(String kind) {
    return KEYED_BY_LAST_CHILD.contains(kind) ? Lookup.LAST_CHILD : Lookup.DIRECT;
  }

  Optional<Template> templateFor(Node node) {
    switch (lookupFor(node.kind())) {
      case LAST_CHILD:
        if (node.isEmpty()) return Optional.empty();
        return byLastChild(node.child(-1).kind());
      case DIRECT:
      default:
        return Optional.ofNullable(DIRECT.get(node.kind()));
    }
  }

  Optional<Template> direct(String kind) {
    return Optional.ofNullable(DIRECT.get(kind));
  }

  private Optional<Template> byLastChild(String kind) {
    Template template = BY_LAST_CHILD.get(kind);
    return template != null ? Optional.of(template) : Optional.ofNullable(customized.get(kind));
  }

  /**
   * Adds call templates for the variable-arity opcodes a code object uses. Keys look like {@code
   * CALL_FUNCTION_2}; values are the opcode's argument count.
   */
  void customize(Map<String, Integer> opcodes) {
    for (Map.Entry<String, Integer> entry : opcodes.entrySet()) {
      String key = entry.getKey();
      if (BY_LAST_CHILD.containsKey(key) || customized.containsKey(key)) continue;
      Optional<Template> template = callTemplate(key, entry.getValue());
      if (template.isPresent()) {
        customized.put(key, template.get());
        logger.debug("customized {} as {}", key, template.get());
      }
    }
  }

  static Optional<Template> callTemplate(String opcode, int argCount) {
    int split = opcode.lastIndexOf('_');
    String op = split < 0 ? opcode : opcode.substring(0, split);

    if (opcode.startsWith("CALL_METHOD") || opcode.startsWith("CALL_FUNCTION_KW")) {
      return Optional.of(
          Template.of(
              "%c(%P)", child(0, "expr"), range(1, -1, ", ", Precedence.NO_PARENTHESIS_EVER)));
    }
    if (op.equals("CALL_FUNCTION")) {
      return Optional.of(
          Template.of("%c(%P)", child(0, "expr"), range(1, -1, ", ", Precedence.YIELD - 1)));
    }

    String start = argCount == 0 ? "%c(" : "%c(%C, ";
    switch (op) {
      case "CALL_FUNCTION_VAR":
        return Optional.of(
            argCount == 0
                ? Template.of(start + "*%c)", 0, -2)
                : Template.of(start + "*%c)", 0, range(1, -2, ", "), -2));
      case "CALL_FUNCTION_VAR_KW":
        return Optional.of(
            argCount == 0
                ? Template.of(start + "*%c, **%c)", 0, -3, -2)
                : Template.of(start + "*%c, **%c)", 0, range(1, -3, ", "), -3, -2));
      default:
        return Optional.empty();
    }
  }

  private static ImmutableMap<String, Template> directTemplates() {
    ImmutableMap.Builder<String, Template> t = ImmutableMap.builder();

    // Operator glyphs.
    glyph(t, "BINARY_POWER", "**");
    glyph(t, "BINARY_MULTIPLY", "*");
    glyph(t, "BINARY_MATRIX_MULTIPLY", "@");
    glyph(t, "BINARY_TRUE_DIVIDE", "/");
    glyph(t, "BINARY_FLOOR_DIVIDE", "//");
    glyph(t, "BINARY_MODULO", "%%");
    glyph(t, "BINARY_ADD", "+");
    glyph(t, "BINARY_SUBTRACT", "-");
    glyph(t, "BINARY_LSHIFT", "<<");
    glyph(t, "BINARY_RSHIFT", ">>");
    glyph(t, "BINARY_AND", "&");
    glyph(t, "BINARY_XOR", "^");
    glyph(t, "BINARY_OR", "|");
    glyph(t, "INPLACE_POWER", "**=");
    glyph(t, "INPLACE_MULTIPLY", "*=");
    glyph(t, "INPLACE_MATRIX_MULTIPLY", "@=");
    glyph(t, "INPLACE_TRUE_DIVIDE", "/=");
    glyph(t, "INPLACE_FLOOR_DIVIDE", "//=");
    glyph(t, "INPLACE_MODULO", "%%=");
    glyph(t, "INPLACE_ADD", "+=");
    glyph(t, "INPLACE_SUBTRACT", "-=");
    glyph(t, "INPLACE_LSHIFT", "<<=");
    glyph(t, "INPLACE_RSHIFT", ">>=");
    glyph(t, "INPLACE_AND", "&=");
    glyph(t, "INPLACE_XOR", "^=");
    glyph(t, "INPLACE_OR", "|=");
    glyph(t, "UNARY_POSITIVE", "+");
    glyph(t, "UNARY_NEGATIVE", "-");
    glyph(t, "UNARY_INVERT", "~");

    // Names.
    for (String op :
        new String[] {
          "LOAD_FAST", "LOAD_NAME", "LOAD_GLOBAL", "LOAD_DEREF", "LOAD_CLASSNAME",
          "STORE_FAST", "STORE_NAME", "STORE_GLOBAL", "STORE_DEREF"
        }) {
      t.put(op, Template.of("%{pattr}"));
    }
    for (String op : new String[] {"DELETE_FAST", "DELETE_NAME", "DELETE_GLOBAL", "DELETE_DEREF"}) {
      t.put(op, Template.of("%|del %{pattr}\n"));
    }

    // Expressions.
    t.put("attribute", Template.of("%c.%[1]{pattr}", child(0, "expr")));
    t.put("attribute_w_parens", Template.of("(%c).%[1]{pattr}", child(0, "expr")));
    t.put("store_w_parens", Template.of("(%c).%[1]{pattr}", child(0, "expr")));
    t.put(
        "subscript",
        Template.of(
            "%p[%p]",
            prec(0, "expr", Precedence.SUBSCRIPT),
            prec(1, "expr", Precedence.NO_PARENTHESIS_EVER)));
    t.put(
        "subscript2",
        Template.of(
            "%p[%p]",
            prec(0, "expr", Precedence.SUBSCRIPT),
            prec(1, "expr", Precedence.NO_PARENTHESIS_EVER)));
    t.put(
        "store_subscript",
        Template.of("%p[%c]", prec(0, "expr", Precedence.SUBSCRIPT), child(1, "expr")));
    t.put(
        "delete_subscript",
        Template.of("%|del %p[%c]\n", prec(0, "expr", Precedence.SUBSCRIPT), child(1, "expr")));
    t.put("build_tuple2", Template.of("%P", range(0, -1, ", ", Precedence.NO_PARENTHESIS_EVER)));
    t.put(
        "unary_op",
        Template.of("%c%p", child(1, "unary_operator"), prec(0, "expr", Precedence.UNARY)));
    t.put("unary_not", Template.of("not %p", prec(0, "expr", 22)));
    t.put("and", Template.of("%p and %p", prec(0, 24), prec(2, 24)));
    t.put("or", Template.of("%p or %p", prec(0, 26), prec(2, 26)));
    t.put("ret_and", Template.of("%c and %c", 0, 2));
    t.put("ret_or", Template.of("%c or %c", 0, 2));
    t.put("compare_single", Template.of("%p %[-1]{pattr} %p", prec(0, 19), prec(1, 19)));
    t.put(
        "if_exp",
        Template.of(
            "%p if %p else %p",
            prec(2, "expr", 27),
            prec(0, "expr", 27),
            prec(4, "expr", 27)));
    t.put(
        "if_exp_not",
        Template.of(
            "%p if not %p else %p",
            prec(2, "expr", 27),
            prec(0, "expr", 22),
            prec(4, "expr", 27)));
    t.put(
        "named_expr",
        Template.of("%c := %p", child(2, "store"), prec(0, "expr", Precedence.NAMED_EXPR)));
    t.put("await_expr", Template.of("await %p", prec(0, "expr", 2)));
    t.put("yield_from", Template.of("yield from %c", child(0, "expr")));
    t.put("starred", Template.of("*%c", child(0, "expr")));
    t.put("kwarg", Template.of("%[0]{pattr}=%c", 1));
    t.put("kwargs", Template.of("%D", range(0, MAX, ", ")));
    t.put(
        "call_ex",
        Template.of("%c(%p)", child(0, "expr"), prec(1, Precedence.NO_PARENTHESIS_EVER)));
    t.put("unpack", Template.of("%C%,", range(1, MAX, ", ")));
    t.put("unpack_w_parens", Template.of("(%C%,)", range(1, MAX, ", ")));
    t.put("yield", Template.of("yield %c", 0));

    // Comprehension clauses.
    t.put("list_iter", Template.of("%c", 0));
    t.put("list_for", Template.of(" for %c in %c%c", 2, 0, 3));
    t.put("list_if", Template.of(" if %p%c", prec(0, "expr", Precedence.COMPREHENSION), 2));
    t.put("list_if_not", Template.of(" if not %p%c", prec(0, "expr", 22), 2));
    t.put("lc_body", Template.of(""));
    t.put("comp_iter", Template.of("%c", 0));
    t.put("comp_for", Template.of(" for %c in %c%c", 2, 0, 3));
    t.put("comp_if", Template.of(" if %p%c", prec(0, "expr", Precedence.COMPREHENSION), 2));
    t.put("comp_if_not", Template.of(" if not %p%c", prec(0, "expr", 22), 2));
    t.put("comp_body", Template.of(""));
    t.put(
        "comp_if_not_and",
        Template.of("not (%p and %p)", prec(0, "expr", 24), prec(2, "expr", 24)));
    t.put(
        "comp_if_not_or", Template.of("not (%p or %p)", prec(0, "expr", 26), prec(2, "expr", 26)));
    t.put("comp_if_or2", Template.of("%p or %p", prec(0, "expr", 26), prec(2, "expr", 26)));
    t.put("comp_if_or_not", Template.of("%p or not %p", prec(0, "expr", 26), prec(2, "expr", 22)));
    t.put(
        "list_if_and_or",
        Template.of(
            "%p and %p or %p", prec(0, "expr", 24), prec(2, "expr", 24), prec(4, "expr", 26)));
    t.put("list_if_chained", Template.of("%c", child(0, "list_if_compare")));
    t.put("list_if_compare", Template.of("%p", prec(0, "expr", Precedence.COMPREHENSION)));
    t.put("set_iter", Template.of("%c", 0));
    t.put("set_for", Template.of(" for %c in %c%c", 2, 0, 3));

    // Simple statements.
    t.put("pass", Template.of("%|pass\n"));
    t.put("continue", Template.of("%|continue\n"));
    t.put("break", Template.of("%|break\n"));
    t.put("expr_stmt", Template.of("%|%p\n", prec(0, "expr", Precedence.NAMED_EXPR - 1)));
    t.put("call_stmt", Template.of("%|%p\n", prec(0, Precedence.NAMED_EXPR - 1)));
    t.put("await_stmt", Template.of("%|%c\n", 0));
    t.put("assign", Template.of("%|%c = %p\n", -1, prec(0, 200)));
    t.put("assign2", Template.of("%|%c, %c = %c, %c\n", 3, 4, 0, 1));
    t.put("assign3", Template.of("%|%c, %c, %c = %c, %c, %c\n", 5, 6, 7, 0, 1, 2));
    t.put("aug_assign1", Template.of("%|%c %c %c\n", 0, 2, 1));
    t.put("aug_assign2", Template.of("%|%c.%[2]{pattr} %c %c\n", 0, -3, -4));
    t.put("raise_stmt0", Template.of("%|raise\n"));
    t.put("raise_stmt1", Template.of("%|raise %c\n", 0));
    t.put("raise_stmt2", Template.of("%|raise %c from %c\n", 0, 1));
    t.put("assert", Template.of("%|assert %c\n", 0));
    t.put("assert2", Template.of("%|assert %c, %c\n", 0, 3));
    t.put("importstmt", Template.of("%|import %c\n", 2));
    t.put("import_from", Template.of("%|from %[2]{pattr} import %c\n", child(3, "importlist")));
    t.put("import_from_star", Template.of("%|from %[2]{pattr} import *\n"));
    t.put("importlist", Template.of("%C", range(0, MAX, ", ")));
    t.put("store_locals", Template.of("%|# STORE_LOCALS\n"));

    // Compound statements.
    t.put("testtrue", Template.of("not %p", prec(0, 22)));
    t.put("ifstmt", Template.of("%|if %c:\n%+%c%-", 0, 1));
    t.put("iflaststmt", Template.of("%|if %c:\n%+%c%-", 0, 1));
    t.put("iflaststmtc", Template.of("%|if %c:\n%+%c%-", 0, 1));
    t.put("ifelsestmt", Template.of("%|if %c:\n%+%c%-%|else:\n%+%c%-", 0, 1, 3));
    t.put("ifelsestmtc", Template.of("%|if %c:\n%+%c%-%|else:\n%+%c%-", 0, 1, 3));
    t.put("ifelsestmtl", Template.of("%|if %c:\n%+%c%-%|else:\n%+%c%-", 0, 1, 3));
    t.put("ifelsestmtr", Template.of("%|if %c:\n%+%c%-%|else:\n%+%c%-", 0, 1, 2));
    t.put("elifelsestmtr", Template.of("%|elif %c:\n%+%c%-%|else:\n%+%c%-\n\n", 0, 1, 2));
    t.put("ifelsestmtr2", Template.of("%|if %c:\n%+%c%-%|else:\n%+%c%-", 0, 1, 3));
    t.put("elifelsestmtr2", Template.of("%|elif %c:\n%+%c%-%|else:\n%+%c%-\n\n", 0, 1, 3));
    t.put("ifelifstmt", Template.of("%|if %c:\n%+%c%-%c", 0, 1, 3));
    t.put("elifelifstmt", Template.of("%|elif %c:\n%+%c%-%c", 0, 1, 3));
    t.put("elifstmt", Template.of("%|elif %c:\n%+%c%-", 0, 1));
    t.put("elifelsestmt", Template.of("%|elif %c:\n%+%c%-%|else:\n%+%c%-", 0, 1, 3));
    t.put("whilestmt", Template.of("%|while %c:\n%+%c%-\n\n", 1, 2));
    t.put("whileTruestmt", Template.of("%|while True:\n%+%c%-\n\n", 1));
    t.put("whileelsestmt", Template.of("%|while %c:\n%+%c%-%|else:\n%+%c%-\n\n", 1, 2, -2));
    t.put(
        "for",
        Template.of(
            "%|for %c in %c:\n%+%c%-\n\n",
            child(3, "store"),
            child(1, "expr"),
            child(4, "for_block")));
    t.put(
        "for38",
        Template.of(
            "%|for %c in %c:\n%+%c%-\n\n",
            child(2, "store"),
            child(0, "expr"),
            child(3, "for_block")));
    t.put(
        "forelsestmt",
        Template.of(
            "%|for %c in %c:\n%+%c%-%|else:\n%+%c%-\n\n",
            child(3, "store"),
            child(1, "expr"),
            child(4, "for_block"),
            -2));
    t.put("try_except", Template.of("%|try:\n%+%c%-%c\n\n", 1, 3));
    t.put("tryfinallystmt", Template.of("%|try:\n%+%c%-%|finally:\n%+%c%-\n\n", 1, 5));
    t.put("except", Template.of("%|except:\n%+%c%-", 3));
    t.put("except_cond1", Template.of("%|except %c:\n", 1));
    t.put("except_cond2", Template.of("%|except %c as %c:\n", 1, 5));
    t.put("except_suite", Template.of("%+%c%-%C", 0, range(1, MAX, "")));
    t.put("with", Template.of("%|with %c:\n%+%c%-", 0, 3));
    t.put("withasstmt", Template.of("%|with %c as %c:\n%+%c%-", 0, 2, 3));

    // Definitions.
    t.put("function_def", Template.of("\n\n%|def %c\n", -2));
    t.put("function_def_deco", Template.of("\n\n%c", 0));
    t.put("mkfuncdeco", Template.of("%|@%c\n%c", 0, 1));
    t.put("mkfuncdeco0", Template.of("%|def %c\n", child(0, "mkfunc")));
    t.put("classdefdeco", Template.of("\n\n%c", 0));
    t.put("classdefdeco1", Template.of("%|@%c\n%c", 0, 1));

    return t.build();
  }

  private static void glyph(ImmutableMap.Builder<String, Template> t, String kind, String glyph) {
    t.put(kind, Template.of(glyph));
  }
}
