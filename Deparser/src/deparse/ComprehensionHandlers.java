package deparse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * List, set and dict comprehensions and generator expressions.
 *
 * <p>The compiler turns each of these into a call of a nested code object on the outer iterable.
 * The nested code may be inlined into the call site or reached through a closure; either way its
 * tree is rebuilt and searched for the chain of for/if clauses leading down to the body
 * expression, and the outer iterable replaces the nested code's {@code .0} argument.
 */
final class ComprehensionHandlers {
  private static final ImmutableSet<String> ITER_KINDS =
      ImmutableSet.of("list_iter", "comp_iter", "set_iter", "set_iter_async");

  private static final ImmutableSet<String> FOR_KINDS =
      ImmutableSet.of("list_for", "comp_for", "set_for", "list_afor", "set_afor");

  private static final ImmutableSet<String> IF_KINDS =
      ImmutableSet.of("list_if", "comp_if", "list_if37", "set_if");

  private static final ImmutableSet<String> IF_NOT_KINDS =
      ImmutableSet.of("list_if_not", "comp_if_not", "list_if37_not", "set_if_not");

  // ::= expr POP_JUMP_IF_TRUE expr POP_JUMP_IF_FALSE <iter>
  private static final ImmutableSet<String> IF_OR_KINDS =
      ImmutableSet.of("list_if_or", "comp_if_or");

  // Conditions combining two or three tests, written out through their templates.
  private static final ImmutableSet<String> COMPOUND_IF_KINDS =
      ImmutableSet.of(
          "comp_if_not_and",
          "comp_if_not_or",
          "comp_if_or2",
          "comp_if_or_not",
          "list_if_and_or",
          "list_if_chained");

  // Compound conditions whose top operator is "or".
  private static final ImmutableSet<String> OR_RESULT_KINDS =
      ImmutableSet.of("comp_if_or2", "comp_if_or_not", "list_if_and_or");

  private static final ImmutableSet<String> BODY_KINDS =
      ImmutableSet.of("lc_body", "comp_body", "set_comp_body", "gen_comp_body");

  private static final ImmutableSet<String> WRAPPERS =
      ImmutableSet.of("stmt", "sstmt", "return", "return_expr", "return_expr_lambda");

  private static final int AND = 24;
  private static final int NOT = 22;

  private final SourceWalker walker;
  private final RenderState state;

  ComprehensionHandlers(SourceWalker walker) {
    this.walker = walker;
    this.state = walker.state();
  }

  void register(ImmutableMap.Builder<String, NodeHandler> handlers) {
    handlers.put("list_comp", node -> comprehension(node, "[", "]"));
    handlers.put("list_comp_async", node -> comprehension(node, "[", "]"));
    handlers.put("generator_exp", node -> comprehension(node, "(", ")"));
    handlers.put("generator_exp_async", node -> comprehension(node, "(", ")"));
    handlers.put("set_comp", node -> comprehension(node, "{", "}"));
    handlers.put("set_comp_async", node -> comprehension(node, "{", "}"));
    handlers.put("dict_comp", node -> comprehension(node, "{", "}"));
    handlers.put("dict_comp_async", node -> comprehension(node, "{", "}"));
  }

  private static final class Clause {
    final Node store;
    final Node source;
    final boolean async;
    final List<Condition> conditions = new ArrayList<>();

    Clause(Node store, Node source, boolean async) {
      this.store = store;
      this.source = source;
      this.async = async;
    }
  }

  private static final class Condition {
    final Node test;
    final boolean negated;
    final Optional<Node> alternative;
    final boolean compound;

    Condition(Node test, boolean negated, Optional<Node> alternative) {
      this(test, negated, alternative, false);
    }

    private Condition(Node test, boolean negated, Optional<Node> alternative, boolean compound) {
      this.test = test;
      this.negated = negated;
      this.alternative = alternative;
      this.compound = compound;
    }

    static Condition compound(Node node) {
      return new Condition(node, false, Optional.empty(), true);
    }
  }

  private void comprehension(Node node, String open, String close) throws ParserException {
    walker.write(open);
    try (RenderState.Restorer r = state.withPrecedence(Precedence.COMPREHENSION)) {
      Optional<Token> code = findCode(node);
      if (!code.isPresent()) {
        walkFunction(node, Optional.empty(), node.kind().contains("async"));
      } else {
        Optional<Node> function = comprehensionFunction(node, code.get());
        if (function.isPresent()) {
          walkFunction(function.get(), collectionOf(node), node.kind().contains("async"));
        } else {
          walker.writeUnparsed(Nodes.code(code.get()));
        }
      }
    }
    walker.write(close);
  }

  static Optional<Token> findCode(Node node) {
    for (Node child : node.children()) {
      if (Nodes.isCode(child)) return Optional.of((Token) child);
      if (child.is("load_genexpr") && !child.isEmpty() && Nodes.isCode(child.child(0))) {
        return Optional.of((Token) child.child(0));
      }
    }
    return Optional.empty();
  }

  static Optional<Node> collectionOf(Node node) {
    ImmutableList<Node> children = node.children();
    for (int i = 0; i < children.size(); i++) {
      Node child = children.get(i);
      if (child.isAny("get_iter", "get_aiter") && !child.isEmpty()) {
        return Optional.of(child.child(0));
      }
      if (child.isAny("GET_ITER", "GET_AITER") && i > 0) {
        return Optional.of(children.get(i - 1));
      }
    }
    return node.size() >= 3 ? Optional.of(node.child(-3)) : Optional.empty();
  }

  private Optional<Node> comprehensionFunction(Node node, Token codeToken) throws ParserException {
    CodeObject code = Nodes.code(codeToken);
    Optional<SyntaxTree> built;
    if (node.size() > 3 && node.child(3).is("get_aiter")) {
      try (RenderState.Restorer mode = walker.withNestedLambdaMode(CompileMode.GENEXPR)) {
        built = walker.buildNested(code, true);
      }
    } else {
      built = walker.buildNested(code, walker.isLambda());
    }
    if (!built.isPresent()) return Optional.empty();

    Node tree = built.get();
    if (tree.is("lambda_start")
        && tree.size() > 1
        && tree.child(0).isAny("dom_start", "dom_start_opt")) {
      tree = tree.child(1);
    }
    while (!tree.isEmpty() && (tree.size() == 1 || tree.isIn(WRAPPERS))) {
      tree = tree.child(0).isAny("dom_start", "dom_start_opt") ? tree.child(1) : tree.child(0);
    }
    return Optional.of(tree);
  }

  private void walkFunction(Node function, Optional<Node> collection, boolean async)
      throws ParserException {
    List<Clause> clauses = new ArrayList<>();
    Node n = function;

    // Generator and set/dict functions loop at the top level: LOAD_ARG FOR_ITER store <iter>.
    Optional<Node> topStore = childOfKind(function, "store");
    Optional<Node> topIter = firstChildIn(function, ITER_KINDS);
    if (topStore.isPresent() && topIter.isPresent()) {
      clauses.add(new Clause(topStore.get(), null, async));
      n = topIter.get();
    } else if (topIter.isPresent()) {
      n = topIter.get();
    }

    Node body = null;
    while (body == null) {
      if (n.isIn(ITER_KINDS)) {
        Verify.verify(!n.isEmpty(), "empty %s", n.kind());
        n = n.child(0);
      } else if (n.is("list_afor2")) {
        // ::= async_iter store list_iter ...
        clauses.add(new Clause(n.child(1), null, true));
        n = n.size() > 3 && n.child(3).is("list_iter") ? n.child(3) : n.child(2);
      } else if (n.isIn(FOR_KINDS)) {
        boolean asyncFor = n.isAny("list_afor", "set_afor");
        clauses.add(new Clause(n.child(2), n.child(0), asyncFor));
        n = n.child(3);
      } else if (n.isIn(IF_KINDS) || n.isIn(IF_NOT_KINDS)) {
        lastClause(clauses, n)
            .conditions
            .add(new Condition(n.child(0), n.isIn(IF_NOT_KINDS), Optional.empty()));
        n = n.child(-1).is("come_from_opt") ? n.child(-2) : n.child(-1);
      } else if (n.isIn(COMPOUND_IF_KINDS)) {
        lastClause(clauses, n).conditions.add(Condition.compound(n));
        n = n.child(-1);
      } else if (n.isIn(IF_OR_KINDS)) {
        lastClause(clauses, n)
            .conditions
            .add(new Condition(n.child(0), false, Optional.of(n.child(2))));
        n = n.child(-1);
      } else {
        body = n;
      }
    }

    renderBody(body);
    for (int i = 0; i < clauses.size(); i++) {
      Clause clause = clauses.get(i);
      walker.write(clause.async ? " async for " : " for ");
      walker.preorder(clause.store);
      walker.write(" in ");
      Node source = i == 0 && collection.isPresent() ? collection.get() : clause.source;
      Verify.verify(source != null, "no iterable for the outermost for clause");
      walker.preorder(source);
      renderConditions(clause.conditions);
    }
  }

  private static Clause lastClause(List<Clause> clauses, Node ifNode) {
    Verify.verify(!clauses.isEmpty(), "%s before any for clause", ifNode.kind());
    return clauses.get(clauses.size() - 1);
  }

  // comp_body ::= gen_comp_body ::= expr YIELD_VALUE POP_TOP
  private void renderBody(Node body) throws ParserException {
    while (body.isIn(BODY_KINDS) && !body.isEmpty()) {
      body = body.child(0);
    }
    if (body.is("dict_comp_body")) {
      walker.preorder(body.child(0));
      walker.write(": ");
      walker.preorder(body.child(1));
    } else {
      walker.preorder(body);
    }
  }

  private void renderConditions(List<Condition> conditions) throws ParserException {
    if (conditions.isEmpty()) return;
    walker.write(" if ");
    boolean joined = conditions.size() > 1;
    for (int i = 0; i < conditions.size(); i++) {
      if (i > 0) {
        walker.write(" and ");
      }
      renderCondition(conditions.get(i), joined);
    }
  }

  private void renderCondition(Condition condition, boolean joined) throws ParserException {
    int precedence = joined ? AND : Precedence.COMPREHENSION;
    if (condition.compound) {
      boolean parenthesize = joined && condition.test.isIn(OR_RESULT_KINDS);
      if (parenthesize) walker.write("(");
      walker.preorder(condition.test);
      if (parenthesize) walker.write(")");
      return;
    }
    if (condition.alternative.isPresent()) {
      if (joined) walker.write("(");
      try (RenderState.Restorer r = state.withPrecedence(Precedence.TABLE.get("or"))) {
        walker.preorder(condition.test);
        walker.write(" or ");
        walker.preorder(condition.alternative.get());
      }
      if (joined) walker.write(")");
      return;
    }
    if (condition.negated) {
      walker.write("not ");
      precedence = NOT;
    }
    try (RenderState.Restorer r = state.withPrecedence(precedence)) {
      walker.preorder(condition.test);
    }
  }

  private static Optional<Node> childOfKind(Node node, String kind) {
    for (Node child : node.children()) {
      if (child.is(kind)) return Optional.of(child);
    }
    return Optional.empty();
  }

  private static Optional<Node> firstChildIn(Node node, ImmutableSet<String> kinds) {
    for (Node child : node.children()) {
      if (child.isIn(kinds)) return Optional.of(child);
    }
    return Optional.empty();
  }
}
