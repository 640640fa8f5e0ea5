package deparse;

import static com.google.common.truth.Truth.assertThat;
import static deparse.TreeFixtures.assign;
import static deparse.TreeFixtures.binOp;
import static deparse.TreeFixtures.code;
import static deparse.TreeFixtures.constant;
import static deparse.TreeFixtures.expr;
import static deparse.TreeFixtures.fast;
import static deparse.TreeFixtures.load;
import static deparse.TreeFixtures.named;
import static deparse.TreeFixtures.render;
import static deparse.TreeFixtures.stmts;
import static deparse.TreeFixtures.store;
import static deparse.TreeFixtures.storeFast;
import static deparse.TreeFixtures.string;
import static deparse.TreeFixtures.token;
import static deparse.TreeFixtures.tree;

import org.junit.jupiter.api.Test;

public class ComprehensionHandlersTest {

  private static final String MODULE = "<module>";

  /** Deparses {@code r = <comprehension>} where the comprehension's code has the given tree. */
  private static String deparse(SyntaxTree comprehension, String codeName, SyntaxTree function)
      throws ParserException, DeparseException {
    ScriptedFrontEnd frontEnd = new ScriptedFrontEnd();
    frontEnd.tree(MODULE, stmts(assign(expr(comprehension), store("r"))));
    frontEnd.tree(codeName, tree("lambda_start", tree("return_expr_lambda", function)));
    return new Deparser(frontEnd, frontEnd).deparse(code(MODULE)).text();
  }

  // The call site: MAKE_FUNCTION over the code, then a call on the outer iterable.
  private static SyntaxTree inline(String kind, String loadOp, String codeName, Node iterable) {
    return tree(
        kind,
        token(loadOp, code(codeName)),
        string(codeName),
        token("MAKE_FUNCTION_0", 0),
        iterable,
        token("GET_ITER"),
        token("CALL_FUNCTION_1", 1));
  }

  private static SyntaxTree listFunction(Node clauses) {
    return tree("list_comp", token("BUILD_LIST_0", 0), token("LOAD_ARG"), clauses);
  }

  private static SyntaxTree listFor(Node source, Node target, Node rest) {
    return tree(
        "list_iter",
        tree("list_for", source, token("FOR_ITER"), target, rest, token("JUMP_BACK")));
  }

  private static SyntaxTree listIf(String kind, Node test, Node rest) {
    return tree("list_iter", tree(kind, test, token("POP_JUMP_IF_FALSE"), rest));
  }

  private static SyntaxTree listBody(Node value) {
    return tree("list_iter", tree("lc_body", value, token("LIST_APPEND")));
  }

  private static SyntaxTree doubledFiltered() {
    return listFunction(
        listFor(
            fast(".0"),
            storeFast("x"),
            listIf(
                "list_if",
                fast("z"),
                listBody(binOp(fast("x"), "BINARY_MULTIPLY", constant(2))))));
  }

  @Test
  public void inlinedListComprehension() throws Exception {
    SyntaxTree site = inline("list_comp", "LOAD_LISTCOMP", "<listcomp>", load("y"));
    assertThat(deparse(site, "<listcomp>", doubledFiltered()))
        .isEqualTo("r = [x * 2 for x in y if z]\n");
  }

  @Test
  public void closureListComprehension() throws Exception {
    SyntaxTree site =
        tree(
            "list_comp",
            tree("load_closure", token("LOAD_CLOSURE"), token("BUILD_TUPLE_1", 1)),
            token("LOAD_LISTCOMP", code("<listcomp>")),
            string("<listcomp>"),
            token("MAKE_FUNCTION_8", 8),
            load("y"),
            token("GET_ITER"),
            token("CALL_FUNCTION_1", 1));
    assertThat(deparse(site, "<listcomp>", doubledFiltered()))
        .isEqualTo("r = [x * 2 for x in y if z]\n");
  }

  @Test
  public void generatorExpression() throws Exception {
    SyntaxTree function =
        tree(
            "genexpr_func",
            token("LOAD_ARG"),
            token("FOR_ITER"),
            storeFast("x"),
            tree(
                "comp_iter",
                tree(
                    "comp_body",
                    tree("gen_comp_body", fast("x"), token("YIELD_VALUE"), token("POP_TOP")))),
            token("JUMP_BACK"));
    SyntaxTree site =
        tree(
            "generator_exp",
            tree("load_genexpr", token("LOAD_GENEXPR", code("<genexpr>"))),
            string("<genexpr>"),
            token("MAKE_FUNCTION_0", 0),
            load("y"),
            token("GET_ITER"),
            token("CALL_FUNCTION_1", 1));
    assertThat(deparse(site, "<genexpr>", function)).isEqualTo("r = (x for x in y)\n");
  }

  @Test
  public void setComprehension() throws Exception {
    SyntaxTree function =
        tree(
            "set_comp_func",
            token("BUILD_SET_0", 0),
            token("LOAD_ARG"),
            token("FOR_ITER"),
            storeFast("x"),
            tree(
                "comp_iter",
                tree("comp_body", tree("set_comp_body", fast("x"), token("SET_ADD")))),
            token("JUMP_BACK"));
    SyntaxTree site = inline("set_comp", "LOAD_SETCOMP", "<setcomp>", load("y"));
    assertThat(deparse(site, "<setcomp>", function)).isEqualTo("r = {x for x in y}\n");
  }

  @Test
  public void dictComprehension() throws Exception {
    SyntaxTree function =
        tree(
            "dict_comp_func",
            token("BUILD_MAP_0", 0),
            token("LOAD_ARG"),
            token("FOR_ITER"),
            storeFast("k"),
            tree(
                "comp_iter",
                tree(
                    "comp_body",
                    tree("dict_comp_body", fast("k"), load("v"), token("MAP_ADD")))),
            token("JUMP_BACK"));
    SyntaxTree site = inline("dict_comp", "LOAD_DICTCOMP", "<dictcomp>", load("y"));
    assertThat(deparse(site, "<dictcomp>", function)).isEqualTo("r = {k: v for k in y}\n");
  }

  @Test
  public void nestedForWithConditionsJoinedByAnd() throws Exception {
    SyntaxTree function =
        listFunction(
            listFor(
                fast(".0"),
                storeFast("row"),
                listFor(
                    fast("row"),
                    storeFast("x"),
                    listIf(
                        "list_if",
                        fast("a"),
                        listIf("list_if", fast("b"), listBody(fast("x")))))));
    SyntaxTree site = inline("list_comp", "LOAD_LISTCOMP", "<listcomp>", load("rows"));
    assertThat(deparse(site, "<listcomp>", function))
        .isEqualTo("r = [x for row in rows for x in row if a and b]\n");
  }

  @Test
  public void negatedCondition() throws Exception {
    SyntaxTree function =
        listFunction(
            listFor(
                fast(".0"), storeFast("x"), listIf("list_if_not", fast("a"), listBody(fast("x")))));
    SyntaxTree site = inline("list_comp", "LOAD_LISTCOMP", "<listcomp>", load("y"));
    assertThat(deparse(site, "<listcomp>", function))
        .isEqualTo("r = [x for x in y if not a]\n");
  }

  @Test
  public void alternativeCondition() throws Exception {
    SyntaxTree either =
        tree(
            "list_iter",
            tree(
                "list_if_or",
                fast("a"),
                token("POP_JUMP_IF_TRUE"),
                fast("b"),
                token("POP_JUMP_IF_FALSE"),
                listBody(fast("x"))));
    SyntaxTree function = listFunction(listFor(fast(".0"), storeFast("x"), either));
    SyntaxTree site = inline("list_comp", "LOAD_LISTCOMP", "<listcomp>", load("y"));
    assertThat(deparse(site, "<listcomp>", function))
        .isEqualTo("r = [x for x in y if a or b]\n");
  }

  private static SyntaxTree generatorOver(Node clauses) {
    return tree(
        "genexpr_func",
        token("LOAD_ARG"),
        token("FOR_ITER"),
        storeFast("x"),
        clauses,
        token("JUMP_BACK"));
  }

  private static SyntaxTree generatorBody() {
    return tree(
        "comp_iter",
        tree(
            "comp_body",
            tree("gen_comp_body", fast("x"), token("YIELD_VALUE"), token("POP_TOP"))));
  }

  private static String deparseGenerator(SyntaxTree function) throws Exception {
    SyntaxTree site =
        tree(
            "generator_exp",
            tree("load_genexpr", token("LOAD_GENEXPR", code("<genexpr>"))),
            string("<genexpr>"),
            token("MAKE_FUNCTION_0", 0),
            load("y"),
            token("GET_ITER"),
            token("CALL_FUNCTION_1", 1));
    return deparse(site, "<genexpr>", function);
  }

  @Test
  public void negatedConjunctionCondition() throws Exception {
    SyntaxTree condition =
        tree(
            "comp_iter",
            tree(
                "comp_if_not_and",
                fast("a"),
                token("POP_JUMP_IF_FALSE"),
                fast("b"),
                token("POP_JUMP_IF_TRUE"),
                generatorBody()));
    assertThat(deparseGenerator(generatorOver(condition)))
        .isEqualTo("r = (x for x in y if not (a and b))\n");
  }

  @Test
  public void negatedAlternativeConditions() throws Exception {
    SyntaxTree notEither =
        tree(
            "comp_iter",
            tree(
                "comp_if_not_or",
                fast("a"),
                token("POP_JUMP_IF_TRUE"),
                fast("b"),
                token("POP_JUMP_IF_TRUE"),
                generatorBody()));
    assertThat(deparseGenerator(generatorOver(notEither)))
        .isEqualTo("r = (x for x in y if not (a or b))\n");

    SyntaxTree orNot =
        tree(
            "comp_iter",
            tree(
                "comp_if_or_not",
                fast("a"),
                token("POP_JUMP_IF_TRUE"),
                fast("b"),
                token("POP_JUMP_IF_TRUE"),
                generatorBody()));
    assertThat(deparseGenerator(generatorOver(orNot)))
        .isEqualTo("r = (x for x in y if a or not b)\n");
  }

  @Test
  public void compoundConditionJoinsEarlierFilter() throws Exception {
    SyntaxTree andOr =
        tree(
            "list_iter",
            tree(
                "list_if_and_or",
                fast("a"),
                token("POP_JUMP_IF_FALSE"),
                fast("b"),
                token("POP_JUMP_IF_TRUE"),
                fast("c"),
                token("POP_JUMP_IF_FALSE"),
                listBody(fast("x"))));
    SyntaxTree function =
        listFunction(listFor(fast(".0"), storeFast("x"), listIf("list_if", fast("z"), andOr)));
    SyntaxTree site = inline("list_comp", "LOAD_LISTCOMP", "<listcomp>", load("y"));
    assertThat(deparse(site, "<listcomp>", function))
        .isEqualTo("r = [x for x in y if z and (a and b or c)]\n");
  }

  @Test
  public void chainedComparisonCondition() throws Exception {
    SyntaxTree compare =
        expr(tree("compare_single", fast("a"), fast("b"), named("COMPARE_OP", "<")));
    SyntaxTree chained =
        tree(
            "list_iter",
            tree("list_if_chained", tree("list_if_compare", compare), listBody(fast("x"))));
    SyntaxTree function = listFunction(listFor(fast(".0"), storeFast("x"), chained));
    SyntaxTree site = inline("list_comp", "LOAD_LISTCOMP", "<listcomp>", load("y"));
    assertThat(deparse(site, "<listcomp>", function))
        .isEqualTo("r = [x for x in y if a < b]\n");
  }

  @Test
  public void comprehensionWithoutNestedCode() throws ParserException {
    SyntaxTree comprehension =
        listFunction(listFor(load("y"), store("x"), listBody(load("x"))));
    assertThat(render(expr(comprehension))).isEqualTo("[x for x in y]");
  }

  @Test
  public void findsCodeAndIterable() {
    SyntaxTree site = inline("list_comp", "LOAD_LISTCOMP", "<listcomp>", load("y"));
    assertThat(ComprehensionHandlers.findCode(site).get().kind()).isEqualTo("LOAD_LISTCOMP");
    assertThat(ComprehensionHandlers.collectionOf(site).get()).isEqualTo(load("y"));

    SyntaxTree wrapped = tree("set_comp", tree("get_iter", load("w")), token("CALL_FUNCTION_1"));
    assertThat(ComprehensionHandlers.collectionOf(wrapped).get()).isEqualTo(load("w"));
    assertThat(ComprehensionHandlers.findCode(wrapped).isPresent()).isFalse();
  }
}
