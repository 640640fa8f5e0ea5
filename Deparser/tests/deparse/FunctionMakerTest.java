package deparse;

import static com.google.common.truth.Truth.assertThat;
import static deparse.TreeFixtures.assign;
import static deparse.TreeFixtures.binOp;
import static deparse.TreeFixtures.code;
import static deparse.TreeFixtures.constant;
import static deparse.TreeFixtures.expr;
import static deparse.TreeFixtures.exprStmt;
import static deparse.TreeFixtures.fast;
import static deparse.TreeFixtures.functionDef;
import static deparse.TreeFixtures.load;
import static deparse.TreeFixtures.makeFunction;
import static deparse.TreeFixtures.named;
import static deparse.TreeFixtures.returnNone;
import static deparse.TreeFixtures.returnValue;
import static deparse.TreeFixtures.stmts;
import static deparse.TreeFixtures.store;
import static deparse.TreeFixtures.storeFast;
import static deparse.TreeFixtures.string;
import static deparse.TreeFixtures.token;
import static deparse.TreeFixtures.tree;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class FunctionMakerTest {
  private static final String MODULE = "<module>";

  private static String deparse(SyntaxTree module, CodeObject function, SyntaxTree body)
      throws ParserException, DeparseException {
    ScriptedFrontEnd frontEnd =
        new ScriptedFrontEnd().tree(MODULE, module).tree(function.name(), body);
    return new Deparser(frontEnd, frontEnd).deparse(code(MODULE)).text().strip();
  }

  private static String deparseDef(
      CodeObject function, SyntaxTree body, int flags, Node... operands)
      throws ParserException, DeparseException {
    return deparse(stmts(functionDef(function, flags, operands)), function, body);
  }

  private static CodeObject.Builder function(String... varNames) {
    return CodeObject.builder("f")
        .argCount(varNames.length)
        .varNames(ImmutableList.copyOf(varNames));
  }

  private static SyntaxTree pass() {
    return stmts(tree("pass"));
  }

  /** {@code {'k1': v1, ...}} as the constant-key map MAKE_FUNCTION takes. */
  private static SyntaxTree keyMap(ImmutableList<Object> keys, Node... values) {
    Node[] children = new Node[values.length + 2];
    System.arraycopy(values, 0, children, 0, values.length);
    children[values.length] = token("LOAD_CONST", keys);
    children[values.length + 1] = token("BUILD_CONST_KEY_MAP_" + values.length, values.length);
    return expr(tree("dict", children));
  }

  @Test
  public void simpleFunction() throws Exception {
    assertThat(deparseDef(function("a").build(), stmts(returnValue(fast("a"))), 0))
        .isEqualTo("def f(a):\n    return a");
  }

  @Test
  public void positionalDefaults() throws Exception {
    assertThat(
            deparseDef(
                function("a", "b").build(),
                pass(),
                FunctionMaker.DEFAULTS,
                constant(ImmutableList.of(1))))
        .isEqualTo("def f(a, b=1):\n    pass");
  }

  @Test
  public void starredAndKeywordOnlyParameters() throws Exception {
    CodeObject f =
        CodeObject.builder("f")
            .argCount(1)
            .kwOnlyArgCount(1)
            .flags(CodeObject.CO_VARARGS | CodeObject.CO_VARKEYWORDS)
            .varNames(ImmutableList.of("a", "k", "args", "kw"))
            .build();
    assertThat(
            deparseDef(
                f, pass(), FunctionMaker.KW_DEFAULTS, keyMap(ImmutableList.of("k"), constant(2))))
        .isEqualTo("def f(a, *args, k=2, **kw):\n    pass");
  }

  @Test
  public void bareStarBeforeKeywordOnly() throws Exception {
    CodeObject f =
        CodeObject.builder("f").kwOnlyArgCount(1).varNames(ImmutableList.of("k")).build();
    assertThat(deparseDef(f, pass(), 0)).isEqualTo("def f(*, k):\n    pass");
  }

  @Test
  public void positionalOnlyMarker() throws Exception {
    CodeObject f = function("a", "b").posOnlyArgCount(1).build();
    assertThat(deparseDef(f, pass(), 0)).isEqualTo("def f(a, /, b):\n    pass");
  }

  @Test
  public void annotations() throws Exception {
    SyntaxTree annotations =
        keyMap(ImmutableList.of("a", "return"), load("int"), load("str"));
    assertThat(deparseDef(function("a").build(), pass(), FunctionMaker.ANNOTATIONS, annotations))
        .isEqualTo("def f(a: int) -> str:\n    pass");

    SyntaxTree annotated = keyMap(ImmutableList.of("a"), load("int"));
    assertThat(
            deparseDef(
                function("a").build(),
                pass(),
                FunctionMaker.DEFAULTS | FunctionMaker.ANNOTATIONS,
                constant(ImmutableList.of(1)),
                annotated))
        .isEqualTo("def f(a: int = 1):\n    pass");
  }

  @Test
  public void docstringComesBeforeGlobalDeclarations() throws Exception {
    SyntaxTree body =
        stmts(
            exprStmt(string("Doc.")),
            assign(constant(1), tree("store", named("STORE_GLOBAL", "g"))));
    assertThat(deparseDef(function().build(), body, 0))
        .isEqualTo("def f():\n    \"\"\"Doc.\"\"\"\n    global g\n    g = 1");
  }

  @Test
  public void nonlocalDeclaration() throws Exception {
    CodeObject f = function().freeVars(ImmutableList.of("n")).build();
    SyntaxTree body = stmts(assign(constant(1), tree("store", named("STORE_DEREF", "n"))));
    assertThat(deparseDef(f, body, 0)).isEqualTo("def f():\n    nonlocal n\n    n = 1");
  }

  @Test
  public void returnNoneIsBareUnlessNoneIsNamed() throws Exception {
    SyntaxTree body = stmts(assign(constant(1), storeFast("x")), returnNone());
    assertThat(deparseDef(function().build(), body, 0))
        .isEqualTo("def f():\n    x = 1\n    return");

    CodeObject namesNone = function().names(ImmutableList.of("None")).build();
    assertThat(deparseDef(namesNone, body, 0))
        .isEqualTo("def f():\n    x = 1\n    return None");
  }

  @Test
  public void nestedFunction() throws Exception {
    CodeObject g = CodeObject.builder("g").build();
    ScriptedFrontEnd frontEnd =
        new ScriptedFrontEnd()
            .tree(MODULE, stmts(functionDef(function().build(), 0)))
            .tree("f", stmts(functionDef(g, 0)))
            .tree("g", pass());
    assertThat(new Deparser(frontEnd, frontEnd).deparse(code(MODULE)).text().strip())
        .isEqualTo("def f():\n\n    def g():\n        pass");
  }

  @Test
  public void lambdas() throws Exception {
    CodeObject increment =
        CodeObject.builder("<lambda>").argCount(1).varNames(ImmutableList.of("x")).build();
    SyntaxTree module =
        stmts(assign(expr(makeFunction("lambda_body", increment, 0)), store("f")));
    SyntaxTree body =
        tree(
            "lambda_start",
            tree("return_expr_lambda", binOp(fast("x"), "BINARY_ADD", constant(1))));
    assertThat(deparse(module, increment, body)).isEqualTo("f = lambda x: x + 1");

    CodeObject zero = CodeObject.builder("<lambda>").build();
    module = stmts(assign(expr(makeFunction("lambda_body", zero, 0)), store("f")));
    body = tree("lambda_start", tree("return_expr_lambda", constant(0)));
    assertThat(deparse(module, zero, body)).isEqualTo("f = lambda: 0");
  }

  @Test
  public void missingOperandsFail() {
    TemplateException ex =
        assertThrows(
            TemplateException.class,
            () -> deparseDef(function("a").build(), pass(), FunctionMaker.DEFAULTS));
    assertThat(ex).hasMessageThat().contains("MAKE_FUNCTION flags 0x1 need more operands");
  }

  @Test
  public void parameterList() {
    CodeObject f =
        CodeObject.builder("f")
            .argCount(2)
            .flags(CodeObject.CO_VARARGS)
            .varNames(ImmutableList.of("a", "b", "rest"))
            .build();
    FunctionMaker.FunctionParts parts = new FunctionMaker.FunctionParts(f);
    parts.defaults.add("None");
    assertThat(FunctionMaker.parameters(parts)).isEqualTo("a, b=None, *rest");
  }
}
