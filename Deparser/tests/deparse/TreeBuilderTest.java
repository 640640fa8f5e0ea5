package deparse;

import static com.google.common.truth.Truth.assertThat;
import static deparse.TreeFixtures.assign;
import static deparse.TreeFixtures.code;
import static deparse.TreeFixtures.exprStmt;
import static deparse.TreeFixtures.load;
import static deparse.TreeFixtures.stmts;
import static deparse.TreeFixtures.store;
import static deparse.TreeFixtures.string;
import static deparse.TreeFixtures.tree;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class TreeBuilderTest {

  /** Returns a fixed tree and remembers what it was asked to parse. */
  private static final class RecordingParser implements GrammarParser {
    private final SyntaxTree result;
    private final List<ParseRequest> requests = new ArrayList<>();

    RecordingParser(SyntaxTree result) {
      this.result = result;
    }

    @Override
    public SyntaxTree parse(ParseRequest request) {
      requests.add(request);
      return result;
    }

    ParseRequest onlyRequest() {
      assertThat(requests).hasSize(1);
      return requests.get(0);
    }

    ImmutableList<String> parsedKinds() {
      return onlyRequest().tokens().stream()
          .map(Node::kind)
          .collect(ImmutableList.toImmutableList());
    }
  }

  private static Token at(String kind, int offset) {
    return Token.of(kind, offset);
  }

  private static ScannedCode scanned(Token... tokens) {
    return ScannedCode.of(
        ImmutableList.copyOf(tokens),
        ImmutableMap.of("CALL_FUNCTION_1", 1),
        InstructionIndex.empty());
  }

  // x = 1 followed by the compiler's trailing return.
  private static ScannedCode withReturn(Token loadConst) {
    return scanned(at("LOAD_CONST", 0), at("STORE_NAME", 2), loadConst, at("RETURN_VALUE", 6));
  }

  private static SyntaxTree build(RecordingParser parser, ScannedCode scanned, CodeObject code)
      throws ParserException {
    return new TreeBuilder(parser, DeparseOptions.defaults())
        .build(scanned, code, false, false, CompileMode.EXEC);
  }

  @Test
  public void implicitReturnIsDropped() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts());
    build(parser, withReturn(at("LOAD_CONST", 4)), code("f"));

    assertThat(parser.parsedKinds()).containsExactly("LOAD_CONST", "STORE_NAME").inOrder();
    assertThat(parser.onlyRequest().customize()).containsExactly("CALL_FUNCTION_1", 1);
    assertThat(parser.onlyRequest().compileMode()).isEqualTo(CompileMode.EXEC);
  }

  @Test
  public void explicitReturnIsMarked() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts());
    Token explicit = Token.builder("LOAD_CONST").attr(1).offset(4).build();
    build(parser, withReturn(explicit), code("f"));

    assertThat(parser.parsedKinds())
        .containsExactly("LOAD_CONST", "STORE_NAME", "LOAD_CONST", "RETURN_VALUE", "RETURN_LAST")
        .inOrder();
    assertThat(parser.onlyRequest().tokens().get(4).offset()).isEqualTo(7);
  }

  @Test
  public void returnFromSourceLineIsMarked() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts());
    Token onLine = Token.builder("LOAD_CONST").offset(4).lineStart(3).build();
    build(parser, withReturn(onLine), code("f"));

    assertThat(parser.parsedKinds()).contains("RETURN_LAST");
  }

  @Test
  public void topLevelAlwaysDropsFinalReturn() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts());
    Token explicit = Token.builder("LOAD_CONST").attr(1).offset(4).build();
    new TreeBuilder(parser, DeparseOptions.defaults())
        .build(withReturn(explicit), code("<module>"), false, true, CompileMode.EXEC);

    assertThat(parser.parsedKinds()).containsExactly("LOAD_CONST", "STORE_NAME").inOrder();
  }

  // a + 1, as a module compiles it.
  private static ScannedCode expressionTail() {
    return scanned(
        at("LOAD_NAME", 0),
        Token.builder("LOAD_CONST").attr(1).offset(2).build(),
        at("BINARY_ADD", 4),
        at("RETURN_VALUE", 6));
  }

  @Test
  public void topLevelKeepsComputedReturn() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts());
    new TreeBuilder(parser, DeparseOptions.defaults())
        .build(expressionTail(), code("<module>"), false, true, CompileMode.EXEC);

    assertThat(parser.parsedKinds())
        .containsExactly("LOAD_NAME", "LOAD_CONST", "BINARY_ADD", "RETURN_VALUE", "RETURN_LAST")
        .inOrder();
  }

  @Test
  public void evalModeKeepsWholeStream() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts());
    DeparseOptions options = DeparseOptions.builder().compileMode(CompileMode.EVAL).build();
    new TreeBuilder(parser, options)
        .build(expressionTail(), code("<module>"), false, true, CompileMode.EVAL);

    assertThat(parser.parsedKinds())
        .containsExactly("LOAD_NAME", "LOAD_CONST", "BINARY_ADD", "RETURN_VALUE")
        .inOrder();
    assertThat(options.hidesInternal()).isFalse();
  }

  @Test
  public void evalModeKeepsImplicitReturn() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts());
    DeparseOptions options = DeparseOptions.builder().compileMode(CompileMode.EVAL).build();
    new TreeBuilder(parser, options)
        .build(withReturn(at("LOAD_CONST", 4)), code("<module>"), false, true, CompileMode.EVAL);

    assertThat(parser.parsedKinds()).hasSize(4);
  }

  @Test
  public void bodyEndingInRaiseIsUntouched() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts());
    build(parser, scanned(at("LOAD_GLOBAL", 0), at("RAISE_VARARGS_1", 2)), code("f"));

    assertThat(parser.parsedKinds()).containsExactly("LOAD_GLOBAL", "RAISE_VARARGS_1").inOrder();
  }

  @Test
  public void namedNoneKeepsTokens() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts());
    CodeObject code = CodeObject.builder("f").names(ImmutableList.of("None")).build();
    build(parser, withReturn(at("LOAD_CONST", 4)), code);

    assertThat(parser.parsedKinds()).hasSize(4);
  }

  @Test
  public void emptyBodyIsPassWithoutParsing() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts());
    SyntaxTree tree = build(parser, scanned(at("LOAD_CONST", 0), at("RETURN_VALUE", 2)), code("f"));

    assertThat(tree).isEqualTo(TreeBuilder.PASS);
    assertThat(parser.requests).isEmpty();
  }

  @Test
  public void internalsKeptWhenAsked() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts());
    DeparseOptions options = DeparseOptions.builder().hideInternal(false).build();
    new TreeBuilder(parser, options)
        .build(withReturn(at("LOAD_CONST", 4)), code("f"), false, false, CompileMode.EXEC);

    assertThat(parser.parsedKinds()).hasSize(4);
  }

  @Test
  public void lambdaTokensAreRelabeled() throws ParserException {
    RecordingParser parser = new RecordingParser(tree("lambda_start"));
    ScannedCode scanned =
        scanned(
            at("LOAD_FAST", 0),
            at("POP_JUMP_IF_FALSE", 2),
            at("RETURN_END_IF", 4),
            at("RETURN_VALUE", 6));
    new TreeBuilder(parser, DeparseOptions.defaults())
        .build(scanned, code("<lambda>"), true, false, CompileMode.LAMBDA);

    assertThat(parser.parsedKinds())
        .containsExactly(
            "LOAD_FAST",
            "POP_JUMP_IF_FALSE",
            "RETURN_END_IF_LAMBDA",
            "RETURN_VALUE_LAMBDA",
            "LAMBDA_MARKER")
        .inOrder();
    assertThat(parser.onlyRequest().tokens().get(4).offset()).isEqualTo(7);
    assertThat(parser.onlyRequest().compileMode()).isEqualTo(CompileMode.LAMBDA);
  }

  @Test
  public void leadingStringBecomesDocstring() throws ParserException {
    RecordingParser parser =
        new RecordingParser(stmts(exprStmt(string("Doc.")), assign(load("a"), store("b"))));
    SyntaxTree tree = build(parser, scanned(at("NOP", 0)), code("f"));

    assertThat(tree.child(0).kind()).isEqualTo("docstring");
    assertThat(((SyntaxTree) tree.child(0)).transformedBy().get()).isEqualTo("markDocstring");
    assertThat(tree.child(1).kind()).isEqualTo("sstmt");
  }

  @Test
  public void docAssignmentBecomesDocstring() {
    SyntaxTree marked = TreeBuilder.markDocstring(stmts(assign(string("Doc."), store("__doc__"))));
    assertThat(marked.child(0).kind()).isEqualTo("docstring");

    SyntaxTree other = stmts(assign(string("Doc."), store("title")));
    assertThat(TreeBuilder.markDocstring(other)).isEqualTo(other);
  }

  @Test
  public void shapeProblemsBecomeDiagnostics() throws ParserException {
    RecordingParser parser = new RecordingParser(stmts(tree("break")));
    TreeBuilder builder = new TreeBuilder(parser, DeparseOptions.defaults());
    builder.build(scanned(at("NOP", 0)), code("f"), false, false, CompileMode.EXEC);

    assertThat(builder.diagnostics()).hasSize(1);
    assertThat(builder.diagnostics().get(0)).contains("# not in loop:");
  }

  @Test
  public void parseFailureCarriesTokenWindow() {
    ParserException failure = new ParserException("no rule for JUMP_BACK", 5);
    GrammarParser parser =
        request -> {
          throw failure;
        };
    Token[] tokens = new Token[8];
    for (int i = 0; i < tokens.length; i++) {
      tokens[i] = at("NOP", i * 2);
    }
    DeparseOptions options = DeparseOptions.builder().hideInternal(false).build();

    ParserException ex =
        assertThrows(
            ParserException.class,
            () ->
                new TreeBuilder(parser, options)
                    .build(scanned(tokens), code("f"), false, false, CompileMode.EXEC));
    assertThat(ex).hasMessageThat().isEqualTo("no rule for JUMP_BACK");
    assertThat(ex).hasCauseThat().isSameInstanceAs(failure);
    assertThat(ex.tokenIndex()).isEqualTo(5);
    assertThat(ex.tokenWindow()).hasSize(6);
    assertThat(ex.tokenWindow().get(0).offset()).isEqualTo(4);
  }
}
