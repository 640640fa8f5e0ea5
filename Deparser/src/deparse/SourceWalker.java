package deparse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Renders a parse tree back to source text. Each node goes to the handler registered for its kind,
 * or else to its template, or else its children are rendered in order.
 */
public class SourceWalker {
  private static final Logger logger = LoggerFactory.getLogger(SourceWalker.class);

  private final Scanner scanner;
  private final DeparseOptions options;
  private final TreeBuilder treeBuilder;
  private final TemplateTable templates = new TemplateTable();
  private final RenderState state = new RenderState();
  private final ImmutableMap<String, NodeHandler> handlers;
  private final List<String> parseErrors = new ArrayList<>();

  private CompileMode nestedLambdaMode = CompileMode.LAMBDA;
  private boolean returnNone = false;
  private String name = "";

  public SourceWalker(Scanner scanner, GrammarParser parser, DeparseOptions options) {
    this.scanner = scanner;
    this.options = options;
    this.treeBuilder = new TreeBuilder(parser, options);

    ImmutableMap.Builder<String, NodeHandler> builder = ImmutableMap.builder();
    new ExpressionHandlers(this).register(builder);
    new StatementHandlers(this).register(builder);
    new CollectionHandlers(this).register(builder);
    new ComprehensionHandlers(this).register(builder);
    new FunctionMaker(this).register(builder);
    new ClassMaker(this).register(builder);
    new DocstringWriter(this).register(builder);
    this.handlers = builder.build();
  }

  DeparseOptions options() {
    return options;
  }

  RenderState state() {
    return state;
  }

  TemplateTable templates() {
    return templates;
  }

  TreeBuilder treeBuilder() {
    return treeBuilder;
  }

  String indent() {
    return state.scope().indent();
  }

  boolean isLambda() {
    return state.scope().isLambda();
  }

  boolean returnNone() {
    return returnNone;
  }

  String currentName() {
    return name;
  }

  ImmutableList<String> diagnostics() {
    return treeBuilder.diagnostics();
  }

  ImmutableList<String> parseErrors() {
    return ImmutableList.copyOf(parseErrors);
  }

  // Output

  void write(String... data) {
    SourceBuffer buffer = state.scope().buffer();
    for (String s : data) {
      buffer.write(s);
    }
  }

  void println(String... data) {
    write(data);
    state.scope().buffer().endLine();
  }

  String output() {
    return state.scope().buffer().contents();
  }

  // Traversal

  protected void preorder(Node node) throws ParserException {
    NodeHandler handler = handlers.get(node.kind());
    if (handler != null) {
      handler.render(node);
    } else {
      defaultRender(node);
    }
    node.lineStart().ifPresent(state::setLineNumber);
  }

  void defaultRender(Node node) throws ParserException {
    Optional<Template> template = templates.templateFor(node);
    if (template.isPresent()) {
      template.get().expand(this, node);
    } else {
      for (Node child : node.children()) {
        preorder(child);
      }
    }
  }

  void expand(Template template, Node node) throws ParserException {
    template.expand(this, node);
  }

  String traverse(Node node) throws ParserException {
    return traverse(node, false);
  }

  String traverse(Node node, boolean lambda) throws ParserException {
    return traverse(node, indent(), lambda);
  }

  String traverseAt(Node node, String indent) throws ParserException {
    return traverse(node, indent, false);
  }

  private String traverse(Node node, String indent, boolean lambda) throws ParserException {
    try (RenderState.Restorer r = state.enterScope(indent, lambda)) {
      preorder(node);
      return state.scope().buffer().contents();
    }
  }

  void genSource(SyntaxTree tree, String name, boolean lambda, boolean returnNone)
      throws ParserException {
    boolean savedReturnNone = this.returnNone;
    String savedName = this.name;
    this.returnNone = returnNone;
    this.name = name;
    try {
      if (tree.isEmpty()) {
        println(indent(), "pass");
      } else if (lambda) {
        write(traverse(tree, true));
      } else {
        println(traverse(tree, false));
      }
    } finally {
      this.returnNone = savedReturnNone;
      this.name = savedName;
    }
  }

  // Nested code

  SyntaxTree buildTopLevel(ScannedCode scanned, CodeObject code) throws ParserException {
    boolean lambda = options.compileMode().isLambdaLike();
    SyntaxTree tree =
        treeBuilder.build(scanned, code, lambda, code.isModule(), options.compileMode());
    templates.customize(scanned.customize());
    showTree(code, tree);
    return tree;
  }

  Optional<SyntaxTree> buildNested(CodeObject code, boolean lambda) throws ParserException {
    ScannedCode scanned = scanner.ingest(code);
    CompileMode mode = lambda ? nestedLambdaMode : CompileMode.EXEC;
    try {
      SyntaxTree tree = treeBuilder.build(scanned, code, lambda, false, mode);
      templates.customize(scanned.customize());
      showTree(code, tree);
      return Optional.of(tree);
    } catch (ParserException e) {
      if (!options.tolerateErrors()) throw e;
      logger.warn("parse error in nested code {}: {}", code.name(), e.describe());
      parseErrors.add(code.name() + ": " + e.getMessage());
      return Optional.empty();
    }
  }

  private void showTree(CodeObject code, SyntaxTree tree) {
    if (options.showTree()) {
      logger.debug(
          "tree for {}:\n{}", code.name(), TreeFormatter.withTemplates(templates).format(tree));
    }
  }

  void writeUnparsed(CodeObject code) {
    write("<parse error in ", code.name(), ">");
  }

  RenderState.Restorer withNestedLambdaMode(CompileMode mode) {
    CompileMode saved = nestedLambdaMode;
    nestedLambdaMode = mode;
    return () -> nestedLambdaMode = saved;
  }
}
