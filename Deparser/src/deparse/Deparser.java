package deparse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Verify;

/**
 * Reconstructs Python source from a compiled code object. Each call renders with fresh state, so
 * one instance may deparse any number of code objects.
 */
public final class Deparser {
  private static final Logger logger = LoggerFactory.getLogger(Deparser.class);

  private final Scanner scanner;
  private final GrammarParser parser;
  private final DeparseOptions options;

  public Deparser(Scanner scanner, GrammarParser parser, DeparseOptions options) {
    this.scanner = scanner;
    this.parser = parser;
    this.options = options;
  }

  public Deparser(Scanner scanner, GrammarParser parser) {
    this(scanner, parser, DeparseOptions.defaults());
  }

  /**
   * Renders {@code code} and everything nested in it.
   *
   * @throws ParserException if the outermost code, or nested code when errors are not tolerated,
   *     does not parse
   * @throws DeparseException if the render completed with shape diagnostics or tolerated parse
   *     errors; the exception carries the text
   */
  public DeparseResult deparse(CodeObject code) throws ParserException, DeparseException {
    CompileMode mode = options.compileMode();
    logger.debug("deparsing {} in {} mode", code.name(), mode);
    SourceWalker walker = new SourceWalker(scanner, parser, options);
    SyntaxTree tree = walker.buildTopLevel(scanner.ingest(code), code);
    Verify.verify(
        tree.is(mode.startSymbol()),
        "%s mode expects a '%s' tree; got '%s'",
        mode,
        mode.startSymbol(),
        tree.kind());

    GlobalsCollector scopes = GlobalsCollector.collect(tree, code);
    Verify.verify(
        mode.isLambdaLike() || scopes.nonlocals().isEmpty(),
        "nonlocal names at the top level: %s",
        scopes.nonlocals());

    tree = hoistAnnotationsSetup(walker, tree);
    walker.genSource(tree, code.name(), mode.isLambdaLike(), false);

    for (String name : scopes.globals()) {
      walker.write(String.format("# global %s ## Warning: Unused global\n", name));
    }

    if (!walker.diagnostics().isEmpty()) {
      walker.write("# NOTE: have internal decompilation grammar errors.\n");
      for (String error : walker.diagnostics()) {
        walker.write(error);
      }
      throw new DeparseException(
          "Deparsing hit an internal grammar-rule bug", walker.output(), walker.diagnostics());
    }
    if (!walker.parseErrors().isEmpty()) {
      throw new DeparseException(
          "Deparsing stopped due to parse error", walker.output(), walker.parseErrors());
    }
    return DeparseResult.of(walker.output(), walker.diagnostics());
  }

  // A module with variable annotations starts with SETUP_ANNOTATIONS, which has no template.
  private static SyntaxTree hoistAnnotationsSetup(SourceWalker walker, SyntaxTree tree) {
    if (!tree.is("stmts") || tree.isEmpty()) return tree;
    Node first = Nodes.unwrap(tree.child(0), "sstmt");
    if (first.isEmpty() || !first.child(0).is("SETUP_ANNOTATIONS")) return tree;
    walker.println("__annotations__ = {}");
    return SyntaxTree.of(tree.kind(), tree.slice(1, tree.size()));
  }
}
