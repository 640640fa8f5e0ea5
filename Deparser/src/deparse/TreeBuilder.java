package deparse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

final class TreeBuilder {
  private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

  private static final int TOKEN_WINDOW_RADIUS = 3;

  static final SyntaxTree PASS =
      SyntaxTree.of("stmts", SyntaxTree.of("sstmt", SyntaxTree.of("stmt", SyntaxTree.of("pass"))));

  private final GrammarParser parser;
  private final DeparseOptions options;
  private final List<String> diagnostics = new ArrayList<>();

  TreeBuilder(GrammarParser parser, DeparseOptions options) {
    this.parser = parser;
    this.options = options;
  }

  ImmutableList<String> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  SyntaxTree build(
      ScannedCode scanned, CodeObject code, boolean lambda, boolean topLevel, CompileMode mode)
      throws ParserException {
    logger.debug("building tree for {} ({} tokens)", code.name(), scanned.tokens().size());
    List<Token> tokens = new ArrayList<>(scanned.tokens());

    if (lambda) {
      for (int i = 0; i < tokens.size(); i++) {
        Token token = tokens.get(i);
        if (token.is("RETURN_END_IF")) {
          tokens.set(i, token.withKind("RETURN_END_IF_LAMBDA"));
        } else if (token.is("RETURN_VALUE")) {
          tokens.set(i, token.withKind("RETURN_VALUE_LAMBDA"));
        }
      }
      tokens.add(marker("LAMBDA_MARKER", tokens));
      return parse(tokens, scanned, mode);
    }

    if (options.hidesInternal()) {
      stripImplicitReturn(tokens, code, topLevel);
      if (tokens.isEmpty()) {
        return PASS;
      }
    }

    SyntaxTree tree = parse(tokens, scanned, mode);
    TreeShapeValidator validator = new TreeShapeValidator();
    validator.validate(tree);
    for (String error : validator.errors()) {
      logger.warn("{}: {}", code.name(), error.trim());
      diagnostics.add(error);
    }
    return markDocstring(tree);
  }

  /**
   * Compilers end every body with {@code LOAD_CONST None; RETURN_VALUE}, which cannot be written
   * back at that position. Drop it when it carries nothing from the source; otherwise mark the
   * final return so the renderer can tell. Bodies ending in anything else are left alone.
   */
  private static void stripImplicitReturn(List<Token> tokens, CodeObject code, boolean topLevel) {
    if (tokens.size() < 2 || code.names().contains("None")) return;

    Token last = Iterables.getLast(tokens);
    if (!last.isAny("RETURN_VALUE", "RETURN_VALUE_LAMBDA")) return;

    Token loadConst = tokens.get(tokens.size() - 2);
    if (loadConst.is("LOAD_CONST")
        && (topLevel || (!loadConst.lineStart().isPresent() && !loadConst.hasAttr()))) {
      logger.debug("{}: dropping implicit return at offset {}", code.name(), last.offset());
      tokens.subList(tokens.size() - 2, tokens.size()).clear();
      return;
    }
    logger.debug("{}: marking final return", code.name());
    tokens.add(marker("RETURN_LAST", tokens));
  }

  private static Token marker(String kind, List<Token> tokens) {
    int offset = tokens.isEmpty() ? 0 : Iterables.getLast(tokens).offset() + 1;
    return Token.of(kind, offset);
  }

  private SyntaxTree parse(List<Token> tokens, ScannedCode scanned, CompileMode mode)
      throws ParserException {
    ParseRequest request =
        ParseRequest.builder()
            .tokens(tokens)
            .customize(scanned.customize())
            .instructions(scanned.instructions())
            .compileMode(mode)
            .trace(options.traceParser())
            .build();
    try {
      return parser.parse(request);
    } catch (ParserException e) {
      throw e.withTokenWindow(tokens, TOKEN_WINDOW_RADIUS);
    }
  }

  static SyntaxTree markDocstring(SyntaxTree tree) {
    if (!tree.is("stmts") || tree.isEmpty()) return tree;
    Optional<Token> doc = docstringToken(tree.child(0));
    if (!doc.isPresent()) return tree;
    SyntaxTree docstring = SyntaxTree.of("docstring", doc.get()).markTransformed("markDocstring");
    return tree.withChild(0, docstring);
  }

  private static Optional<Token> docstringToken(Node statement) {
    Node node = Nodes.unwrap(statement, "sstmt", "stmt");
    if (node.is("expr_stmt") && node.size() >= 1) {
      return stringConstant(node.child(0));
    }
    if (node.is("assign") && node.size() == 2) {
      Node store = node.child(1);
      if (store.is("store")
          && store.size() == 1
          && store.child(0).is("STORE_NAME")
          && ((Token) store.child(0)).pattr().equals("__doc__")) {
        return stringConstant(node.child(0));
      }
    }
    return Optional.empty();
  }

  private static Optional<Token> stringConstant(Node expr) {
    Node node = Nodes.unwrap(expr, "expr");
    if (node instanceof Token
        && node.isAny("LOAD_STR", "LOAD_CONST")
        && ((Token) node).attr() instanceof String) {
      return Optional.of((Token) node);
    }
    return Optional.empty();
  }
}
