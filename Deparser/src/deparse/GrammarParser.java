package deparse;

/**
 * Builds a parse tree over a token stream. Implementations must consult {@link
 * ParseRequest#rejectReduction} before every reduction of a gated rule.
 */
public interface GrammarParser {
  SyntaxTree parse(ParseRequest request) throws ParserException;
}
