package deparse;

import java.util.List;

/**
 * A gate the parser consults before reducing a span of tokens by a rule it cannot decide from the
 * grammar alone.
 */
@FunctionalInterface
public interface ReductionCheck {
  /**
   * Returns true when the reduction must be rejected. {@code candidate} is the subtree the parser
   * would build; {@code first} and {@code last} index the token window it covers, inclusive.
   */
  boolean reject(
      GrammarRule rule,
      SyntaxTree candidate,
      InstructionIndex instructions,
      List<Token> tokens,
      int first,
      int last);
}
