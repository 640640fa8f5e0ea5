package deparse;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Decides whether an "if" that ends its enclosing block really ends where the candidate reduction
 * claims, by looking at where the test's jump lands.
 */
final class IfLastStatementCheck implements ReductionCheck {
  private static final ImmutableList<String> TEST_THEN_STATEMENTS =
      ImmutableList.of("testexpr", "stmts");

  private static final ImmutableSet<String> BOOLEAN_TESTS =
      ImmutableSet.of("testtrue", "testtruec", "testfalse", "testfalsec");

  @Override
  public boolean reject(
      GrammarRule rule,
      SyntaxTree candidate,
      InstructionIndex instructions,
      List<Token> tokens,
      int first,
      int last) {
    Node testExpr = candidate.child(0);

    // A synthetic block end stands in for a return we could not express.
    if (tokens.get(last).is("RETURN_LAST")) {
      last--;
    }

    if (rule.lhs().equals("iflaststmt") && rule.rhs().equals(TEST_THEN_STATEMENTS)) {
      Optional<Boolean> verdict = checkTestJump(candidate, instructions, tokens.get(last));
      if (verdict.isPresent()) return verdict.get();
    }

    if (testExpr.isEmpty() || !testExpr.child(0).isIn(BOOLEAN_TESTS)) return false;

    Node test = testExpr.child(0);
    if (test.size() == 1
        && test.child(0).isAny("nand", "and")
        && rule.rhs().equals(TEST_THEN_STATEMENTS)) {
      return true;
    }
    if (test.size() < 2 || !test.child(1).kindStartsWith("POP_JUMP_IF_")) return false;

    int jumpTarget = jumpTargetOf(test.child(1));
    int firstOffset = tokens.get(first).offset();
    Token lastToken = tokens.get(last);
    if (firstOffset <= jumpTarget && jumpTarget < lastToken.offset()) {
      return true;
    }

    int n = tokens.size();
    if (last + 1 < n) {
      if (last > 0 && tokens.get(last - 1).is("JUMP_BACK")) {
        if (jumpTarget > firstOffset) return true;
      } else if (tokens.get(last + 1).is("COME_FROM_LOOP") && !lastToken.is("BREAK_LOOP")) {
        return true;
      }
    }

    // A preceding conditional jump to the same place makes this one half of an "and".
    if (first > 0 && tokens.get(first - 1).is("POP_JUMP_IF_FALSE")) {
      return !Objects.equals(tokens.get(first - 1).attr(), jumpTarget);
    }

    // A target past the end that matches a trailing jump is an ordinary join; so is anything else.
    return false;
  }

  private static Optional<Boolean> checkTestJump(
      SyntaxTree candidate, InstructionIndex instructions, Token lastToken) {
    Optional<Token> bodyStart = candidate.child(1).firstToken();
    if (!bodyStart.isPresent() || !instructions.hasOffset(bodyStart.get().offset())) {
      return Optional.empty();
    }
    int bodyIndex = instructions.indexOf(bodyStart.get().offset());
    if (bodyIndex == 0) return Optional.empty();

    Instruction testLast = instructions.get(bodyIndex - 1);
    if (testLast.jumpType() != Instruction.JumpType.ABSOLUTE) return Optional.empty();

    int target = testLast.jumpTarget();
    if (target == lastToken.offset()) return Optional.of(false);

    for (int i = bodyIndex; i < instructions.size(); i++) {
      Instruction inst = instructions.get(i);
      if (inst.offset() >= target) break;
      if (inst.isJump() && inst.jumpTarget() == target) {
        return Optional.of(true);
      }
    }
    return Optional.of(false);
  }

  private static int jumpTargetOf(Node jump) {
    return ((Token) jump)
        .intAttr()
        .orElseThrow(() -> new IllegalStateException(jump.kind() + " has no jump target"));
  }
}
