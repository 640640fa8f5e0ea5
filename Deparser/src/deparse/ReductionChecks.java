package deparse;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

public final class ReductionChecks {
  private static final ReductionChecks STANDARD;

  static {
    IfLastStatementCheck ifLast = new IfLastStatementCheck();
    STANDARD = new ReductionChecks(ImmutableMap.of("iflaststmt", ifLast, "iflaststmtc", ifLast));
  }

  private final ImmutableMap<String, ReductionCheck> checks;

  private ReductionChecks(Map<String, ReductionCheck> checks) {
    this.checks = ImmutableMap.copyOf(checks);
  }

  public static ReductionChecks standard() {
    return STANDARD;
  }

  public static ReductionChecks of(Map<String, ReductionCheck> checks) {
    return new ReductionChecks(checks);
  }

  public boolean gates(String lhs) {
    return checks.containsKey(lhs);
  }

  public boolean reject(
      GrammarRule rule,
      SyntaxTree candidate,
      InstructionIndex instructions,
      List<Token> tokens,
      int first,
      int last) {
    ReductionCheck check = checks.get(rule.lhs());
    return check != null && check.reject(rule, candidate, instructions, tokens, first, last);
  }
}
