package deparse;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

@AutoValue
public abstract class ParseRequest {
  public abstract ImmutableList<Token> tokens();

  public abstract ImmutableMap<String, Integer> customize();

  public abstract InstructionIndex instructions();

  public abstract CompileMode compileMode();

  public abstract ReductionChecks reductionChecks();

  public abstract boolean trace();

  public static Builder builder() {
    return new AutoValue_ParseRequest.Builder()
        .reductionChecks(ReductionChecks.standard())
        .instructions(InstructionIndex.empty())
        .customize(ImmutableMap.of())
        .compileMode(CompileMode.EXEC)
        .trace(false);
  }

  public final boolean rejectReduction(
      GrammarRule rule, SyntaxTree candidate, int first, int last) {
    return reductionChecks().reject(rule, candidate, instructions(), tokens(), first, last);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder tokens(Iterable<Token> tokens);

    public abstract Builder customize(ImmutableMap<String, Integer> customize);

    public abstract Builder instructions(InstructionIndex instructions);

    public abstract Builder compileMode(CompileMode compileMode);

    public abstract Builder reductionChecks(ReductionChecks reductionChecks);

    public abstract Builder trace(boolean trace);

    public abstract ParseRequest build();
  }
}
