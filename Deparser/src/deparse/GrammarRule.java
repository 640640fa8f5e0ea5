package deparse;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class GrammarRule {
  public abstract String lhs();

  public abstract ImmutableList<String> rhs();

  public static GrammarRule of(String lhs, String... rhs) {
    return new AutoValue_GrammarRule(lhs, ImmutableList.copyOf(rhs));
  }

  @Override
  public final String toString() {
    return lhs() + " ::= " + String.join(" ", rhs());
  }
}
