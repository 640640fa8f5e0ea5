package deparse;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class DeparseResult {
  public abstract String text();

  public abstract ImmutableList<String> diagnostics();

  static DeparseResult of(String text, Iterable<String> diagnostics) {
    return new AutoValue_DeparseResult(text, ImmutableList.copyOf(diagnostics));
  }
}
