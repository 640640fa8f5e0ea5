package deparse;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class DeparseOptions {
  public abstract CompileMode compileMode();

  // Record parse failures in nested code and keep rendering instead of failing at once.
  public abstract boolean tolerateErrors();

  // Drop compiler bookkeeping: implicit return None, __module__ assignments.
  public abstract boolean hideInternal();

  /** {@link #hideInternal()}, except that an eval-mode expression keeps everything. */
  public boolean hidesInternal() {
    return hideInternal() && compileMode() != CompileMode.EVAL;
  }

  public abstract boolean showTree();

  public abstract boolean traceParser();

  public static DeparseOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_DeparseOptions.Builder()
        .compileMode(CompileMode.EXEC)
        .tolerateErrors(false)
        .hideInternal(true)
        .showTree(false)
        .traceParser(false);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder compileMode(CompileMode compileMode);

    public abstract Builder tolerateErrors(boolean tolerateErrors);

    public abstract Builder hideInternal(boolean hideInternal);

    public abstract Builder showTree(boolean showTree);

    public abstract Builder traceParser(boolean traceParser);

    public abstract DeparseOptions build();
  }
}
