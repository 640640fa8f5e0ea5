package deparse;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The parts of a compiled code object the deparser needs beyond its token stream. */
@AutoValue
public abstract class CodeObject {
  public static final int CO_VARARGS = 0x04;
  public static final int CO_VARKEYWORDS = 0x08;
  public static final int CO_GENERATOR = 0x20;
  public static final int CO_COROUTINE = 0x80;
  public static final int CO_ASYNC_GENERATOR = 0x200;

  public abstract String name();

  public abstract int argCount();

  public abstract int posOnlyArgCount();

  public abstract int kwOnlyArgCount();

  public abstract int flags();

  public abstract ImmutableList<String> varNames();

  public abstract ImmutableList<String> freeVars();

  public abstract ImmutableList<String> cellVars();

  public abstract ImmutableList<String> names();

  public final boolean hasFlag(int flag) {
    return (flags() & flag) != 0;
  }

  public final boolean isLambda() {
    return name().equals("<lambda>");
  }

  public final boolean isModule() {
    return name().equals("<module>");
  }

  public static Builder builder(String name) {
    return new AutoValue_CodeObject.Builder()
        .name(name)
        .argCount(0)
        .posOnlyArgCount(0)
        .kwOnlyArgCount(0)
        .flags(0)
        .varNames(ImmutableList.of())
        .freeVars(ImmutableList.of())
        .cellVars(ImmutableList.of())
        .names(ImmutableList.of());
  }

  @Override
  public final String toString() {
    return "<code " + name() + ">";
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder name(String name);

    public abstract Builder argCount(int argCount);

    public abstract Builder posOnlyArgCount(int posOnlyArgCount);

    public abstract Builder kwOnlyArgCount(int kwOnlyArgCount);

    public abstract Builder flags(int flags);

    public abstract Builder varNames(Iterable<String> varNames);

    public abstract Builder freeVars(Iterable<String> freeVars);

    public abstract Builder cellVars(Iterable<String> cellVars);

    public abstract Builder names(Iterable<String> names);

    public abstract CodeObject build();
  }
}
