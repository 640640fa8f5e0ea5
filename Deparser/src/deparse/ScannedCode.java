package deparse;

import java.util.Map;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A scanner's output for one code object. {@code customize} maps each variable-arity opcode seen
 * (for example {@code CALL_FUNCTION_2}) to its argument count.
 */
@AutoValue
public abstract class ScannedCode {
  public abstract ImmutableList<Token> tokens();

  public abstract ImmutableMap<String, Integer> customize();

  public abstract InstructionIndex instructions();

  public static ScannedCode of(
      Iterable<Token> tokens, Map<String, Integer> customize, InstructionIndex instructions) {
    return new AutoValue_ScannedCode(
        ImmutableList.copyOf(tokens), ImmutableMap.copyOf(customize), instructions);
  }
}
