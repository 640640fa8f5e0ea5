package deparse;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

@AutoValue
public abstract class Instruction {
  public enum JumpType {
    ABSOLUTE,
    RELATIVE,
    NONE;
  }

  public abstract int offset();

  public abstract String opName();

  public abstract Optional<Object> argValue();

  public abstract String argRepr();

  public abstract JumpType jumpType();

  public final boolean isJump() {
    return jumpType() != JumpType.NONE;
  }

  // For jumps, argValue() is the resolved target offset.
  public final int jumpTarget() {
    Preconditions.checkState(isJump(), "%s at %s is not a jump", opName(), offset());
    return (Integer) argValue().get();
  }

  public static Instruction of(int offset, String opName) {
    return new AutoValue_Instruction(offset, opName, Optional.empty(), "", JumpType.NONE);
  }

  public static Instruction of(int offset, String opName, Object argValue) {
    return new AutoValue_Instruction(
        offset, opName, Optional.of(argValue), String.valueOf(argValue), JumpType.NONE);
  }

  public static Instruction jumpAbsolute(int offset, String opName, int target) {
    return new AutoValue_Instruction(
        offset, opName, Optional.of(target), "to " + target, JumpType.ABSOLUTE);
  }

  public static Instruction jumpRelative(int offset, String opName, int target) {
    return new AutoValue_Instruction(
        offset, opName, Optional.of(target), "to " + target, JumpType.RELATIVE);
  }

  @Override
  public final String toString() {
    return String.format("%4d %-20s %s", offset(), opName(), argRepr()).trim();
  }
}
