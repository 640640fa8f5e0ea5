package deparse;

import java.util.HashMap;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The decoded instructions of one code object together with a map from byte offset to array
 * index. Offsets are not contiguous, so the two must not be confused.
 */
public final class InstructionIndex {
  private static final InstructionIndex EMPTY = new InstructionIndex(ImmutableList.of());

  private final ImmutableList<Instruction> instructions;
  private final ImmutableMap<Integer, Integer> offsetToIndex;

  private InstructionIndex(ImmutableList<Instruction> instructions) {
    this.instructions = instructions;

    Map<Integer, Integer> offsets = new HashMap<>();
    int previous = -1;
    for (int i = 0; i < instructions.size(); i++) {
      int offset = instructions.get(i).offset();
      Preconditions.checkArgument(
          offset > previous, "instruction offsets must increase; %s follows %s", offset, previous);
      offsets.put(offset, i);
      previous = offset;
    }
    this.offsetToIndex = ImmutableMap.copyOf(offsets);
  }

  public static InstructionIndex of(Iterable<Instruction> instructions) {
    return new InstructionIndex(ImmutableList.copyOf(instructions));
  }

  public static InstructionIndex of(Instruction... instructions) {
    return new InstructionIndex(ImmutableList.copyOf(instructions));
  }

  public static InstructionIndex empty() {
    return EMPTY;
  }

  public int size() {
    return instructions.size();
  }

  public Instruction get(int index) {
    return instructions.get(index);
  }

  public ImmutableList<Instruction> instructions() {
    return instructions;
  }

  public boolean hasOffset(int offset) {
    return offsetToIndex.containsKey(offset);
  }

  public int indexOf(int offset) {
    Integer index = offsetToIndex.get(offset);
    Preconditions.checkArgument(index != null, "no instruction at offset %s", offset);
    return index;
  }
}
