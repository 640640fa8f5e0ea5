package deparse;

import com.google.common.collect.ImmutableList;

/**
 * The render finished but cannot be trusted: the tree had shape errors, or a nested code object
 * failed to parse. The best-effort text is kept for inspection.
 */
public class DeparseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String partialText;
  private final ImmutableList<String> diagnostics;

  public DeparseException(String message, String partialText, Iterable<String> diagnostics) {
    super(message);
    this.partialText = partialText;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  public String partialText() {
    return partialText;
  }

  public ImmutableList<String> diagnostics() {
    return diagnostics;
  }
}
