package deparse;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

public class ParserException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int tokenIndex;
  private final ImmutableList<Token> tokenWindow;
  private final Optional<String> trace;

  public ParserException(String message, int tokenIndex) {
    this(message, tokenIndex, ImmutableList.of(), Optional.empty(), null);
  }

  public ParserException(String message, int tokenIndex, String trace) {
    this(message, tokenIndex, ImmutableList.of(), Optional.of(trace), null);
  }

  private ParserException(
      String message,
      int tokenIndex,
      ImmutableList<Token> tokenWindow,
      Optional<String> trace,
      Throwable cause) {
    super(message, cause);
    this.tokenIndex = tokenIndex;
    this.tokenWindow = tokenWindow;
    this.trace = trace;
  }

  public int tokenIndex() {
    return tokenIndex;
  }

  public ImmutableList<Token> tokenWindow() {
    return tokenWindow;
  }

  public Optional<String> trace() {
    return trace;
  }

  // Returns a copy that carries the tokens within radius of the failure.
  public ParserException withTokenWindow(List<Token> tokens, int radius) {
    ImmutableList<Token> window = ImmutableList.of();
    if (tokenIndex >= 0 && tokenIndex < tokens.size()) {
      int from = Math.max(0, tokenIndex - radius);
      int to = Math.min(tokens.size(), tokenIndex + radius + 1);
      window = ImmutableList.copyOf(tokens.subList(from, to));
    }
    return new ParserException(getMessage(), tokenIndex, window, trace, this);
  }

  public String describe() {
    StringBuilder sb = new StringBuilder(getMessage());
    for (Token token : tokenWindow) {
      sb.append("\n    ").append(TreeFormatter.describeToken(token));
    }
    trace.ifPresent(t -> sb.append("\n").append(t));
    return sb.toString();
  }
}
