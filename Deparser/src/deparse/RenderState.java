package deparse;

import java.util.ArrayDeque;
import java.util.Deque;

import com.google.common.base.Preconditions;

final class RenderState {
  static final String INDENT_PER_LEVEL = " ";
  static final String TAB = "    ";

  static final class Scope {
    private final SourceBuffer buffer = new SourceBuffer();
    private String indent;
    private boolean lambda;

    private Scope(String indent, boolean lambda) {
      this.indent = indent;
      this.lambda = lambda;
    }

    SourceBuffer buffer() {
      return buffer;
    }

    String indent() {
      return indent;
    }

    boolean isLambda() {
      return lambda;
    }
  }

  interface Restorer extends AutoCloseable {
    @Override
    void close();
  }

  private final Deque<Scope> scopes = new ArrayDeque<>();
  private int precedence = Precedence.DEFAULT;
  private int lineNumber = 1;

  RenderState() {
    scopes.push(new Scope("", false));
  }

  Scope scope() {
    return scopes.peek();
  }

  // Number of scopes opened above the outermost output.
  int depth() {
    return scopes.size() - 1;
  }

  Restorer enterScope(String indent, boolean lambda) {
    Scope scope = new Scope(indent, lambda);
    scopes.push(scope);
    return () -> {
      Preconditions.checkState(scopes.peek() == scope, "scopes closed out of order");
      scopes.pop();
    };
  }

  Restorer withLambda(boolean lambda) {
    Scope scope = scope();
    boolean saved = scope.lambda;
    scope.lambda = lambda;
    return () -> scope.lambda = saved;
  }

  int precedence() {
    return precedence;
  }

  Restorer withPrecedence(int newPrecedence) {
    int saved = precedence;
    precedence = newPrecedence;
    return () -> precedence = saved;
  }

  void indentMore(String amount) {
    scope().indent += amount;
  }

  void indentLess(String amount) {
    Scope scope = scope();
    Preconditions.checkState(scope.indent.endsWith(amount), "indent underflow");
    scope.indent = scope.indent.substring(0, scope.indent.length() - amount.length());
  }

  int lineNumber() {
    return lineNumber;
  }

  void advanceLine() {
    lineNumber++;
  }

  void setLineNumber(int lineNumber) {
    this.lineNumber = lineNumber;
  }
}
