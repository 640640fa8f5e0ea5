package deparse;

import java.util.Optional;

public enum CompileMode {
  EXEC("stmts"),
  SINGLE("single_start"),
  EVAL("expr_start"),
  EXPR("expr_start"),
  LAMBDA("lambda_start"),
  LISTCOMP("lambda_start"),
  GENEXPR("lambda_start"),
  SETCOMP("lambda_start"),
  DICTCOMP("lambda_start");

  private final String startSymbol;

  CompileMode(String startSymbol) {
    this.startSymbol = startSymbol;
  }

  public String startSymbol() {
    return startSymbol;
  }

  public boolean isLambdaLike() {
    return startSymbol.equals("lambda_start");
  }

  public static Optional<CompileMode> forName(String name) {
    for (CompileMode mode : values()) {
      if (mode.name().equalsIgnoreCase(name)) return Optional.of(mode);
    }
    return Optional.empty();
  }
}
