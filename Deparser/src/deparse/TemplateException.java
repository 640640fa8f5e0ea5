package deparse;

public class TemplateException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public TemplateException(String message) {
    super(message);
  }

  static TemplateException unexpectedChild(Node node, int index, Object expected, Node actual) {
    return new TemplateException(
        String.format(
            "at %s[%d], expected '%s' node; got '%s'",
            node.kind(),
            index,
            expected,
            actual.kind()));
  }
}
