package deparse;

import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

final class DocstringWriter {
  private static final String DOUBLE_QUOTES = "\"\"\"";
  private static final String SINGLE_QUOTES = "'''";

  // Stands in for an escaped backslash while the other escapes are undone.
  private static final char BACKSLASH = '\t';

  private final SourceWalker walker;

  DocstringWriter(SourceWalker walker) {
    this.walker = walker;
  }

  void register(ImmutableMap.Builder<String, NodeHandler> handlers) {
    handlers.put("docstring", this::docstring);
  }

  private void docstring(Node node) {
    Token token = Nodes.token(node.child(0));
    if (!(token.attr() instanceof String)) return;
    String docstring = (String) token.attr();

    String quote = DOUBLE_QUOTES;
    if (docstring.contains("\"") && !docstring.contains(SINGLE_QUOTES)) {
      quote = SINGLE_QUOTES;
    }

    walker.write(walker.indent());
    String body = unescape(docstring);
    if (isRaw(body)) {
      walker.write("r");
      body = body.replace(BACKSLASH, '\\');
    } else {
      char quoteChar = quote.charAt(quote.length() - 1);
      if (!body.isEmpty() && body.charAt(body.length() - 1) == quoteChar) {
        body = body.substring(0, body.length() - 1) + "\\" + quoteChar;
      }
      body = body.replace(quote, "\\" + quote);
      body = body.replace(String.valueOf(BACKSLASH), "\\\\");
    }

    List<String> lines = Splitter.on('\n').splitToList(body);
    walker.write(quote);
    if (lines.size() == 1) {
      walker.println(lines.get(0), quote);
      return;
    }
    walker.println(lines.get(0));
    for (String line : lines.subList(1, lines.size() - 1)) {
      walker.println(line.isEmpty() ? "\n\n" : line);
    }
    walker.println(lines.get(lines.size() - 1), quote);
  }

  static String unescape(String docstring) {
    String repr = PythonLiterals.reprString(expandTabs(docstring));
    String body = repr.substring(1, repr.length() - 1);
    return body.replace("\\\\", String.valueOf(BACKSLASH))
        .replace("\\r\\n", "\n")
        .replace("\\n", "\n")
        .replace("\\r", "\n")
        .replace("\\\"", "\"")
        .replace("\\'", "'");
  }

  // Backslashes but nothing else that needs escaping, and no ending a raw string cannot have.
  private static boolean isRaw(String body) {
    int n = body.length();
    return body.indexOf(BACKSLASH) >= 0
        && body.indexOf('\\') < 0
        && n >= 2
        && body.charAt(n - 1) != BACKSLASH
        && (body.charAt(n - 1) != '"' || body.charAt(n - 2) == BACKSLASH);
  }

  static String expandTabs(String s) {
    StringBuilder sb = new StringBuilder();
    int column = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\t') {
        int spaces = 8 - column % 8;
        for (int k = 0; k < spaces; k++) {
          sb.append(' ');
        }
        column += spaces;
      } else {
        sb.append(c);
        column = c == '\n' || c == '\r' ? 0 : column + 1;
      }
    }
    return sb.toString();
  }
}
