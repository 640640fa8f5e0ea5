package deparse;

import java.math.BigDecimal;
import java.util.List;

final class PythonLiterals {
  // The ... constant.
  static final Object ELLIPSIS =
      new Object() {
        @Override
        public String toString() {
          return "Ellipsis";
        }
      };

  static String repr(Object value) {
    if (value == null) return "None";
    if (value == ELLIPSIS) return "...";
    if (value instanceof Boolean) return ((Boolean) value) ? "True" : "False";
    if (value instanceof Double || value instanceof Float) {
      return reprFloat(((Number) value).doubleValue());
    }
    if (value instanceof Number) return value.toString();
    if (value instanceof String) return reprString((String) value);
    if (value instanceof byte[]) return reprBytes((byte[]) value);
    if (value instanceof List) return reprTuple((List<?>) value);
    if (value instanceof CodeObject) return "<code object " + ((CodeObject) value).name() + ">";
    return value.toString();
  }

  static String reprTuple(List<?> values) {
    if (values.size() == 1) return "(" + repr(values.get(0)) + ",)";
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(repr(values.get(i)));
    }
    return sb.append(')').toString();
  }

  static String reprFloat(double d) {
    if (Double.isNaN(d)) return "float('nan')";
    if (Double.isInfinite(d)) return d > 0 ? "float('inf')" : "-float('inf')";
    if (d == 0) return (1 / d < 0) ? "-0.0" : "0.0";

    BigDecimal exact = new BigDecimal(Double.toString(d)).stripTrailingZeros();
    double magnitude = Math.abs(d);
    if (magnitude >= 1e-4 && magnitude < 1e16) {
      String plain = exact.toPlainString();
      return plain.contains(".") ? plain : plain + ".0";
    }

    String digits = exact.unscaledValue().abs().toString();
    int exponent = digits.length() - 1 - exact.scale();
    StringBuilder sb = new StringBuilder();
    if (d < 0) sb.append('-');
    sb.append(digits.charAt(0));
    if (digits.length() > 1) sb.append('.').append(digits, 1, digits.length());
    sb.append('e').append(exponent < 0 ? '-' : '+');
    int abs = Math.abs(exponent);
    if (abs < 10) sb.append('0');
    return sb.append(abs).toString();
  }

  static String reprString(String s) {
    char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
    StringBuilder sb = new StringBuilder().append(quote);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c == quote) {
            sb.append('\\').append(c);
          } else if (c < 0x20 || c == 0x7f || (c >= 0x80 && c < 0xa0)) {
            sb.append(String.format("\\x%02x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.append(quote).toString();
  }

  static String reprBytes(byte[] bytes) {
    boolean hasSingle = false;
    boolean hasDouble = false;
    for (byte b : bytes) {
      hasSingle |= b == '\'';
      hasDouble |= b == '"';
    }
    char quote = hasSingle && !hasDouble ? '"' : '\'';
    StringBuilder sb = new StringBuilder("b").append(quote);
    for (byte b : bytes) {
      int c = b & 0xff;
      if (c == '\\') {
        sb.append("\\\\");
      } else if (c == quote) {
        sb.append('\\').append((char) c);
      } else if (c == '\n') {
        sb.append("\\n");
      } else if (c == '\r') {
        sb.append("\\r");
      } else if (c == '\t') {
        sb.append("\\t");
      } else if (c < 0x20 || c >= 0x7f) {
        sb.append(String.format("\\x%02x", c));
      } else {
        sb.append((char) c);
      }
    }
    return sb.append(quote).toString();
  }

  private PythonLiterals() {}
}
