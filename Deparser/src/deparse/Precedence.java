package deparse;

import com.google.common.collect.ImmutableMap;

/**
 * Binding strength of expression kinds; lower binds tighter. A child is parenthesized when the
 * precedence installed by its context is lower than its own.
 */
final class Precedence {
  static final int DEFAULT = 100;
  static final int NO_PARENTHESIS_EVER = 100;
  static final int NEVER = -2;
  static final int COMPREHENSION = 27;
  static final int UNARY = 6;

  static final ImmutableMap<String, Integer> TABLE =
      ImmutableMap.<String, Integer>builder()
          .put("named_expr", 40)
          .put("dict_unpack", 38)
          .put("list_unpack", 38)
          .put("yield_from", 38)
          .put("tuple_list_starred", 38)
          .put("unpack", 38)
          .put("_lambda_body", 30)
          .put("lambda_body", 32)
          .put("yield", 30)
          .put("if_exp", 28)
          .put("if_exp_lambda", 28)
          .put("if_exp_not_lambda", 28)
          .put("if_exp_not", 28)
          .put("if_exp_true", 28)
          .put("if_exp_ret", 28)
          .put("or", 26)
          .put("ret_or", 26)
          .put("and", 24)
          .put("ret_and", 24)
          .put("and_not", 24)
          .put("not", 22)
          .put("unary_not", 22)
          .put("compare", 20)
          .put("BINARY_OR", 18)
          .put("BINARY_XOR", 16)
          .put("BINARY_AND", 14)
          .put("BINARY_LSHIFT", 12)
          .put("BINARY_RSHIFT", 12)
          .put("BINARY_ADD", 10)
          .put("BINARY_SUBTRACT", 10)
          .put("BINARY_DIVIDE", 8)
          .put("BINARY_FLOOR_DIVIDE", 8)
          .put("BINARY_MATRIX_MULTIPLY", 8)
          .put("BINARY_MODULO", 8)
          .put("BINARY_MULTIPLY", 8)
          .put("BINARY_TRUE_DIVIDE", 8)
          .put("unary_op", UNARY)
          .put("BINARY_POWER", 4)
          .put("await_expr", 3)
          .put("attribute", 2)
          .put("buildslice2", 2)
          .put("buildslice3", 2)
          .put("call", 2)
          .put("call_kw36", 2)
          .put("delete_subscript", 2)
          .put("slice0", 2)
          .put("slice1", 2)
          .put("slice2", 2)
          .put("slice3", 2)
          .put("store_subscript", 2)
          .put("subscript", 2)
          .put("subscript2", 2)
          .put("dict", 0)
          .put("dict_comp", 0)
          .put("generator_exp", 0)
          .put("list", 0)
          .put("list_comp", 0)
          .put("set_comp", 0)
          .put("set_comp_expr", 0)
          .put("unary_convert", 0)
          .build();

  static final int YIELD = TABLE.get("yield");
  static final int SUBSCRIPT = TABLE.get("subscript");
  static final int ATTRIBUTE = TABLE.get("attribute");
  static final int NAMED_EXPR = TABLE.get("named_expr");

  static int of(String kind) {
    return TABLE.getOrDefault(kind, NEVER);
  }

  private Precedence() {}
}
