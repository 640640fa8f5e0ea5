package deparse;

import static com.google.common.truth.Truth.assertThat;
import static deparse.TreeFixtures.load;
import static deparse.TreeFixtures.stmts;
import static deparse.TreeFixtures.store;
import static deparse.TreeFixtures.token;
import static deparse.TreeFixtures.tree;

import org.junit.jupiter.api.Test;

public class TreeShapeValidatorTest {

  private static TreeShapeValidator validate(SyntaxTree tree) {
    TreeShapeValidator validator = new TreeShapeValidator();
    validator.validate(tree);
    return validator;
  }

  private static SyntaxTree loop(String kind, Node... body) {
    return tree(kind, tree("stmts", body));
  }

  @Test
  public void loopControlOutsideLoop() {
    TreeShapeValidator validator = validate(stmts(tree("break"), tree("continue")));

    assertThat(validator.hasErrors()).isTrue();
    assertThat(validator.errors()).hasSize(2);
    assertThat(validator.errors().get(0)).startsWith("\n# not in loop:\n#\t");
    assertThat(validator.errors().get(0)).contains("break");
    assertThat(validator.errors().get(1)).contains("continue");
  }

  @Test
  public void loopControlInsideLoops() {
    assertThat(validate(stmts(loop("for", tree("break")))).hasErrors()).isFalse();
    assertThat(validate(stmts(loop("whilestmt", tree("continue")))).hasErrors()).isFalse();
    assertThat(validate(stmts(loop("async_for_stmt", tree("break")))).hasErrors()).isFalse();
    assertThat(validate(stmts(loop("ifstmt", tree("break")))).hasErrors()).isTrue();
  }

  @Test
  public void augmentedAssignmentOfAnd() {
    SyntaxTree bad =
        tree(
            "aug_assign1",
            tree("expr", tree("and", load("a"), token("JUMP_IF_FALSE_OR_POP"), load("b"))),
            load("c"),
            tree("inplace_op", token("INPLACE_ADD")),
            store("a"));
    TreeShapeValidator validator = validate(stmts(bad));

    assertThat(validator.errors()).hasSize(1);
    assertThat(validator.errors().get(0))
        .contains("# improper augmented assigment (e.g. +=, *=, ...):");
  }

  @Test
  public void cleanTreeHasNoErrors() {
    SyntaxTree fine =
        tree("aug_assign1", load("a"), load("c"), tree("inplace_op", token("INPLACE_ADD")));
    assertThat(validate(stmts(fine)).errors()).isEmpty();
  }
}
