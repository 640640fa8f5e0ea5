package deparse;

final class AugmentedAssignValidator extends ErrorCollectingValidator {
  @Override
  protected void check(Node node, boolean inLoop) {
    if (node.isAny("aug_assign1", "aug_assign2")
        && node.size() > 0
        && node.child(0).size() > 0
        && node.child(0).child(0).is("and")) {
      logError(commentedTree("improper augmented assigment (e.g. +=, *=, ...)", node) + "\n");
    }
  }
}
