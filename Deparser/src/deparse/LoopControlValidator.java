package deparse;

final class LoopControlValidator extends ErrorCollectingValidator {
  @Override
  protected void check(Node node, boolean inLoop) {
    if (!inLoop && node.isAny("continue", "break")) {
      logError(commentedTree("not in loop", node));
    }
  }
}
