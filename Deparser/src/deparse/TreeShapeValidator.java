package deparse;

final class TreeShapeValidator extends ErrorCollectingValidator {
  void validate(SyntaxTree tree) {
    ErrorCollectingValidator[] validators = {
      new LoopControlValidator(), new AugmentedAssignValidator()
    };
    for (ErrorCollectingValidator validator : validators) {
      validator.accept(tree);
      takeErrors(validator);
    }
  }
}
