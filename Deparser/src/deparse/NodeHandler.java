package deparse;

@FunctionalInterface
interface NodeHandler {
  void render(Node node) throws ParserException;
}
