package deparse;

public interface Scanner {
  ScannedCode ingest(CodeObject code);
}
