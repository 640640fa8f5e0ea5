package deparse;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

public final class Token extends Node {
  private final Object attr;
  private final String pattr;
  private final int offset;
  private final Optional<Integer> lineStart;

  private Token(String kind, Object attr, String pattr, int offset, Optional<Integer> lineStart) {
    super(kind);
    this.attr = attr;
    this.pattr = pattr;
    this.offset = offset;
    this.lineStart = lineStart;
  }

  public static Token of(String kind) {
    return builder(kind).build();
  }

  public static Token of(String kind, int offset) {
    return builder(kind).offset(offset).build();
  }

  public static Builder builder(String kind) {
    return new Builder(kind);
  }

  public Builder toBuilder() {
    Builder builder = new Builder(kind()).attr(attr).pattr(pattr).offset(offset);
    lineStart.ifPresent(builder::lineStart);
    return builder;
  }

  public Object attr() {
    return attr;
  }

  public boolean hasAttr() {
    return attr != null;
  }

  public Optional<Integer> intAttr() {
    return attr instanceof Integer ? Optional.of((Integer) attr) : Optional.empty();
  }

  public Optional<CodeObject> codeAttr() {
    return attr instanceof CodeObject ? Optional.of((CodeObject) attr) : Optional.empty();
  }

  @SuppressWarnings("unchecked")
  public ImmutableList<Object> listAttr() {
    if (attr instanceof List) return ImmutableList.copyOf((List<Object>) attr);
    throw new IllegalStateException(kind() + " operand is not a sequence: " + attr);
  }

  public String pattr() {
    return pattr != null ? pattr : (attr == null ? "None" : String.valueOf(attr));
  }

  public boolean hasPattr() {
    return pattr != null;
  }

  public int offset() {
    return offset;
  }

  @Override
  public Optional<Integer> lineStart() {
    return lineStart;
  }

  @Override
  public boolean isTerminal() {
    return true;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public Token withKind(String kind) {
    return new Token(kind, attr, pattr, offset, lineStart);
  }

  @Override
  public Optional<Token> firstToken() {
    return Optional.of(this);
  }

  @Override
  public boolean isNone() {
    return is("LOAD_CONST") && attr == null;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Token)) return false;
    Token that = (Token) o;
    return kind().equals(that.kind())
        && Objects.equals(attr, that.attr)
        && Objects.equals(pattr, that.pattr)
        && offset == that.offset
        && lineStart.equals(that.lineStart);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind(), attr, pattr, offset, lineStart);
  }

  public static final class Builder {
    private final String kind;
    private Object attr;
    private String pattr;
    private int offset = -1;
    private Optional<Integer> lineStart = Optional.empty();

    private Builder(String kind) {
      this.kind = kind;
    }

    @CanIgnoreReturnValue
    public Builder attr(Object attr) {
      this.attr = attr;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder pattr(String pattr) {
      this.pattr = pattr;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder offset(int offset) {
      this.offset = offset;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder lineStart(int lineStart) {
      this.lineStart = Optional.of(lineStart);
      return this;
    }

    public Token build() {
      return new Token(kind, attr, pattr, offset, lineStart);
    }
  }
}
