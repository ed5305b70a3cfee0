package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.safety.LiteralSafety;

import java.util.Objects;

/**
 * Inline value: string, number, boolean or null. Collections and maps are coerced element-wise when rendered.
 * <p>
 * String values pass through {@link LiteralSafety} at construction.
 */
public final class Literal implements Expression {
  private static final Literal NULL = new Literal(null);
  private static final Literal TRUE = new Literal(Boolean.TRUE);
  private static final Literal FALSE = new Literal(Boolean.FALSE);

  private final Object value;

  private Literal(Object value) {
    this.value = value;
  }

  public static Literal of(Object value) {
    if (value == null) return NULL;
    if (value instanceof Boolean b) return b ? TRUE : FALSE;
    if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
      throw new CypherConstructionException("Literal", "non-finite number has no Cypher literal form: " + d);
    }
    if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
      throw new CypherConstructionException("Literal", "non-finite number has no Cypher literal form: " + f);
    }
    if (value instanceof CharSequence cs) LiteralSafety.defaults().check(cs.toString());
    return new Literal(value);
  }

  public static Literal nullValue() { return NULL; }

  public Object value() { return value; }

  public boolean isNull() { return value == null; }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return (o instanceof Literal l) && Objects.equals(value, l.value);
  }

  @Override
  public int hashCode() { return Objects.hashCode(value); }

  @Override
  public String toString() { return "Literal[" + value + "]"; }
}
