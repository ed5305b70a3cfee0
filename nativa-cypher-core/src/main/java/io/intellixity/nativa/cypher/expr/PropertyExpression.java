package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

import java.util.*;

/**
 * Property access {@code subject.name[.chain...]}.
 * <p>
 * Renders through the subject's alias when it has one ({@code p.name}), otherwise through the subject's text.
 */
public final class PropertyExpression implements Expression {
  private final Expression subject;
  private final String name;
  private final List<String> chain;

  public PropertyExpression(Expression subject, String name) {
    this(subject, name, List.of());
  }

  public PropertyExpression(Expression subject, String name, List<String> chain) {
    this.subject = CypherConstructionException.requirePresent(subject, "Property", "subject");
    this.name = CypherConstructionException.requireText(name, "Property", "name");
    this.chain = List.copyOf(chain == null ? List.of() : chain);
  }

  public Expression subject() { return subject; }
  public String name() { return name; }
  public List<String> chain() { return chain; }

  /** Nested access: {@code p.address.city}. */
  public PropertyExpression property(String next) {
    CypherConstructionException.requireText(next, "Property", "name");
    List<String> extended = new ArrayList<>(chain);
    extended.add(next);
    return new PropertyExpression(subject, name, extended);
  }

  public Comparison eq(Object value) { return Expressions.eq(this, value); }
  public Comparison ne(Object value) { return Expressions.ne(this, value); }
  public Comparison gt(Object value) { return Expressions.gt(this, value); }
  public Comparison gte(Object value) { return Expressions.gte(this, value); }
  public Comparison lt(Object value) { return Expressions.lt(this, value); }
  public Comparison lte(Object value) { return Expressions.lte(this, value); }
  public Comparison in(Object... values) { return Expressions.in(this, values); }
  public Comparison in(Collection<?> values) { return Expressions.in(this, values); }

  public NullCheck isNull() { return Expressions.isNull(this); }
  public NullCheck isNotNull() { return Expressions.isNotNull(this); }

  public StringOperation contains(Object value) { return Expressions.contains(this, value); }
  public StringOperation startsWith(Object value) { return Expressions.startsWith(this, value); }
  public StringOperation endsWith(Object value) { return Expressions.endsWith(this, value); }
  public StringOperation matchesRegex(Object pattern) { return Expressions.matchesRegex(this, pattern); }

  public AliasedExpression as(String alias) { return Expressions.as(this, alias); }
  public SortItem asc() { return Expressions.asc(this); }
  public SortItem desc() { return Expressions.desc(this); }

  /** SET item {@code subject.name = value}. */
  public Assignment to(Object value) { return Expressions.set(this, value); }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PropertyExpression p)) return false;
    return subject.equals(p.subject) && name.equals(p.name) && chain.equals(p.chain);
  }

  @Override
  public int hashCode() { return Objects.hash(subject, name, chain); }

  @Override
  public String toString() { return "Property[" + render() + "]"; }
}
