package io.intellixity.nativa.cypher.render;

import io.intellixity.nativa.cypher.expr.*;
import io.intellixity.nativa.cypher.pattern.*;

import java.math.BigDecimal;
import java.util.*;

/**
 * Renders expression trees to Cypher text.
 * <p>
 * Pattern elements render in full only in pattern position ({@link #render(Expression)} on the element
 * itself, or inside a path). As an operand, projection item or function argument an aliased element
 * renders as its alias, so {@code RETURN p} and {@code count(p)} come out right.
 */
public final class ExpressionRenderer implements ExpressionVisitor<String> {
  private static final ExpressionRenderer INSTANCE = new ExpressionRenderer();

  private ExpressionRenderer() {}

  public static String render(Expression expression) {
    return expression.accept(INSTANCE);
  }

  /** Rendering for an expression used as a value: aliased pattern elements collapse to their alias. */
  public static String reference(Expression expression) {
    if (expression instanceof PatternElement pe && pe.hasAlias()) return pe.alias();
    return expression.accept(INSTANCE);
  }

  public static String join(List<? extends Expression> expressions) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < expressions.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(reference(expressions.get(i)));
    }
    return sb.toString();
  }

  /** Literal text for a raw value, using the same coercion as {@link Expressions#valueOf(Object)}. */
  public static String literal(Object value) {
    if (value == null) return "NULL";
    if (value instanceof Expression e) return reference(e);
    if (value instanceof CharSequence cs) return quote(cs.toString());
    if (value instanceof Character c) return quote(String.valueOf(c));
    if (value instanceof Boolean b) return b ? "true" : "false";
    if (value instanceof Double d) return decimal(BigDecimal.valueOf(d));
    if (value instanceof Float f) return decimal(new BigDecimal(Float.toString(f)));
    if (value instanceof BigDecimal bd) return decimal(bd);
    if (value instanceof Number n) return n.toString();
    if (value instanceof Enum<?> e) return quote(e.name());
    if (value instanceof Collection<?> || value instanceof Object[] || value instanceof Map<?,?>) {
      return reference(Expressions.valueOf(value));
    }
    return quote(String.valueOf(value));
  }

  /** Single-quoted string literal; {@code '} becomes {@code \'} and {@code \} becomes {@code \\}. */
  public static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append('\'');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\') sb.append("\\\\");
      else if (c == '\'') sb.append("\\'");
      else sb.append(c);
    }
    return sb.append('\'').toString();
  }

  private static String decimal(BigDecimal d) {
    if (d.signum() == 0) return "0";
    return d.stripTrailingZeros().toPlainString();
  }

  @Override
  public String visit(Literal literal) { return literal(literal.value()); }

  @Override
  public String visit(Parameter parameter) { return "$" + parameter.name(); }

  @Override
  public String visit(Variable variable) { return variable.name(); }

  @Override
  public String visit(PropertyExpression property) {
    StringBuilder sb = new StringBuilder(reference(property.subject()));
    sb.append('.').append(Identifiers.quoteIfNeeded(property.name()));
    for (String part : property.chain()) sb.append('.').append(Identifiers.quoteIfNeeded(part));
    return sb.toString();
  }

  @Override
  public String visit(Comparison comparison) {
    return reference(comparison.left()) + " " + comparison.operator().symbol() + " " + reference(comparison.right());
  }

  @Override
  public String visit(StringOperation operation) {
    return reference(operation.left()) + " " + operation.operator().symbol() + " " + reference(operation.right());
  }

  @Override
  public String visit(NullCheck nullCheck) {
    return reference(nullCheck.expression()) + (nullCheck.isNull() ? " IS NULL" : " IS NOT NULL");
  }

  @Override
  public String visit(Logical logical) {
    return "(" + reference(logical.left()) + " " + logical.operator().name() + " " + reference(logical.right()) + ")";
  }

  @Override
  public String visit(Not not) {
    // Stacked negations cancel pairwise.
    Expression inner = not.expression();
    boolean negated = true;
    while (inner instanceof Not nested) {
      inner = nested.expression();
      negated = !negated;
    }
    return negated ? "NOT (" + reference(inner) + ")" : render(inner);
  }

  @Override
  public String visit(FunctionCall function) {
    return function.name() + "(" + join(function.arguments()) + ")";
  }

  @Override
  public String visit(Distinct distinct) { return "DISTINCT " + reference(distinct.expression()); }

  @Override
  public String visit(AliasedExpression aliased) {
    return reference(aliased.expression()) + " AS " + Identifiers.quoteIfNeeded(aliased.alias());
  }

  @Override
  public String visit(SortItem sortItem) {
    String e = reference(sortItem.expression());
    return (sortItem.direction() == null) ? e : e + " " + sortItem.direction().name();
  }

  @Override
  public String visit(ListExpression list) { return "[" + join(list.elements()) + "]"; }

  @Override
  public String visit(MapExpression map) { return "{" + entries(map.entries()) + "}"; }

  @Override
  public String visit(RawCypher raw) { return raw.text(); }

  @Override
  public String visit(Arithmetic arithmetic) {
    return reference(arithmetic.left()) + " " + arithmetic.operator().symbol() + " " + reference(arithmetic.right());
  }

  @Override
  public String visit(Assignment assignment) {
    return reference(assignment.target()) + " " + assignment.operator().symbol() + " " + reference(assignment.value());
  }

  @Override
  public String visit(LabelOperation labels) {
    StringBuilder sb = new StringBuilder(reference(labels.subject()));
    for (String l : labels.labels()) sb.append(':').append(Identifiers.quoted(l));
    return sb.toString();
  }

  @Override
  public String visit(NodePattern node) {
    StringBuilder sb = new StringBuilder("(");
    if (node.alias() != null) sb.append(node.alias());
    for (String l : node.labels()) sb.append(':').append(Identifiers.quoted(l));
    if (!node.properties().isEmpty()) {
      sb.append(" {").append(entries(node.properties())).append('}');
    }
    return sb.append(')').toString();
  }

  @Override
  public String visit(RelationshipPattern relationship) {
    return render(relationship.start()) + arrow(relationship) + render(relationship.end());
  }

  @Override
  public String visit(PatternPath path) {
    StringBuilder sb = new StringBuilder();
    if (path.alias() != null) sb.append(path.alias()).append(" = ");
    List<PatternElement> els = path.elements();
    for (int i = 0; i < els.size(); i++) {
      PatternElement e = els.get(i);
      if (e instanceof RelationshipPattern r) {
        // a preceding relationship already wrote the shared node
        boolean afterNode = i > 0 && (els.get(i - 1) instanceof NodePattern || els.get(i - 1) instanceof RelationshipPattern);
        boolean beforeNode = i + 1 < els.size() && els.get(i + 1) instanceof NodePattern;
        if (!afterNode) sb.append(render(r.start()));
        sb.append(arrow(r));
        if (!beforeNode) sb.append(render(r.end()));
      } else {
        sb.append(render(e));
      }
    }
    return sb.toString();
  }

  private static String arrow(RelationshipPattern r) {
    StringBuilder sb = new StringBuilder();
    sb.append(r.direction() == Direction.INCOMING ? "<-[" : "-[");
    if (r.alias() != null) sb.append(r.alias());
    for (int i = 0; i < r.types().size(); i++) {
      sb.append(i == 0 ? ":" : "|").append(Identifiers.quoted(r.types().get(i)));
    }
    if (r.variableLength()) {
      sb.append('*');
      if (r.minHops() != null) sb.append(r.minHops());
      if (r.maxHops() != null) sb.append("..").append(r.maxHops());
      else if (r.minHops() != null) sb.append("..");
    }
    if (!r.properties().isEmpty()) {
      sb.append(" {").append(entries(r.properties())).append('}');
    }
    sb.append(']');
    sb.append(r.direction() == Direction.OUTGOING ? "->" : "-");
    return sb.toString();
  }

  private static String entries(Map<String, Expression> entries) {
    StringBuilder sb = new StringBuilder();
    boolean first = true;
    for (Map.Entry<String, Expression> e : entries.entrySet()) {
      if (!first) sb.append(", ");
      first = false;
      sb.append(Identifiers.quoteIfNeeded(e.getKey())).append(": ").append(reference(e.getValue()));
    }
    return sb.toString();
  }
}
