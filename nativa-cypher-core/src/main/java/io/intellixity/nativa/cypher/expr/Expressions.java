package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.statement.Parameters;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/** Static factories for expressions and predicates. */
public final class Expressions {
  private static final AtomicLong ANONYMOUS_PARAMS = new AtomicLong();

  private Expressions() {}

  /**
   * Value coercion used wherever a raw value meets the expression tree: expressions pass through,
   * collections and arrays become lists, maps become map literals, everything else a {@link Literal}.
   */
  public static Expression valueOf(Object value) {
    if (value instanceof Expression e) return e;
    if (value instanceof Collection<?> c) return listOf(c);
    if (value instanceof Object[] arr) return listOf(Arrays.asList(arr));
    if (value instanceof Map<?,?> m) return mapOf(m);
    return Literal.of(value);
  }

  public static Literal literal(Object value) { return Literal.of(value); }

  public static Literal nullLiteral() { return Literal.nullValue(); }

  /** Anonymous parameter; names are unique for the lifetime of the process. */
  public static Parameter param(Object value) {
    return new Parameter("param" + ANONYMOUS_PARAMS.incrementAndGet(), value);
  }

  public static Parameter namedParam(String name, Object value) {
    return new Parameter(Parameters.sanitize(name), value);
  }

  /** Keeps a raw value out of the query text by turning it into an anonymous parameter. */
  public static Parameter safe(Object value) { return param(value); }

  public static Map<String, Expression> safeMap(Map<String, ?> values) {
    if (values == null) return null;
    Map<String, Expression> out = new LinkedHashMap<>();
    for (Map.Entry<String, ?> e : values.entrySet()) out.put(e.getKey(), safe(e.getValue()));
    return out;
  }

  public static Variable variable(String name) { return new Variable(name); }

  public static PropertyExpression property(Expression subject, String name) {
    return new PropertyExpression(subject, name);
  }

  public static PropertyExpression property(String variable, String name) {
    return new PropertyExpression(new Variable(variable), name);
  }

  public static ListExpression list(Object... values) {
    return listOf(values == null ? List.of() : Arrays.asList(values));
  }

  public static ListExpression listOf(Collection<?> values) {
    List<Expression> out = new ArrayList<>();
    if (values != null) {
      for (Object v : values) out.add(valueOf(v));
    }
    return new ListExpression(out);
  }

  public static MapExpression mapOf(Map<?, ?> values) {
    Map<String, Expression> out = new LinkedHashMap<>();
    if (values != null) {
      for (Map.Entry<?, ?> e : values.entrySet()) {
        if (e.getKey() == null) throw new CypherConstructionException("Map", "key must not be null");
        out.put(String.valueOf(e.getKey()), valueOf(e.getValue()));
      }
    }
    return new MapExpression(out);
  }

  // ---------- boolean combinators ----------

  public static Logical and(Expression left, Expression right) { return new Logical(left, Logical.Operator.AND, right); }
  public static Logical or(Expression left, Expression right) { return new Logical(left, Logical.Operator.OR, right); }
  public static Logical xor(Expression left, Expression right) { return new Logical(left, Logical.Operator.XOR, right); }

  /** Left fold with AND: {@code ((a AND b) AND c)}. A single condition is returned as-is. */
  public static Expression allOf(Expression... conditions) { return fold(Logical.Operator.AND, conditions); }

  public static Expression anyOf(Expression... conditions) { return fold(Logical.Operator.OR, conditions); }

  /** Negation; {@code not(not(x))} is {@code x}. */
  public static Expression not(Expression expression) {
    CypherConstructionException.requirePresent(expression, "Not", "expression");
    if (expression instanceof Not n) return n.expression();
    return new Not(expression);
  }

  private static Expression fold(Logical.Operator op, Expression... conditions) {
    if (conditions == null || conditions.length == 0) {
      throw new CypherConstructionException(op.name(), "at least one condition is required");
    }
    Expression acc = CypherConstructionException.requirePresent(conditions[0], op.name(), "condition");
    for (int i = 1; i < conditions.length; i++) acc = new Logical(acc, op, conditions[i]);
    return acc;
  }

  // ---------- comparisons ----------

  public static Comparison eq(Expression left, Object right) { return compare(left, Comparison.Operator.EQ, right); }
  public static Comparison ne(Expression left, Object right) { return compare(left, Comparison.Operator.NE, right); }
  public static Comparison gt(Expression left, Object right) { return compare(left, Comparison.Operator.GT, right); }
  public static Comparison gte(Expression left, Object right) { return compare(left, Comparison.Operator.GTE, right); }
  public static Comparison lt(Expression left, Object right) { return compare(left, Comparison.Operator.LT, right); }
  public static Comparison lte(Expression left, Object right) { return compare(left, Comparison.Operator.LTE, right); }

  public static Comparison compare(Expression left, Comparison.Operator op, Object right) {
    return new Comparison(left, op, valueOf(right));
  }

  /** {@code left IN [v1, v2]}; each value is coerced individually. */
  public static Comparison in(Expression left, Object... values) {
    return new Comparison(left, Comparison.Operator.IN, list(values));
  }

  public static Comparison in(Expression left, Collection<?> values) {
    return new Comparison(left, Comparison.Operator.IN, listOf(values));
  }

  /** {@code left IN right} where right already evaluates to a list ({@code $ids}, {@code collect(x)}). */
  public static Comparison in(Expression left, Expression right) {
    if (right instanceof ListExpression || right instanceof Parameter || right instanceof Variable
        || right instanceof FunctionCall || right instanceof PropertyExpression || right instanceof RawCypher) {
      return new Comparison(left, Comparison.Operator.IN, right);
    }
    return new Comparison(left, Comparison.Operator.IN, new ListExpression(List.of(right)));
  }

  public static NullCheck isNull(Expression expression) { return new NullCheck(expression, true); }
  public static NullCheck isNotNull(Expression expression) { return new NullCheck(expression, false); }

  // ---------- string operators ----------

  public static StringOperation contains(Expression left, Object right) {
    return new StringOperation(left, StringOperation.Operator.CONTAINS, valueOf(right));
  }

  public static StringOperation startsWith(Expression left, Object right) {
    return new StringOperation(left, StringOperation.Operator.STARTS_WITH, valueOf(right));
  }

  public static StringOperation endsWith(Expression left, Object right) {
    return new StringOperation(left, StringOperation.Operator.ENDS_WITH, valueOf(right));
  }

  public static StringOperation matchesRegex(Expression left, Object pattern) {
    return new StringOperation(left, StringOperation.Operator.REGEX, valueOf(pattern));
  }

  // ---------- projection / ordering ----------

  public static AliasedExpression as(Expression expression, String alias) { return new AliasedExpression(expression, alias); }

  public static SortItem asc(Expression expression) { return new SortItem(expression, SortItem.Direction.ASC); }
  public static SortItem desc(Expression expression) { return new SortItem(expression, SortItem.Direction.DESC); }

  /** Sort key without an explicit direction. */
  public static SortItem sort(Expression expression) { return new SortItem(expression, null); }

  public static RawCypher raw(String text) { return new RawCypher(text); }

  /** String concatenation {@code a + b + c}. */
  public static Expression concat(Object... parts) {
    if (parts == null || parts.length == 0) throw new CypherConstructionException("concat", "at least one part is required");
    Expression acc = valueOf(parts[0]);
    for (int i = 1; i < parts.length; i++) acc = new Arithmetic(acc, Arithmetic.Operator.ADD, valueOf(parts[i]));
    return acc;
  }

  public static Arithmetic arithmetic(Expression left, Arithmetic.Operator op, Object right) {
    return new Arithmetic(left, op, valueOf(right));
  }

  // ---------- SET / REMOVE items ----------

  public static Assignment set(Expression target, Object value) {
    return new Assignment(target, Assignment.Operator.ASSIGN, valueOf(value));
  }

  /** Replace all properties: {@code p = {..}}. */
  public static Assignment setAll(Expression target, Map<String, ?> properties) {
    return new Assignment(target, Assignment.Operator.ASSIGN, mapOf(properties));
  }

  /** Merge properties in: {@code p += {..}}. */
  public static Assignment mutate(Expression target, Map<String, ?> properties) {
    return new Assignment(target, Assignment.Operator.MUTATE, mapOf(properties));
  }

  public static LabelOperation nodeLabels(Expression subject, String... labels) {
    return new LabelOperation(subject, labels == null ? List.of() : Arrays.asList(labels));
  }
}
