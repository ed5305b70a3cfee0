package io.intellixity.nativa.cypher.expr;

import java.util.*;

/** Cypher function calls. Arguments are coerced with {@link Expressions#valueOf(Object)}. */
public final class Functions {
  private Functions() {}

  public static FunctionCall call(String name, Object... args) {
    List<Expression> out = new ArrayList<>();
    if (args != null) {
      for (Object a : args) out.add(Expressions.valueOf(a));
    }
    return new FunctionCall(name, out);
  }

  /** Wraps the first argument of {@code function} in {@code DISTINCT}. */
  public static FunctionCall distinct(FunctionCall function) { return function.distinct(); }

  // aggregates
  public static FunctionCall count(Expression e) { return call("count", e); }
  public static FunctionCall countStar() { return call("count", new RawCypher("*")); }
  public static FunctionCall countDistinct(Expression e) { return count(e).distinct(); }
  public static FunctionCall sum(Expression e) { return call("sum", e); }
  public static FunctionCall avg(Expression e) { return call("avg", e); }
  public static FunctionCall min(Expression e) { return call("min", e); }
  public static FunctionCall max(Expression e) { return call("max", e); }
  public static FunctionCall collect(Expression e) { return call("collect", e); }
  public static FunctionCall collectDistinct(Expression e) { return collect(e).distinct(); }

  // scalar
  public static FunctionCall size(Expression e) { return call("size", e); }
  public static FunctionCall length(Expression path) { return call("length", path); }
  public static FunctionCall type(Expression relationship) { return call("type", relationship); }
  public static FunctionCall id(Expression entity) { return call("id", entity); }
  public static FunctionCall elementId(Expression entity) { return call("elementId", entity); }
  public static FunctionCall labels(Expression node) { return call("labels", node); }
  public static FunctionCall keys(Expression entity) { return call("keys", entity); }
  public static FunctionCall nodes(Expression path) { return call("nodes", path); }
  public static FunctionCall relationships(Expression path) { return call("relationships", path); }
  public static FunctionCall exists(Expression e) { return call("exists", e); }
  public static FunctionCall timestamp() { return call("timestamp"); }
  public static FunctionCall date(Object... args) { return call("date", args); }
  public static FunctionCall datetime(Object... args) { return call("datetime", args); }

  public static FunctionCall coalesce(Object... values) { return call("coalesce", values); }

  // string
  public static FunctionCall toLower(Expression e) { return call("toLower", e); }
  public static FunctionCall toUpper(Expression e) { return call("toUpper", e); }
  public static FunctionCall trim(Expression e) { return call("trim", e); }
  public static FunctionCall lTrim(Expression e) { return call("lTrim", e); }
  public static FunctionCall rTrim(Expression e) { return call("rTrim", e); }
  public static FunctionCall toString(Expression e) { return call("toString", e); }
  public static FunctionCall toInteger(Expression e) { return call("toInteger", e); }
  public static FunctionCall toFloat(Expression e) { return call("toFloat", e); }
  public static FunctionCall split(Expression e, Object delimiter) { return call("split", e, delimiter); }
  public static FunctionCall replace(Expression e, Object search, Object replacement) { return call("replace", e, search, replacement); }

  public static FunctionCall substring(Expression e, int start) { return call("substring", e, start); }
  public static FunctionCall substring(Expression e, int start, int length) { return call("substring", e, start, length); }
}
