package io.intellixity.nativa.cypher.statement;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.config.CypherSettings;
import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.expr.Parameter;

import java.util.*;

/**
 * Parameter table for one statement-construction session.
 * <p>
 * Not thread-safe. A container belongs to a single session; calling {@link #add(Object)} concurrently on
 * one instance is a misuse and is not guarded.
 */
public final class Parameters {
  public static final String DEFAULT_PREFIX = "param";

  private final String prefix;
  private final Map<String, Object> values = new LinkedHashMap<>();
  private int counter;

  /** Container using the configured prefix ({@link CypherSettings#parameterPrefix()}, {@code param} by default). */
  public Parameters() {
    this(CypherSettings.current().parameterPrefix());
  }

  public Parameters(String prefix) {
    this.prefix = sanitize(CypherConstructionException.requireText(prefix, "Parameters", "prefix"));
  }

  /** Anonymous parameter named {@code prefix + n}; names never repeat within this container. */
  public Parameter add(Object value) {
    String name;
    do {
      name = prefix + (++counter);
    } while (values.containsKey(name));
    values.put(name, value);
    return new Parameter(name, value);
  }

  /** Named parameter; the name is sanitized first and a previous value under it is replaced. */
  public Parameter addNamed(String name, Object value) {
    String safe = sanitize(name);
    values.put(safe, value);
    return new Parameter(safe, value);
  }

  public Object get(String name) { return values.get(name); }

  public boolean contains(String name) { return values.containsKey(name); }

  public int size() { return values.size(); }

  public String prefix() { return prefix; }

  /** Read-only view in insertion order. */
  public Map<String, Object> asMap() { return Collections.unmodifiableMap(values); }

  /**
   * Turns an arbitrary name into a legal parameter name: characters other than letters, digits and
   * {@code _} become {@code _}, and a name that does not start with a letter gets a {@code p_} prefix.
   */
  public static String sanitize(String name) {
    CypherConstructionException.requireText(name, "Parameters", "name");
    StringBuilder sb = new StringBuilder(name.length() + 2);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
    }
    if (!Character.isLetter(sb.charAt(0))) sb.insert(0, "p_");
    return sb.toString();
  }

  /** Every parameter reachable from {@code expressions}, later writes overriding earlier ones. */
  public static Map<String, Object> extract(Expression... expressions) {
    Map<String, Object> out = new LinkedHashMap<>();
    ParameterCollector collector = new ParameterCollector(out);
    if (expressions != null) {
      for (Expression e : expressions) collector.collect(e);
    }
    return out;
  }
}
