package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.CypherBuildException;
import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.pattern.PatternElement;
import io.intellixity.nativa.cypher.render.ExpressionRenderer;
import io.intellixity.nativa.cypher.statement.ParameterCollector;
import io.intellixity.nativa.cypher.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * One node of the persistent clause chain.
 * <p>
 * A node holds its clause fields and a reference to the previous node; it is never modified after construction.
 * Every chaining method returns a new node, so a shared prefix can be continued from several places.
 * Subclasses render only their own clause via {@link #cypher(ParameterCollector)}.
 */
abstract class AbstractClause implements Buildable {
  private static final Logger log = LoggerFactory.getLogger(AbstractClause.class);

  private final AbstractClause previous;

  protected AbstractClause(AbstractClause previous) {
    this.previous = previous;
  }

  final AbstractClause previous() { return previous; }

  /** Clause keyword used in error messages. */
  abstract String clause();

  /**
   * Local text of this clause; parameters referenced by its expressions go to {@code params}.
   * An empty string means the clause contributes nothing (e.g. {@code SKIP 0}).
   */
  abstract String cypher(ParameterCollector params);

  final Statement local() {
    Map<String, Object> params = new LinkedHashMap<>();
    String text = cypher(new ParameterCollector(params));
    return new Statement(text, params);
  }

  @Override
  public final Statement build() {
    // Walk back to the first clause, then fold forward; same result as building the predecessor first.
    Deque<AbstractClause> chain = new ArrayDeque<>();
    for (AbstractClause c = this; c != null; c = c.previous) chain.push(c);

    Statement acc = Statement.empty();
    for (AbstractClause c : chain) acc = acc.merge(c.local());

    if (log.isTraceEnabled()) {
      log.trace("nativa.cypher.build clauses={} paramNames={} cypher={}", chain.size(), acc.params().keySet(), acc.cypher());
    }
    return acc;
  }

  // ---------- continuations shared by MATCH / WITH / ORDER BY / SKIP / LIMIT / UNWIND / CREATE ... ----------

  public MatchBuilder match(PatternElement... patterns) { return new MatchClause(this, false, patterns(patterns, "MATCH"), null); }
  public MatchBuilder optionalMatch(PatternElement... patterns) { return new MatchClause(this, true, patterns(patterns, "OPTIONAL MATCH"), null); }
  public CreateBuilder create(PatternElement... patterns) { return new CreateClause(this, patterns(patterns, "CREATE")); }

  public MergeBuilder merge(PatternElement pattern) {
    return new MergeClause(this, CypherConstructionException.requirePresent(pattern, "MERGE", "pattern"), List.of(), List.of());
  }

  public WithBuilder with(Expression... items) { return new WithClause(this, false, items(items, "WITH")); }
  public WithBuilder withDistinct(Expression... items) { return new WithClause(this, true, items(items, "WITH")); }
  public ReturnBuilder returning(Expression... items) { return new ReturnClause(this, false, items(items, "RETURN")); }
  public ReturnBuilder returningDistinct(Expression... items) { return new ReturnClause(this, true, items(items, "RETURN")); }
  public SetBuilder set(Expression... items) { return new SetClause(this, items(items, "SET")); }
  public RemoveBuilder remove(Expression... items) { return new RemoveClause(this, items(items, "REMOVE")); }
  public DeleteBuilder delete(Expression... items) { return new DeleteClause(this, false, items(items, "DELETE")); }
  public DeleteBuilder detachDelete(Expression... items) { return new DeleteClause(this, true, items(items, "DETACH DELETE")); }
  public UnwindBuilder unwind(Expression list, String alias) { return new UnwindClause(this, list, alias); }

  // ---------- helpers ----------

  static List<PatternElement> patterns(PatternElement[] patterns, String clause) {
    if (patterns == null || patterns.length == 0) {
      throw new CypherConstructionException(clause, "at least one pattern is required");
    }
    for (PatternElement p : patterns) CypherConstructionException.requirePresent(p, clause, "pattern");
    return List.of(patterns);
  }

  static List<Expression> items(Expression[] items, String clause) {
    if (items == null || items.length == 0) {
      throw new CypherConstructionException(clause, "at least one item is required");
    }
    for (Expression e : items) CypherConstructionException.requirePresent(e, clause, "item");
    return List.of(items);
  }

  static List<Expression> concat(List<Expression> head, Expression[] more, String clause) {
    List<Expression> out = new ArrayList<>(head);
    out.addAll(items(more, clause));
    return out;
  }

  /** Full pattern text, comma separated; parameters inside the patterns are collected. */
  static String renderPatterns(List<? extends PatternElement> patterns, ParameterCollector params) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < patterns.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(ExpressionRenderer.render(patterns.get(i)));
      params.collect(patterns.get(i));
    }
    return sb.toString();
  }

  /** Projection/item text (aliased pattern elements collapse to their alias); parameters are collected. */
  static String renderItems(List<? extends Expression> items, ParameterCollector params) {
    params.collectAll(items);
    return ExpressionRenderer.join(items);
  }

  static long requireNonNegative(long n, String clause) {
    if (n < 0) throw new CypherConstructionException(clause, "count must be >= 0, was " + n);
    return n;
  }

  static CypherBuildException invalidItem(String clause, Expression item, String expected) {
    return new CypherBuildException(clause, "unsupported item " + item.render() + "; expected " + expected);
  }
}
