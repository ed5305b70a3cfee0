package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.pattern.PatternElement;

import java.util.List;

/**
 * Entry point of the clause-builder chain.
 *
 * <pre>
 * NodePattern p = Patterns.node("Person").named("p");
 * Statement s = Cypher.match(p)
 *     .where(p.property("name").eq(Expressions.namedParam("name", "Tom Hanks")))
 *     .returning(p)
 *     .build();
 * // MATCH (p:`Person`) WHERE p.name = $name RETURN p
 * </pre>
 *
 * The methods available after each call are exactly the clauses Cypher allows there; builders are immutable
 * and may be shared and continued independently.
 */
public final class Cypher {
  private Cypher() {}

  public static MatchBuilder match(PatternElement... patterns) {
    return new MatchClause(null, false, AbstractClause.patterns(patterns, "MATCH"), null);
  }

  public static MatchBuilder optionalMatch(PatternElement... patterns) {
    return new MatchClause(null, true, AbstractClause.patterns(patterns, "OPTIONAL MATCH"), null);
  }

  public static CreateBuilder create(PatternElement... patterns) {
    return new CreateClause(null, AbstractClause.patterns(patterns, "CREATE"));
  }

  public static MergeBuilder merge(PatternElement pattern) {
    return new MergeClause(null, CypherConstructionException.requirePresent(pattern, "MERGE", "pattern"),
        List.of(), List.of());
  }

  public static WithBuilder with(Expression... items) {
    return new WithClause(null, false, AbstractClause.items(items, "WITH"));
  }

  public static WithBuilder withDistinct(Expression... items) {
    return new WithClause(null, true, AbstractClause.items(items, "WITH"));
  }

  public static ReturnBuilder returning(Expression... items) {
    return new ReturnClause(null, false, AbstractClause.items(items, "RETURN"));
  }

  public static ReturnBuilder returningDistinct(Expression... items) {
    return new ReturnClause(null, true, AbstractClause.items(items, "RETURN"));
  }

  public static UnwindBuilder unwind(Expression list, String alias) {
    return new UnwindClause(null, list, alias);
  }

  public static SetBuilder set(Expression... items) {
    return new SetClause(null, AbstractClause.items(items, "SET"));
  }

  public static RemoveBuilder remove(Expression... items) {
    return new RemoveClause(null, AbstractClause.items(items, "REMOVE"));
  }

  public static DeleteBuilder delete(Expression... items) {
    return new DeleteClause(null, false, AbstractClause.items(items, "DELETE"));
  }

  public static DeleteBuilder detachDelete(Expression... items) {
    return new DeleteClause(null, true, AbstractClause.items(items, "DETACH DELETE"));
  }

  /** Standalone {@code ORDER BY}, for appending to text built elsewhere. */
  public static OrderByBuilder orderBy(Expression... keys) {
    return new OrderByClause(null, OrderByClause.sortItems(keys));
  }

  public static SkipBuilder skip(long count) {
    return new SkipClause(null, count);
  }

  public static LimitBuilder limit(long count) {
    return new LimitClause(null, count);
  }
}
