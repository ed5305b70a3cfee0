package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.pattern.PatternElement;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

import java.util.List;

/** {@code MERGE p [ON CREATE SET ..] [ON MATCH SET ..]}. */
final class MergeClause extends AbstractClause implements MergeBuilder {
  private final PatternElement pattern;
  private final List<Expression> onCreate;
  private final List<Expression> onMatch;

  MergeClause(AbstractClause previous, PatternElement pattern, List<Expression> onCreate, List<Expression> onMatch) {
    super(previous);
    this.pattern = pattern;
    this.onCreate = List.copyOf(onCreate);
    this.onMatch = List.copyOf(onMatch);
  }

  @Override
  String clause() { return "MERGE"; }

  @Override
  public MergeBuilder onCreate(Expression... items) {
    return new MergeClause(previous(), pattern, concat(onCreate, items, "ON CREATE SET"), onMatch);
  }

  @Override
  public MergeBuilder onMatch(Expression... items) {
    return new MergeClause(previous(), pattern, onCreate, concat(onMatch, items, "ON MATCH SET"));
  }

  @Override
  String cypher(ParameterCollector params) {
    StringBuilder sb = new StringBuilder("MERGE ").append(renderPatterns(List.of(pattern), params));
    if (!onCreate.isEmpty()) sb.append(" ON CREATE SET ").append(SetItems.set("ON CREATE SET", onCreate, params));
    if (!onMatch.isEmpty()) sb.append(" ON MATCH SET ").append(SetItems.set("ON MATCH SET", onMatch, params));
    return sb.toString();
  }
}
