package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.expr.Expressions;
import io.intellixity.nativa.cypher.pattern.PatternElement;
import io.intellixity.nativa.cypher.render.ExpressionRenderer;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

import java.util.List;

final class MatchClause extends AbstractClause implements MatchBuilder {
  private final boolean optional;
  private final List<PatternElement> patterns;
  private final Expression condition;

  MatchClause(AbstractClause previous, boolean optional, List<PatternElement> patterns, Expression condition) {
    super(previous);
    this.optional = optional;
    this.patterns = List.copyOf(patterns);
    this.condition = condition;
  }

  @Override
  String clause() { return optional ? "OPTIONAL MATCH" : "MATCH"; }

  @Override
  public MatchBuilder where(Expression c) {
    CypherConstructionException.requirePresent(c, "WHERE", "condition");
    Expression combined = (condition == null) ? c : Expressions.and(condition, c);
    return new MatchClause(previous(), optional, patterns, combined);
  }

  @Override
  String cypher(ParameterCollector params) {
    StringBuilder sb = new StringBuilder(clause()).append(' ').append(renderPatterns(patterns, params));
    if (condition != null) {
      sb.append(" WHERE ").append(ExpressionRenderer.reference(condition));
      params.collect(condition);
    }
    return sb.toString();
  }
}
