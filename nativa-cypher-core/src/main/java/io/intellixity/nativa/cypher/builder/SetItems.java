package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.*;
import io.intellixity.nativa.cypher.pattern.PatternElement;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

import java.util.List;

/** Item checks shared by SET, ON CREATE SET, ON MATCH SET, REMOVE and DELETE. */
final class SetItems {
  private SetItems() {}

  static String set(String clause, List<Expression> items, ParameterCollector params) {
    for (Expression e : items) {
      boolean ok = e instanceof Assignment || e instanceof LabelOperation || e instanceof RawCypher
          || (e instanceof Comparison c && c.operator() == Comparison.Operator.EQ);
      if (!ok) throw AbstractClause.invalidItem(clause, e, "an assignment or label item");
    }
    return AbstractClause.renderItems(items, params);
  }

  static String remove(String clause, List<Expression> items, ParameterCollector params) {
    for (Expression e : items) {
      boolean ok = e instanceof PropertyExpression || e instanceof LabelOperation || e instanceof RawCypher;
      if (!ok) throw AbstractClause.invalidItem(clause, e, "a property or label item");
    }
    return AbstractClause.renderItems(items, params);
  }

  static String delete(String clause, List<Expression> items, ParameterCollector params) {
    for (Expression e : items) {
      boolean ok = e instanceof Variable || e instanceof RawCypher
          || (e instanceof PatternElement pe && pe.hasAlias());
      if (!ok) throw AbstractClause.invalidItem(clause, e, "a variable or an aliased pattern element");
    }
    return AbstractClause.renderItems(items, params);
  }
}
