package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.pattern.NodePattern;
import io.intellixity.nativa.cypher.pattern.PatternPath;
import io.intellixity.nativa.cypher.pattern.RelationshipPattern;

public interface ExpressionVisitor<R> {
  R visit(Literal literal);
  R visit(Parameter parameter);
  R visit(Variable variable);
  R visit(PropertyExpression property);
  R visit(Comparison comparison);
  R visit(StringOperation operation);
  R visit(NullCheck nullCheck);
  R visit(Logical logical);
  R visit(Not not);
  R visit(FunctionCall function);
  R visit(Distinct distinct);
  R visit(AliasedExpression aliased);
  R visit(SortItem sortItem);
  R visit(ListExpression list);
  R visit(MapExpression map);
  R visit(RawCypher raw);
  R visit(Arithmetic arithmetic);
  R visit(Assignment assignment);
  R visit(LabelOperation labels);
  R visit(NodePattern node);
  R visit(RelationshipPattern relationship);
  R visit(PatternPath path);
}
