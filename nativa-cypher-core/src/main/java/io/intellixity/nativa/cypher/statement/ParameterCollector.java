package io.intellixity.nativa.cypher.statement;

import io.intellixity.nativa.cypher.expr.*;
import io.intellixity.nativa.cypher.pattern.*;

import java.util.*;

/**
 * Collects every {@link Parameter} reachable from an expression into a caller-supplied map.
 * <p>
 * Parameters are written when reached and never descended into. Containers are visited in their natural
 * order, binary nodes left then right. A later write to a name overwrites the earlier value without error.
 * Traversal uses an explicit work-list so tree depth is not bounded by the call stack.
 */
public final class ParameterCollector implements ExpressionVisitor<Void> {
  private final Map<String, Object> target;
  private final Deque<Expression> work = new ArrayDeque<>();

  public ParameterCollector(Map<String, Object> target) {
    this.target = Objects.requireNonNull(target, "target");
  }

  public Map<String, Object> collect(Expression root) {
    if (root == null) return target;
    work.push(root);
    while (!work.isEmpty()) {
      work.pop().accept(this);
    }
    return target;
  }

  public Map<String, Object> collectAll(Collection<? extends Expression> roots) {
    if (roots != null) {
      for (Expression e : roots) collect(e);
    }
    return target;
  }

  // Children are pushed in reverse so they pop in natural order.
  private void descend(Expression... children) {
    for (int i = children.length - 1; i >= 0; i--) {
      if (children[i] != null) work.push(children[i]);
    }
  }

  private void descend(List<? extends Expression> children) {
    for (int i = children.size() - 1; i >= 0; i--) {
      Expression c = children.get(i);
      if (c != null) work.push(c);
    }
  }

  @Override
  public Void visit(Parameter parameter) {
    target.put(parameter.name(), parameter.value());
    return null;
  }

  @Override public Void visit(Literal literal) { return null; }
  @Override public Void visit(Variable variable) { return null; }
  @Override public Void visit(RawCypher raw) { return null; }

  @Override
  public Void visit(PropertyExpression property) {
    descend(property.subject());
    return null;
  }

  @Override
  public Void visit(Comparison comparison) {
    descend(comparison.left(), comparison.right());
    return null;
  }

  @Override
  public Void visit(StringOperation operation) {
    descend(operation.left(), operation.right());
    return null;
  }

  @Override
  public Void visit(Arithmetic arithmetic) {
    descend(arithmetic.left(), arithmetic.right());
    return null;
  }

  @Override
  public Void visit(NullCheck nullCheck) {
    descend(nullCheck.expression());
    return null;
  }

  @Override
  public Void visit(Logical logical) {
    descend(logical.left(), logical.right());
    return null;
  }

  @Override
  public Void visit(Not not) {
    descend(not.expression());
    return null;
  }

  @Override
  public Void visit(FunctionCall function) {
    descend(function.arguments());
    return null;
  }

  @Override
  public Void visit(Distinct distinct) {
    descend(distinct.expression());
    return null;
  }

  @Override
  public Void visit(AliasedExpression aliased) {
    descend(aliased.expression());
    return null;
  }

  @Override
  public Void visit(SortItem sortItem) {
    descend(sortItem.expression());
    return null;
  }

  @Override
  public Void visit(ListExpression list) {
    descend(list.elements());
    return null;
  }

  @Override
  public Void visit(MapExpression map) {
    descend(new ArrayList<>(map.entries().values()));
    return null;
  }

  @Override
  public Void visit(Assignment assignment) {
    descend(assignment.target(), assignment.value());
    return null;
  }

  @Override
  public Void visit(LabelOperation labels) {
    descend(labels.subject());
    return null;
  }

  @Override
  public Void visit(NodePattern node) {
    descend(new ArrayList<>(node.properties().values()));
    return null;
  }

  @Override
  public Void visit(RelationshipPattern relationship) {
    List<Expression> children = new ArrayList<>();
    children.add(relationship.start());
    children.addAll(relationship.properties().values());
    children.add(relationship.end());
    descend(children);
    return null;
  }

  @Override
  public Void visit(PatternPath path) {
    descend(path.elements());
    return null;
  }
}
