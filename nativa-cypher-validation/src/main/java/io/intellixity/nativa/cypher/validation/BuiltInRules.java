package io.intellixity.nativa.cypher.validation;

import java.util.List;

/** Rules every validator starts with. */
public final class BuiltInRules {
  public static final String UNMATCHED_PARENTHESES = "UNMATCHED_PARENTHESES";
  public static final String UNMATCHED_BRACKETS = "UNMATCHED_BRACKETS";
  public static final String UNMATCHED_BRACES = "UNMATCHED_BRACES";

  private BuiltInRules() {}

  public static List<ValidationRule> all() {
    return List.of(
        new BalancedDelimiterRule(UNMATCHED_PARENTHESES, '(', ')', "parenthesis", "parentheses"),
        new BalancedDelimiterRule(UNMATCHED_BRACKETS, '[', ']', "bracket", "brackets"),
        new BalancedDelimiterRule(UNMATCHED_BRACES, '{', '}', "brace", "braces"),
        new UnquotedPropertyRule(),
        new RelationshipDirectionRule()
    );
  }
}
