package io.intellixity.nativa.cypher.validation;

import io.intellixity.nativa.cypher.CypherException;
import io.intellixity.nativa.cypher.builder.Cypher;
import io.intellixity.nativa.cypher.expr.Expressions;
import io.intellixity.nativa.cypher.pattern.NodePattern;
import io.intellixity.nativa.cypher.pattern.Patterns;
import io.intellixity.nativa.cypher.statement.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CypherValidatorTest {
  private final CypherValidator basic = new CypherValidator(BuiltInRules.all(), ValidationLevel.BASIC);
  private final CypherValidator strict = basic.withLevel(ValidationLevel.STRICT);

  private static List<String> ids(List<ValidationError> errors) {
    return errors.stream().map(ValidationError::rule).toList();
  }

  @Test
  void builtStatementsPass() {
    NodePattern p = Patterns.node("Person").named("p");
    NodePattern m = Patterns.node("Movie").named("m");
    Statement s = Cypher.match(p.relationshipTo(m, "ACTED_IN"))
        .where(p.property("name").eq(Expressions.namedParam("name", "Tom Hanks")))
        .returning(m.property("title"))
        .orderBy(m.property("released").desc())
        .limit(10)
        .build();
    assertEquals(List.of(), strict.validate(s));
  }

  @Test
  void unbalancedDelimiters() {
    assertEquals(List.of(BuiltInRules.UNMATCHED_PARENTHESES), ids(basic.validate("MATCH (n RETURN n")));
    assertEquals(List.of(BuiltInRules.UNMATCHED_BRACKETS), ids(basic.validate("MATCH (a)-[r->(b) RETURN a")));
    assertEquals(List.of(BuiltInRules.UNMATCHED_BRACES), ids(basic.validate("CREATE (n {name: 'x'}}) RETURN n")));
  }

  @Test
  void messagesCountMissingDelimiters() {
    List<ValidationError> errors = basic.validate("RETURN ((1");
    assertEquals("missing 2 closing parentheses", errors.get(0).message());
    assertTrue(basic.validate("RETURN 1)").get(0).message().startsWith("unmatched closing parenthesis"));
  }

  @Test
  void quotedTextIsIgnored() {
    assertTrue(basic.isValid("RETURN 'a ( smiley :)' AS s, `odd ] name` AS t"));
    assertTrue(basic.isValid("RETURN 'it\\'s (' AS s"));
  }

  @Test
  void strictFlagsUnquotedPropertiesWithSpaces() {
    String cypher = "MATCH (n) WHERE n.My Property = 1 RETURN n";
    assertTrue(basic.isValid(cypher));
    List<ValidationError> errors = strict.validate(cypher);
    assertEquals(List.of(UnquotedPropertyRule.ID), ids(errors));
    assertTrue(errors.get(0).message().contains("n.My Property"));
  }

  @Test
  void keywordsAfterAPropertyAreFine() {
    assertTrue(strict.isValid("MATCH (n) WHERE n.name STARTS WITH 'T' AND n.age IS NOT NULL RETURN n.name AS name ORDER BY n.age DESC"));
  }

  @Test
  void strictFlagsUndirectedRelationshipsInMatch() {
    assertEquals(List.of(RelationshipDirectionRule.ID), ids(strict.validate("MATCH (a)-[r:KNOWS]-(b) RETURN a")));
    assertTrue(strict.isValid("MATCH (a)-[r:KNOWS]->(b) RETURN a"));
    assertTrue(strict.isValid("CREATE (a)-[:KNOWS]-(b)"));
  }

  @Test
  void offChecksNothing() {
    assertTrue(basic.withLevel(ValidationLevel.OFF).isValid("MATCH (n"));
    assertTrue(basic.isValid(""));
  }

  @Test
  void requireValidThrowsWithEveryError() {
    Statement bad = Statement.of("MATCH (n {x: [1 RETURN n");
    CypherValidationException ex = assertThrows(CypherValidationException.class, () -> basic.requireValid(bad));
    assertEquals(CypherException.Kind.VALIDATION, ex.kind());
    assertEquals(3, ex.errors().size());
    assertTrue(ex.getMessage().contains(BuiltInRules.UNMATCHED_BRACKETS));

    Statement good = Statement.of("RETURN 1");
    assertSame(good, basic.requireValid(good));
  }

  @Test
  void rulesDiscoveredFromFactoriesFileRun() {
    CypherValidator v = CypherValidator.defaults();
    assertTrue(v.rules().stream().anyMatch(r -> r.id().equals("NO_APOC")));
    assertEquals(List.of("NO_APOC"), ids(v.validate("RETURN apoc.text.join(['a'], ',') AS s")));
    assertEquals(ValidationLevel.STRICT, CypherValidator.strict().level());
  }

  @Test
  void customRulesAppendInOrder() {
    CypherValidator v = basic.withRule(new NoApocRule());
    assertEquals(List.of(BuiltInRules.UNMATCHED_PARENTHESES, "NO_APOC"), ids(v.validate("RETURN apoc.x((1)")));
  }

  @Test
  void levelsIncludeLowerOnes() {
    assertTrue(ValidationLevel.STRICT.includes(ValidationLevel.BASIC));
    assertFalse(ValidationLevel.BASIC.includes(ValidationLevel.STRICT));
    assertFalse(ValidationLevel.OFF.includes(ValidationLevel.BASIC));
  }
}
