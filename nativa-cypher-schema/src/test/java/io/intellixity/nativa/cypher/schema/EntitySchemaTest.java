package io.intellixity.nativa.cypher.schema;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.builder.Cypher;
import io.intellixity.nativa.cypher.expr.Expressions;
import io.intellixity.nativa.cypher.pattern.NodePattern;
import io.intellixity.nativa.cypher.statement.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class EntitySchemaTest {
  private final EntitySchema person = EntitySchema.of("Person").withLabels("Actor").withProperties("name", "born");

  @Test
  void nodesCarryAllLabels() {
    assertEquals(List.of("Person", "Actor"), person.labels());
    assertEquals("(p:`Person`:`Actor`)", person.node("p").render());
    assertEquals("(:`Person`:`Actor`)", person.node().render());
  }

  @Test
  void propertiesResolveThroughTheNodeAlias() {
    NodePattern p = person.node("p");
    assertEquals("p.name", person.property("name").of(p).render());
    assertEquals("n.name", person.property("name").of(person.node()).render());
  }

  @Test
  void unknownPropertiesFail() {
    assertThrows(CypherConstructionException.class, () -> person.property("nmae"));
    assertFalse(person.hasProperty("nmae"));
    assertThrows(CypherConstructionException.class, () -> person.index("idx", "name", "nmae"));
  }

  @Test
  void typedPropertiesWorkInsideTheBuilder() {
    NodePattern p = person.node("p");
    Statement s = Cypher.match(p)
        .where(person.property("born").of(p).gt(Expressions.namedParam("born", 1960)))
        .returning(person.property("name").of(p))
        .build();
    assertEquals("MATCH (p:`Person`:`Actor`) WHERE p.born > $born RETURN p.name", s.cypher());
    assertEquals(Map.of("born", 1960), s.params());
  }

  @Test
  void schemaDdlFromDeclaredProperties() {
    assertEquals("CREATE INDEX person_name IF NOT EXISTS FOR (n:Person) ON (n.name)", person.index("person_name", "name").cypher());
    assertEquals("CREATE CONSTRAINT person_name_unique IF NOT EXISTS FOR (n:Person) REQUIRE n.name IS UNIQUE",
        person.uniqueConstraint("person_name_unique", "name").cypher());
    assertEquals("CREATE CONSTRAINT person_key IF NOT EXISTS FOR (n:Person) REQUIRE (n.name, n.born) IS NODE KEY",
        person.nodeKeyConstraint("person_key", "name", "born").cypher());
  }

  @Test
  void schemasAreImmutable() {
    EntitySchema base = EntitySchema.of("Movie");
    EntitySchema withTitle = base.withProperties("title");
    assertFalse(base.hasProperty("title"));
    assertTrue(withTitle.hasProperty("title"));
    assertThrows(UnsupportedOperationException.class, () -> withTitle.properties().clear());
  }
}
