package io.intellixity.nativa.cypher.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class StatementTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void mergeJoinsTextWithASpaceAndLetsTheRightSideWin() {
    Statement left = Statement.of("MATCH (n)", Map.of("a", 1));
    Statement right = Statement.of("RETURN n", Map.of("a", 2, "b", 3));

    Statement merged = left.merge(right);
    assertEquals("MATCH (n) RETURN n", merged.cypher());
    assertEquals(Map.of("a", 2, "b", 3), merged.params());
  }

  @Test
  void mergeSkipsEmptyText() {
    Statement s = Statement.of("RETURN 1", Map.of("x", 1));
    assertEquals("RETURN 1", Statement.empty().merge(s).cypher());
    assertEquals("RETURN 1", s.merge(Statement.empty()).cypher());
    assertEquals("RETURN 1", s.merge(Statement.of("", Map.of("y", 2))).cypher());
    assertEquals(Map.of("x", 1, "y", 2), s.merge(Statement.of("", Map.of("y", 2))).params());
  }

  @Test
  void paramsKeepInsertionOrderAndAllowNull() {
    Map<String, Object> ps = new LinkedHashMap<>();
    ps.put("z", 1);
    ps.put("a", null);
    Statement s = Statement.of("RETURN $z, $a", ps);
    assertEquals(List.of("z", "a"), new ArrayList<>(s.params().keySet()));
    assertTrue(s.params().containsKey("a"));
    ps.put("late", 2);
    assertFalse(s.params().containsKey("late"));
  }

  @Test
  void nullTextBecomesEmpty() {
    assertTrue(new Statement(null, null).isEmpty());
    assertEquals(Map.of(), new Statement(null, null).params());
  }

  @Test
  void jsonRoundTrip() throws Exception {
    Map<String, Object> ps = new LinkedHashMap<>();
    ps.put("name", "Tom Hanks");
    ps.put("ids", List.of(1, 2));
    Statement s = Statement.of("MATCH (p) WHERE p.name = $name RETURN p", ps);

    String json = mapper.writeValueAsString(s);
    assertEquals("{\"cypher\":\"MATCH (p) WHERE p.name = $name RETURN p\",\"params\":{\"name\":\"Tom Hanks\",\"ids\":[1,2]}}", json);
    assertEquals(s, mapper.readValue(json, Statement.class));
  }

  @Test
  void jsonAcceptsQueryAsTextFieldAndMissingParams() throws Exception {
    Statement s = mapper.readValue("{\"query\":\"RETURN 1\"}", Statement.class);
    assertEquals("RETURN 1", s.cypher());
    assertTrue(s.params().isEmpty());
  }

  @Test
  void jsonRejectsNonObjects() {
    assertThrows(Exception.class, () -> mapper.readValue("[1,2]", Statement.class));
  }
}
