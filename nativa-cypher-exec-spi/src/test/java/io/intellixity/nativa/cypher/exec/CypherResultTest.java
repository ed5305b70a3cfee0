package io.intellixity.nativa.cypher.exec;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class CypherResultTest {

  private static Map<String, Object> row(String name, Object born) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("name", name);
    m.put("born", born);
    return m;
  }

  @Test
  void singleReturnsOnlyRecordOrNull() {
    assertNull(CypherResult.empty().single());
    CypherResult one = new CypherResult(List.of(row("Tom", 1956)), null);
    assertEquals("Tom", one.single().get("name"));

    CypherResult two = new CypherResult(List.of(row("Tom", 1956), row("Meg", 1961)), null);
    assertThrows(IllegalStateException.class, two::single);
  }

  @Test
  void valuesAndToMapCollectInOrder() {
    CypherResult r = new CypherResult(List.of(row("Tom", 1956), row("Meg", 1961), row(null, 1970)), null);

    assertEquals(Arrays.asList("Tom", "Meg", null), r.values("name"));
    assertEquals(List.of(), r.values("missing"));
    assertEquals(List.of("Tom", "Meg"), new ArrayList<>(r.toMap("name", "born").keySet()));
    assertEquals(1961, r.toMap("name", "born").get("Meg"));
    assertEquals(3, r.size());
  }

  @Test
  void countersDefaultToZero() {
    CypherResult r = new CypherResult(List.of(), Map.of("nodesCreated", 2));
    assertEquals(2L, r.counter("nodesCreated"));
    assertEquals(0L, r.counter("relationshipsCreated"));
  }

  @Test
  void recordsAreImmutableCopies() {
    List<Map<String, Object>> src = new ArrayList<>();
    src.add(row("Tom", 1956));
    CypherResult r = new CypherResult(src, null);
    src.clear();

    assertEquals(1, r.size());
    assertThrows(UnsupportedOperationException.class, () -> r.records().get(0).put("x", 1));
  }
}
