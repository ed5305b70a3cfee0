package io.intellixity.nativa.cypher.exec;

import java.util.*;

/**
 * Records returned by one statement, in server order, plus its update counters
 * ({@code nodesCreated}, {@code propertiesSet}, ...; only non-zero counters are present).
 */
public record CypherResult(List<Map<String, Object>> records, Map<String, Object> counters) {
  private static final CypherResult EMPTY = new CypherResult(List.of(), Map.of());

  public CypherResult {
    List<Map<String, Object>> rs = new ArrayList<>();
    if (records != null) {
      for (Map<String, Object> r : records) {
        rs.add(r == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(r)));
      }
    }
    records = Collections.unmodifiableList(rs);
    counters = (counters == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(counters));
  }

  public static CypherResult empty() { return EMPTY; }

  public boolean isEmpty() { return records.isEmpty(); }

  public int size() { return records.size(); }

  /** The only record, or null when there is none; more than one record is an error. */
  public Map<String, Object> single() {
    if (records.isEmpty()) return null;
    if (records.size() > 1) {
      throw new IllegalStateException("Expected at most one record but got " + records.size());
    }
    return records.get(0);
  }

  /** {@code field} of the first record, or null when there are no records. */
  public Object value(String field) {
    return records.isEmpty() ? null : records.get(0).get(field);
  }

  /** {@code field} of every record that has it. */
  public List<Object> values(String field) {
    List<Object> out = new ArrayList<>(records.size());
    for (Map<String, Object> r : records) {
      if (r.containsKey(field)) out.add(r.get(field));
    }
    return out;
  }

  /** {@code keyField -> valueField} over all records; records whose key is not a string are skipped. */
  public Map<String, Object> toMap(String keyField, String valueField) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map<String, Object> r : records) {
      if (r.get(keyField) instanceof String k && r.containsKey(valueField)) out.put(k, r.get(valueField));
    }
    return out;
  }

  /** Counter value, 0 when absent. */
  public long counter(String name) {
    return (counters.get(name) instanceof Number n) ? n.longValue() : 0L;
  }
}
