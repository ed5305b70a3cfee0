package io.intellixity.nativa.cypher.statement;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Built Cypher text plus its parameter table: the artifact handed to an execution layer.
 * <p>
 * Parameters keep insertion order and may hold null values.
 */
@JsonSerialize(using = StatementJsonSerializer.class)
@JsonDeserialize(using = StatementJsonDeserializer.class)
public record Statement(String cypher, Map<String, Object> params) {
  private static final Statement EMPTY = new Statement("", Map.of());

  public Statement {
    cypher = (cypher == null) ? "" : cypher;
    params = (params == null || params.isEmpty())
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  public static Statement empty() { return EMPTY; }

  public static Statement of(String cypher) { return new Statement(cypher, Map.of()); }

  public static Statement of(String cypher, Map<String, Object> params) { return new Statement(cypher, params); }

  public boolean isEmpty() { return cypher.isEmpty(); }

  /**
   * Space-joined text (an empty side contributes nothing) and the union of both parameter tables,
   * {@code other} winning on a shared name.
   */
  public Statement merge(Statement other) {
    if (other == null) return this;
    String text;
    if (cypher.isEmpty()) text = other.cypher;
    else if (other.cypher.isEmpty()) text = cypher;
    else text = cypher + " " + other.cypher;

    Map<String, Object> merged = new LinkedHashMap<>(params);
    merged.putAll(other.params);
    return new Statement(text, merged);
  }
}
