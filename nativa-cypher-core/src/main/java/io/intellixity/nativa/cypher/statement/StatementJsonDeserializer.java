package io.intellixity.nativa.cypher.statement;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/**
 * Reads the form written by {@link StatementJsonSerializer}. {@code "query"} is accepted as an alias of
 * {@code "cypher"}; a missing params object means no parameters.
 */
public final class StatementJsonDeserializer extends JsonDeserializer<Statement> {
  @Override
  public Statement deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Statement JSON must be an object");

    JsonNode text = root.has("cypher") ? root.get("cypher") : root.get("query");
    if (text == null || !text.isTextual()) {
      throw new IllegalArgumentException("Statement JSON requires a textual 'cypher' field");
    }

    Map<String, Object> params = Map.of();
    JsonNode ps = root.get("params");
    if (ps != null && !ps.isNull()) {
      if (!ps.isObject()) throw new IllegalArgumentException("Statement 'params' must be an object");
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(ps, LinkedHashMap.class);
      params = m;
    }
    return new Statement(text.asText(), params);
  }
}
