package io.intellixity.nativa.cypher.statement;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Map;

/** Canonical JSON form of a {@link Statement}: {@code {"cypher": "...", "params": {...}}}. */
public final class StatementJsonSerializer extends JsonSerializer<Statement> {
  @Override
  public void serialize(Statement s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (s == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("cypher", s.cypher());
    g.writeObjectFieldStart("params");
    for (Map.Entry<String, Object> e : s.params().entrySet()) {
      g.writeFieldName(e.getKey());
      serializers.defaultSerializeValue(e.getValue(), g);
    }
    g.writeEndObject();
    g.writeEndObject();
  }
}
