package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class LiteralRenderingTest {
  @Test
  void stringsAreSingleQuotedWithEscapedQuotes() {
    assertEquals("'Tom Hanks'", Literal.of("Tom Hanks").render());
    assertEquals("'O\\'Reilly'", Literal.of("O'Reilly").render());
    assertEquals("''", Literal.of("").render());
  }

  @Test
  void backslashIsEscapedSoAQuoteCannotBeReopened() {
    assertEquals("'a\\\\b'", Literal.of("a\\b").render());
    assertEquals("'x\\\\\\' OR 1=1'", Literal.of("x\\' OR 1=1").render());
  }

  @Test
  void integersArePlainDecimal() {
    assertEquals("42", Literal.of(42).render());
    assertEquals("-7", Literal.of(-7L).render());
    assertEquals("12345678901234567890", Literal.of(new BigInteger("12345678901234567890")).render());
  }

  @Test
  void floatsUseShortestFormWithoutForcedFraction() {
    assertEquals("3.14", Literal.of(3.14).render());
    assertEquals("1", Literal.of(1.0).render());
    assertEquals("1.5", Literal.of(1.5f).render());
    assertEquals("10000000000", Literal.of(1.0E10).render());
    assertEquals("10.5", Literal.of(new BigDecimal("10.500")).render());
    assertEquals("0", Literal.of(0.0).render());
  }

  @Test
  void booleansAndNull() {
    assertEquals("true", Literal.of(true).render());
    assertEquals("false", Literal.of(Boolean.FALSE).render());
    assertEquals("NULL", Literal.of(null).render());
    assertTrue(Literal.nullValue().isNull());
  }

  @Test
  void collectionsAndMapsAreCoercedElementWise() {
    assertEquals("[1, 'a', true]", Expressions.valueOf(List.of(1, "a", true)).render());
    assertEquals("[]", Expressions.valueOf(List.of()).render());

    Map<String, Object> m = new LinkedHashMap<>();
    m.put("name", "Keanu");
    m.put("born", 1964);
    m.put("roles", List.of("Neo"));
    assertEquals("{name: 'Keanu', born: 1964, roles: ['Neo']}", Expressions.valueOf(m).render());
  }

  @Test
  void mapKeysThatAreNotIdentifiersAreQuoted() {
    assertEquals("{`first name`: 'x'}", Expressions.valueOf(Map.of("first name", "x")).render());
  }

  @Test
  void expressionsPassThroughCoercion() {
    Parameter p = Expressions.namedParam("x", 1);
    assertSame(p, Expressions.valueOf(p));
    assertEquals("[$x, 2]", Expressions.list(p, 2).render());
  }

  @Test
  void nonFiniteNumbersHaveNoLiteral() {
    assertThrows(CypherConstructionException.class, () -> Literal.of(Double.NaN));
    assertThrows(CypherConstructionException.class, () -> Literal.of(Float.POSITIVE_INFINITY));
  }
}
