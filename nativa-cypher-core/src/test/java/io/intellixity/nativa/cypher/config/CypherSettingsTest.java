package io.intellixity.nativa.cypher.config;

import io.intellixity.nativa.cypher.render.KeywordCase;
import io.intellixity.nativa.cypher.safety.SafetyLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class CypherSettingsTest {
  private static final ClassLoader EMPTY = new URLClassLoader(new URL[0], null);

  @Test
  void defaults() {
    CypherSettings s = CypherSettings.load(EMPTY, Map.of(), new Properties());
    assertEquals(SafetyLevel.WARN, s.safetyLevel());
    assertEquals("param", s.parameterPrefix());
    assertEquals(KeywordCase.AS_IS, s.formatting().keywordCase());
    assertFalse(s.formatting().clauseNewline());
  }

  @Test
  void environmentVariablesUseUpperSnakeCase() {
    assertEquals("NATIVA_CYPHER_FORMAT_KEYWORD_CASE", CypherSettings.envName(CypherSettings.FORMAT_KEYWORD_CASE));

    CypherSettings s = CypherSettings.load(EMPTY,
        Map.of("NATIVA_CYPHER_SAFETY_LEVEL", "strict", "NATIVA_CYPHER_FORMAT_KEYWORD_CASE", "lower"), new Properties());
    assertEquals(SafetyLevel.STRICT, s.safetyLevel());
    assertEquals(KeywordCase.LOWER, s.formatting().keywordCase());
  }

  @Test
  void systemPropertiesWinOverEnvironment() {
    Properties sys = new Properties();
    sys.setProperty(CypherSettings.SAFETY_LEVEL, "OFF");
    CypherSettings s = CypherSettings.load(EMPTY, Map.of("NATIVA_CYPHER_SAFETY_LEVEL", "STRICT"), sys);
    assertEquals(SafetyLevel.OFF, s.safetyLevel());
  }

  @Test
  void classpathResourceIsTheLowestSource(@TempDir Path dir) throws Exception {
    Files.writeString(dir.resolve(CypherSettings.RESOURCE), String.join("\n",
        CypherSettings.PARAMETER_PREFIX + "=arg",
        CypherSettings.FORMAT_CLAUSE_NEWLINE + "=true",
        CypherSettings.FORMAT_INDENT_SUB_CLAUSES + "=true",
        CypherSettings.SAFETY_LEVEL + "=strict"));

    try (URLClassLoader cl = new URLClassLoader(new URL[] {dir.toUri().toURL()}, null)) {
      CypherSettings s = CypherSettings.load(cl, Map.of("NATIVA_CYPHER_SAFETY_LEVEL", "warn"), new Properties());
      assertEquals("arg", s.parameterPrefix());
      assertTrue(s.formatting().clauseNewline());
      assertTrue(s.formatting().indentSubClauses());
      assertEquals(SafetyLevel.WARN, s.safetyLevel());
    }
  }

  @Test
  void invalidValuesNameTheKey() {
    Properties p = new Properties();
    p.setProperty(CypherSettings.SAFETY_LEVEL, "loud");
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> CypherSettings.fromProperties(p));
    assertTrue(ex.getMessage().contains(CypherSettings.SAFETY_LEVEL));
  }
}
