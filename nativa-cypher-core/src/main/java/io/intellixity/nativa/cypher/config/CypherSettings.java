package io.intellixity.nativa.cypher.config;

import io.intellixity.nativa.cypher.render.FormattingOptions;
import io.intellixity.nativa.cypher.render.KeywordCase;
import io.intellixity.nativa.cypher.safety.SafetyLevel;
import io.intellixity.nativa.cypher.statement.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Process-wide settings.
 * <p>
 * Sources, later ones winning: every {@code nativa-cypher.properties} resource on the classpath, environment
 * variables (key upper-cased, {@code .} and {@code -} replaced by {@code _}, e.g.
 * {@code NATIVA_CYPHER_SAFETY_LEVEL}), then system properties.
 */
public record CypherSettings(SafetyLevel safetyLevel, String parameterPrefix, FormattingOptions formatting) {
  public static final String RESOURCE = "nativa-cypher.properties";

  public static final String SAFETY_LEVEL = "nativa.cypher.safety.level";
  public static final String PARAMETER_PREFIX = "nativa.cypher.parameter.prefix";
  public static final String FORMAT_INDENT = "nativa.cypher.format.indent";
  public static final String FORMAT_KEYWORD_CASE = "nativa.cypher.format.keyword-case";
  public static final String FORMAT_CLAUSE_NEWLINE = "nativa.cypher.format.clause-newline";
  public static final String FORMAT_INDENT_SUB_CLAUSES = "nativa.cypher.format.indent-sub-clauses";

  private static volatile CypherSettings current;

  public CypherSettings {
    safetyLevel = (safetyLevel == null) ? SafetyLevel.WARN : safetyLevel;
    parameterPrefix = (parameterPrefix == null || parameterPrefix.isBlank()) ? Parameters.DEFAULT_PREFIX : parameterPrefix;
    formatting = (formatting == null) ? FormattingOptions.defaults() : formatting;
  }

  public static CypherSettings defaults() {
    return new CypherSettings(SafetyLevel.WARN, Parameters.DEFAULT_PREFIX, FormattingOptions.defaults());
  }

  /** Settings loaded once from the default sources. */
  public static CypherSettings current() {
    CypherSettings c = current;
    if (c == null) {
      synchronized (CypherSettings.class) {
        c = current;
        if (c == null) {
          c = load();
          current = c;
        }
      }
    }
    return c;
  }

  public static CypherSettings load() {
    return load(Thread.currentThread().getContextClassLoader(), System.getenv(), System.getProperties());
  }

  public static CypherSettings load(ClassLoader cl, Map<String, String> env, Properties system) {
    if (cl == null) cl = CypherSettings.class.getClassLoader();
    Properties merged = new Properties();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      try (InputStream in = url.openStream()) {
        merged.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }
    }

    for (String key : List.of(SAFETY_LEVEL, PARAMETER_PREFIX, FORMAT_INDENT, FORMAT_KEYWORD_CASE,
        FORMAT_CLAUSE_NEWLINE, FORMAT_INDENT_SUB_CLAUSES)) {
      String fromEnv = (env == null) ? null : env.get(envName(key));
      if (fromEnv != null) merged.setProperty(key, fromEnv);
      String fromSystem = (system == null) ? null : system.getProperty(key);
      if (fromSystem != null) merged.setProperty(key, fromSystem);
    }
    return fromProperties(merged);
  }

  public static CypherSettings fromProperties(Properties p) {
    FormattingOptions f = FormattingOptions.defaults();
    String indent = p.getProperty(FORMAT_INDENT);
    if (indent != null) f = f.withIndentString(indent);
    String kc = p.getProperty(FORMAT_KEYWORD_CASE);
    if (kc != null) f = f.withKeywordCase(parseEnum(KeywordCase.class, FORMAT_KEYWORD_CASE, kc));
    String nl = p.getProperty(FORMAT_CLAUSE_NEWLINE);
    if (nl != null) f = f.withClauseNewline(Boolean.parseBoolean(nl.trim()));
    String sub = p.getProperty(FORMAT_INDENT_SUB_CLAUSES);
    if (sub != null) f = f.withIndentSubClauses(Boolean.parseBoolean(sub.trim()));

    String level = p.getProperty(SAFETY_LEVEL);
    return new CypherSettings(
        level == null ? SafetyLevel.WARN : parseEnum(SafetyLevel.class, SAFETY_LEVEL, level),
        p.getProperty(PARAMETER_PREFIX),
        f
    );
  }

  static String envName(String key) {
    return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String raw) {
    try {
      return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid value '" + raw + "' for " + key
          + "; expected one of " + Arrays.toString(type.getEnumConstants()), e);
    }
  }
}
