package io.intellixity.nativa.cypher.safety;

import io.intellixity.nativa.cypher.UnsafeLiteralException;
import io.intellixity.nativa.cypher.config.CypherSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Flags string literals that contain Cypher structure characters ({@code '"();{}[]}).
 * <p>
 * Such values are escaped correctly, but they usually come from user input that should have been passed as
 * a parameter. The process-wide level comes from {@link CypherSettings}.
 */
public final class LiteralSafety {
  private static final Logger log = LoggerFactory.getLogger(LiteralSafety.class);
  private static final String SUSPICIOUS = "'\"();{}[]";

  private static volatile LiteralSafety defaults;

  private final SafetyLevel level;

  private LiteralSafety(SafetyLevel level) {
    this.level = Objects.requireNonNull(level, "level");
  }

  public static LiteralSafety of(SafetyLevel level) {
    return new LiteralSafety(level);
  }

  /** Instance for the configured level; resolved once per process. */
  public static LiteralSafety defaults() {
    LiteralSafety d = defaults;
    if (d == null) {
      synchronized (LiteralSafety.class) {
        d = defaults;
        if (d == null) {
          d = new LiteralSafety(CypherSettings.current().safetyLevel());
          defaults = d;
        }
      }
    }
    return d;
  }

  public SafetyLevel level() { return level; }

  public void check(String value) {
    if (level == SafetyLevel.OFF || value == null) return;
    int idx = firstSuspicious(value);
    if (idx < 0) return;

    char c = value.charAt(idx);
    if (level == SafetyLevel.STRICT) {
      throw new UnsafeLiteralException("string literal contains '" + c + "' at index " + idx + "; pass it as a parameter instead");
    }
    // Value itself is not logged: it is likely user input.
    log.warn("nativa.cypher.unsafe_literal char={} index={} length={} hint=use Expressions.safe(..) or a named parameter",
        c, idx, value.length());
  }

  public static boolean isSuspicious(String value) {
    return value != null && firstSuspicious(value) >= 0;
  }

  private static int firstSuspicious(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (SUSPICIOUS.indexOf(value.charAt(i)) >= 0) return i;
    }
    return -1;
  }
}
