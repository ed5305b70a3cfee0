package io.intellixity.nativa.cypher.validation;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags {@code n.My Property}: a property access followed by a bare word that is not a keyword, which is
 * usually a property name with a space that should have been backtick-quoted.
 */
public final class UnquotedPropertyRule implements ValidationRule {
  public static final String ID = "UNQUOTED_PROPERTY";

  private static final Pattern ACCESS = Pattern.compile("(?<![\\w.$])[a-zA-Z0-9_]+\\.[a-zA-Z0-9_]+\\s+([a-zA-Z0-9_]+)");

  private static final Set<String> FOLLOWERS = Set.of(
      "AS", "AND", "OR", "XOR", "NOT", "IS", "IN", "STARTS", "ENDS", "CONTAINS",
      "ASC", "ASCENDING", "DESC", "DESCENDING", "RETURN", "WITH", "WHERE", "ORDER", "BY", "SKIP", "LIMIT",
      "SET", "DELETE", "DETACH", "REMOVE", "CREATE", "MERGE", "MATCH", "OPTIONAL", "UNWIND", "ON", "CALL",
      "YIELD", "UNION", "DISTINCT", "CASE", "WHEN", "THEN", "ELSE", "END", "FOREACH");

  @Override public String id() { return ID; }
  @Override public String description() { return "Property access looks incorrect (missing backticks)"; }
  @Override public ValidationLevel level() { return ValidationLevel.STRICT; }

  @Override
  public ValidationError check(String cypher, String masked) {
    Matcher m = ACCESS.matcher(masked);
    while (m.find()) {
      if (!FOLLOWERS.contains(m.group(1).toUpperCase(Locale.ROOT))) {
        return new ValidationError(ID, "potential unquoted property with spaces: " + cypher.substring(m.start(), m.end()));
      }
    }
    return null;
  }
}
