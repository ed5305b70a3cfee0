package io.intellixity.nativa.cypher.render;

/** Quoting rules for labels, relationship types, aliases and map keys. */
public final class Identifiers {
  private Identifiers() {}

  /** Labels and relationship types are always backtick-quoted; embedded backticks are doubled. */
  public static String quoted(String name) {
    return "`" + name.replace("`", "``") + "`";
  }

  /** Plain identifiers stay as-is, already quoted names are kept, anything else is quoted. */
  public static String quoteIfNeeded(String name) {
    if (isQuoted(name) || isPlain(name)) return name;
    return quoted(name);
  }

  public static boolean isPlain(String name) {
    if (name == null || name.isEmpty()) return false;
    if (Character.isDigit(name.charAt(0))) return false;
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!Character.isLetterOrDigit(c) && c != '_') return false;
    }
    return true;
  }

  private static boolean isQuoted(String name) {
    return name.length() >= 2 && name.startsWith("`") && name.endsWith("`");
  }
}
