package io.intellixity.nativa.cypher.render;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-level post-processor for built Cypher: whitespace, keyword case, clause line breaks and indentation.
 * <p>
 * Only whitespace and keyword letters change. String literals and backtick identifiers are copied untouched,
 * and clause order, parentheses and operands are never altered. A bare word spelled like a keyword keeps its
 * case when it is a map key or label owner (followed by {@code :}), or when the statement declares it as a
 * name, via {@code AS} or as a pattern alias.
 */
public final class CypherFormatter {
  /** Keywords that start a clause; they get a line of their own with {@code clauseNewline}. */
  static final List<String> CLAUSE_KEYWORDS = List.of(
      "OPTIONAL MATCH", "MATCH", "WHERE", "WITH", "RETURN", "ORDER BY", "SKIP", "LIMIT",
      "CREATE", "MERGE", "ON CREATE SET", "ON MATCH SET", "DETACH DELETE", "DELETE", "SET", "REMOVE",
      "UNWIND", "CALL", "YIELD", "UNION ALL", "UNION");

  /** Clause keywords indented one level under their parent clause with {@code indentSubClauses}. */
  static final Set<String> SUB_CLAUSES = Set.of(
      "WHERE", "ORDER BY", "SKIP", "LIMIT", "ON CREATE SET", "ON MATCH SET", "YIELD");

  /** Operator keywords: case is adjusted, lines never break on them. */
  static final List<String> OPERATOR_KEYWORDS = List.of(
      "STARTS WITH", "ENDS WITH", "IS NOT NULL", "IS NULL", "CONTAINS", "DISTINCT",
      "AND", "OR", "XOR", "NOT", "AS", "IN", "ASC", "DESC");

  private static final Pattern KEYWORD = buildPattern();
  private static final Pattern AS_NAME = Pattern.compile("(?i)(?<![\\w.$])AS\\s+(\\w+)");
  private static final Pattern PATTERN_ALIAS = Pattern.compile("[(\\[]\\s*(\\w+)\\s*[:)\\]{]");

  private CypherFormatter() {}

  public static String format(String cypher, FormattingOptions options) {
    if (cypher == null || cypher.isEmpty()) return "";
    FormattingOptions o = (options == null) ? FormattingOptions.defaults() : options;

    Set<String> names = declaredNames(cypher);
    StringBuilder out = new StringBuilder(cypher.length() + 16);
    int i = 0;
    while (i < cypher.length()) {
      char c = cypher.charAt(i);
      if (c == '\'' || c == '"' || c == '`') {
        int end = endOfQuoted(cypher, i, c);
        out.append(cypher, i, end);
        i = end;
      } else {
        int end = i;
        while (end < cypher.length() && "'\"`".indexOf(cypher.charAt(end)) < 0) end++;
        appendPlain(out, cypher.substring(i, end), o, names);
        i = end;
      }
    }
    return out.toString().strip();
  }

  /** Names bound by {@code AS} or as node/relationship aliases, outside quotes, exactly as written. */
  static Set<String> declaredNames(String cypher) {
    String plain = unquoted(cypher);
    Set<String> names = new HashSet<>();
    Matcher as = AS_NAME.matcher(plain);
    while (as.find()) names.add(as.group(1));
    Matcher alias = PATTERN_ALIAS.matcher(plain);
    while (alias.find()) names.add(alias.group(1));
    return names;
  }

  private static String unquoted(String cypher) {
    StringBuilder sb = new StringBuilder(cypher.length());
    int i = 0;
    while (i < cypher.length()) {
      char c = cypher.charAt(i);
      if (c == '\'' || c == '"' || c == '`') {
        int end = endOfQuoted(cypher, i, c);
        sb.append(' ');
        i = end;
      } else {
        sb.append(c);
        i++;
      }
    }
    return sb.toString();
  }

  private static void appendPlain(StringBuilder out, String segment, FormattingOptions o, Set<String> names) {
    String collapsed = segment.replaceAll("\\s+", " ");
    Matcher m = KEYWORD.matcher(collapsed);
    int last = 0;
    while (m.find()) {
      out.append(collapsed, last, m.start());
      if (isIdentifier(collapsed, m, names)) {
        out.append(m.group(1));
        last = m.end();
        continue;
      }
      String canonical = m.group(1).toUpperCase(Locale.ROOT).replaceAll(" +", " ");
      String text = applyCase(m.group(1), o.keywordCase());
      if (o.clauseNewline() && CLAUSE_KEYWORDS.contains(canonical) && hasContentBefore(out)) {
        trimTrailingSpace(out);
        out.append('\n');
        if (o.indentSubClauses() && SUB_CLAUSES.contains(canonical)) out.append(o.indentString());
      }
      out.append(text);
      last = m.end();
    }
    out.append(collapsed, last, collapsed.length());
  }

  private static boolean isIdentifier(String text, Matcher m, Set<String> names) {
    String word = m.group(1);
    if (word.indexOf(' ') >= 0) return false;
    int i = m.end();
    while (i < text.length() && text.charAt(i) == ' ') i++;
    char next = i < text.length() ? text.charAt(i) : ' ';
    if (next == ':') return true;
    // a number or parameter operand follows SKIP/LIMIT, never a name
    if (Character.isDigit(next) || next == '$') return false;
    return names.contains(word);
  }

  private static String applyCase(String keyword, KeywordCase kc) {
    String normalized = keyword.replaceAll(" +", " ");
    return switch (kc) {
      case UPPER -> normalized.toUpperCase(Locale.ROOT);
      case LOWER -> normalized.toLowerCase(Locale.ROOT);
      case AS_IS -> keyword;
    };
  }

  private static boolean hasContentBefore(StringBuilder out) {
    for (int i = out.length() - 1; i >= 0; i--) {
      char c = out.charAt(i);
      if (c == '\n') return false;
      if (c != ' ') return true;
    }
    return false;
  }

  private static void trimTrailingSpace(StringBuilder out) {
    while (out.length() > 0 && out.charAt(out.length() - 1) == ' ') out.setLength(out.length() - 1);
  }

  /** Index just past the closing quote; an unterminated quote runs to the end. Backslash escapes the next char. */
  private static int endOfQuoted(String s, int start, char quote) {
    int i = start + 1;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (c == '\\' && quote != '`') {
        i += 2;
        continue;
      }
      if (c == quote) {
        // doubled backtick inside an identifier
        if (quote == '`' && i + 1 < s.length() && s.charAt(i + 1) == '`') {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return s.length();
  }

  private static Pattern buildPattern() {
    List<String> all = new ArrayList<>(CLAUSE_KEYWORDS);
    all.addAll(OPERATOR_KEYWORDS);
    // longest first so multi-word keywords win over their parts
    all.sort(Comparator.comparingInt(String::length).reversed());
    StringBuilder alt = new StringBuilder();
    for (String k : all) {
      if (alt.length() > 0) alt.append('|');
      alt.append(k.replace(" ", "\\s+"));
    }
    return Pattern.compile("(?<![\\w.$])(" + alt + ")(?![\\w(])", Pattern.CASE_INSENSITIVE);
  }
}
