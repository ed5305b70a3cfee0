package io.intellixity.nativa.cypher.render;

import java.util.Objects;

/**
 * Cosmetic options for {@link CypherFormatter}.
 *
 * @param maxLineLength advisory; {@code 0} means unlimited. Lines are never wrapped.
 */
public record FormattingOptions(String indentString,
                                KeywordCase keywordCase,
                                boolean clauseNewline,
                                boolean indentSubClauses,
                                int maxLineLength) {
  public FormattingOptions {
    indentString = (indentString == null) ? "  " : indentString;
    keywordCase = (keywordCase == null) ? KeywordCase.AS_IS : keywordCase;
    if (maxLineLength < 0) throw new IllegalArgumentException("maxLineLength must be >= 0");
  }

  /** Single line, keywords untouched. */
  public static FormattingOptions defaults() {
    return new FormattingOptions("  ", KeywordCase.AS_IS, false, false, 0);
  }

  /** One clause per line, upper-case keywords, sub-clauses indented. */
  public static FormattingOptions pretty() {
    return new FormattingOptions("  ", KeywordCase.UPPER, true, true, 0);
  }

  public FormattingOptions withIndentString(String s) {
    return new FormattingOptions(Objects.requireNonNull(s, "indentString"), keywordCase, clauseNewline, indentSubClauses, maxLineLength);
  }

  public FormattingOptions withKeywordCase(KeywordCase c) {
    return new FormattingOptions(indentString, c, clauseNewline, indentSubClauses, maxLineLength);
  }

  public FormattingOptions withClauseNewline(boolean b) {
    return new FormattingOptions(indentString, keywordCase, b, indentSubClauses, maxLineLength);
  }

  public FormattingOptions withIndentSubClauses(boolean b) {
    return new FormattingOptions(indentString, keywordCase, clauseNewline, b, maxLineLength);
  }

  public FormattingOptions withMaxLineLength(int n) {
    return new FormattingOptions(indentString, keywordCase, clauseNewline, indentSubClauses, n);
  }
}
