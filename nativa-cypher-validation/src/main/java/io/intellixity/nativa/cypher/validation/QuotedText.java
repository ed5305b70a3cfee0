package io.intellixity.nativa.cypher.validation;

/** Blanks out quoted content so structural checks only see query syntax. */
final class QuotedText {
  private QuotedText() {}

  /**
   * Same-length copy of {@code cypher} where every character between a pair of {@code '}, {@code "} or
   * backtick quotes is replaced by a space. Quote characters themselves are kept. An unterminated quote
   * blanks the rest of the text.
   */
  static String mask(String cypher) {
    if (cypher == null) return "";
    char[] out = cypher.toCharArray();
    int i = 0;
    while (i < out.length) {
      char q = out[i];
      if (q != '\'' && q != '"' && q != '`') {
        i++;
        continue;
      }
      i++;
      while (i < out.length) {
        char c = out[i];
        if (c == '\\' && q != '`' && i + 1 < out.length) {
          out[i] = ' ';
          out[i + 1] = ' ';
          i += 2;
          continue;
        }
        if (c == q) {
          if (q == '`' && i + 1 < out.length && out[i + 1] == '`') {
            out[i] = ' ';
            out[i + 1] = ' ';
            i += 2;
            continue;
          }
          break;
        }
        out[i] = ' ';
        i++;
      }
      i++;
    }
    return new String(out);
  }
}
