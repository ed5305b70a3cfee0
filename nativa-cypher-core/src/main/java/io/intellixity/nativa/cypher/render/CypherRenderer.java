package io.intellixity.nativa.cypher.render;

import io.intellixity.nativa.cypher.config.CypherSettings;
import io.intellixity.nativa.cypher.statement.Statement;

import java.util.Objects;

/** Applies {@link FormattingOptions} to built statements. Parameters are never touched. */
public final class CypherRenderer {
  private final FormattingOptions options;

  public CypherRenderer() {
    this(CypherSettings.current().formatting());
  }

  public CypherRenderer(FormattingOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public FormattingOptions options() { return options; }

  public String render(Statement statement) {
    return render(statement, options);
  }

  public String render(Statement statement, FormattingOptions with) {
    if (statement == null) return "";
    return CypherFormatter.format(statement.cypher(), with);
  }

  /** Formatted text together with the original parameters. */
  public Statement renderWithParams(Statement statement) {
    if (statement == null) return Statement.empty();
    return new Statement(render(statement), statement.params());
  }

  public String prettyPrint(Statement statement) {
    return render(statement, FormattingOptions.pretty().withIndentString(options.indentString()));
  }
}
