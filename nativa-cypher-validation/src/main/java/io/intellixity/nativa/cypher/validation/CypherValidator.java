package io.intellixity.nativa.cypher.validation;

import io.intellixity.nativa.cypher.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Heuristic, regex-level validator for Cypher text. It does not parse: passing validation does not mean the
 * server will accept the statement, and a few legal statements are flagged at STRICT.
 * <p>
 * Rules run in registration order; each contributes at most one error.
 */
public final class CypherValidator {
  private static final Logger log = LoggerFactory.getLogger(CypherValidator.class);

  private final List<ValidationRule> rules;
  private final ValidationLevel level;

  public CypherValidator(List<? extends ValidationRule> rules, ValidationLevel level) {
    this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    this.level = Objects.requireNonNull(level, "level");
  }

  /** Built-in plus discovered rules at BASIC. */
  public static CypherValidator defaults() {
    return new CypherValidator(withDiscovered(), ValidationLevel.BASIC);
  }

  /** Built-in plus discovered rules at STRICT. */
  public static CypherValidator strict() {
    return new CypherValidator(withDiscovered(), ValidationLevel.STRICT);
  }

  private static List<ValidationRule> withDiscovered() {
    List<ValidationRule> all = new ArrayList<>(BuiltInRules.all());
    Set<String> builtInIds = new HashSet<>();
    for (ValidationRule r : all) builtInIds.add(r.id());
    List<ValidationRule> extra = ValidationRuleDiscovery.discover(Thread.currentThread().getContextClassLoader(), builtInIds);
    if (!extra.isEmpty() && log.isDebugEnabled()) {
      List<String> ids = new ArrayList<>();
      for (ValidationRule r : extra) ids.add(r.id());
      log.debug("nativa.cypher.validation.discovered rules={}", ids);
    }
    all.addAll(extra);
    return all;
  }

  public ValidationLevel level() { return level; }

  public List<ValidationRule> rules() { return rules; }

  public CypherValidator withLevel(ValidationLevel newLevel) {
    return new CypherValidator(rules, newLevel);
  }

  public CypherValidator withRule(ValidationRule rule) {
    List<ValidationRule> rs = new ArrayList<>(rules);
    rs.add(Objects.requireNonNull(rule, "rule"));
    return new CypherValidator(rs, level);
  }

  public List<ValidationError> validate(String cypher) {
    if (level == ValidationLevel.OFF || cypher == null || cypher.isEmpty()) return List.of();

    String masked = QuotedText.mask(cypher);
    List<ValidationError> errors = new ArrayList<>();
    for (ValidationRule rule : rules) {
      if (!level.includes(rule.level())) continue;
      ValidationError e = rule.check(cypher, masked);
      if (e != null) errors.add(e);
    }

    if (log.isDebugEnabled()) {
      log.debug("nativa.cypher.validate level={} rules={} errors={} length={}", level, rules.size(), errors.size(), cypher.length());
    }
    return errors;
  }

  public List<ValidationError> validate(Statement statement) {
    return (statement == null) ? List.of() : validate(statement.cypher());
  }

  public boolean isValid(String cypher) {
    return validate(cypher).isEmpty();
  }

  /** Returns the statement unchanged, or throws with every violation found. */
  public Statement requireValid(Statement statement) {
    List<ValidationError> errors = validate(statement);
    if (!errors.isEmpty()) throw new CypherValidationException(errors);
    return statement;
  }
}
