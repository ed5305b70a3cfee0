package io.intellixity.nativa.cypher.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class ValidationRuleDiscoveryTest {
  @TempDir
  Path dir;

  public static final class ParenthesesAgainRule implements ValidationRule {
    public ParenthesesAgainRule() {}

    @Override public String id() { return BuiltInRules.UNMATCHED_PARENTHESES; }
    @Override public String description() { return "same id as a built-in"; }
    @Override public ValidationLevel level() { return ValidationLevel.BASIC; }
    @Override public ValidationError check(String cypher, String masked) { return null; }
  }

  public static final class NoDefaultConstructorRule implements ValidationRule {
    public NoDefaultConstructorRule(String id) {}

    @Override public String id() { return "NEEDS_ARG"; }
    @Override public String description() { return "no public no-arg constructor"; }
    @Override public ValidationLevel level() { return ValidationLevel.BASIC; }
    @Override public ValidationError check(String cypher, String masked) { return null; }
  }

  @Test
  void testResourceRegistersNoApocRule() {
    List<ValidationRule> rules = ValidationRuleDiscovery.discover(getClass().getClassLoader(), Set.of());
    assertEquals(1, rules.size());
    assertInstanceOf(NoApocRule.class, rules.get(0));
  }

  @Test
  void classesListedAgainAreCreatedOnce() throws IOException {
    try (URLClassLoader cl = withRegistration(NoApocRule.class.getName() + " , " + NoApocRule.class.getName() + ",")) {
      assertEquals(Set.of(NoApocRule.class.getName()), ValidationRuleDiscovery.registeredClassNames(cl));
      assertEquals(1, ValidationRuleDiscovery.discover(cl, Set.of()).size());
    }
  }

  @Test
  void ruleIdsMustNotCollideWithReservedIds() throws IOException {
    try (URLClassLoader cl = withRegistration(ParenthesesAgainRule.class.getName())) {
      IllegalStateException ex = assertThrows(IllegalStateException.class,
          () -> ValidationRuleDiscovery.discover(cl, Set.of(BuiltInRules.UNMATCHED_PARENTHESES)));
      assertTrue(ex.getMessage().contains(BuiltInRules.UNMATCHED_PARENTHESES));
    }
    assertThrows(IllegalStateException.class,
        () -> ValidationRuleDiscovery.discover(getClass().getClassLoader(), Set.of("NO_APOC")));
  }

  @Test
  void badRegistrationsNameTheOffendingClass() throws IOException {
    for (String name : List.of("com.example.MissingRule", String.class.getName(), ValidationRule.class.getName(),
        NoDefaultConstructorRule.class.getName())) {
      try (URLClassLoader cl = withRegistration(name)) {
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ValidationRuleDiscovery.discover(cl, Set.of()));
        assertTrue(ex.getMessage().contains(name), ex.getMessage());
      }
    }
  }

  @Test
  void validatorDefaultsIncludeDiscoveredRulesAfterBuiltIns() {
    List<String> ids = new ArrayList<>();
    for (ValidationRule r : CypherValidator.defaults().rules()) ids.add(r.id());
    assertEquals("NO_APOC", ids.get(ids.size() - 1));
    assertTrue(ids.contains(BuiltInRules.UNMATCHED_PARENTHESES));
  }

  // the parent loader contributes the NoApocRule registration from test resources
  private URLClassLoader withRegistration(String value) throws IOException {
    Path root = Files.createTempDirectory(dir, "cp");
    Path file = root.resolve(ValidationRuleDiscovery.RESOURCE);
    Files.createDirectories(file.getParent());
    Files.writeString(file, ValidationRuleDiscovery.KEY + "=" + value + "\n");
    return new URLClassLoader(new URL[]{root.toUri().toURL()}, getClass().getClassLoader());
  }
}
