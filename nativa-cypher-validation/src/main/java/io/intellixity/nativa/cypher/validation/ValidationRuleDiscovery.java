package io.intellixity.nativa.cypher.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.util.*;

/**
 * Finds {@link ValidationRule} implementations listed in {@code META-INF/nativa-cypher.factories}.
 * <p>
 * Each resource is a Properties file; the value under {@code io.intellixity.nativa.cypher.validation.ValidationRule}
 * is a comma-separated list of public classes with a public no-arg constructor. Resources are read in class
 * loader order and a class listed more than once is instantiated once. Rule ids must be unique across the
 * reserved (built-in) ids and every discovered rule.
 */
final class ValidationRuleDiscovery {
  static final String RESOURCE = "META-INF/nativa-cypher.factories";
  static final String KEY = ValidationRule.class.getName();

  private static final Logger log = LoggerFactory.getLogger(ValidationRuleDiscovery.class);

  private ValidationRuleDiscovery() {}

  static List<ValidationRule> discover(ClassLoader loader, Set<String> reservedIds) {
    ClassLoader cl = (loader == null) ? ValidationRuleDiscovery.class.getClassLoader() : loader;
    Set<String> ids = new HashSet<>(reservedIds);
    List<ValidationRule> rules = new ArrayList<>();
    for (String className : registeredClassNames(cl)) {
      ValidationRule rule = instantiate(className, cl);
      if (!ids.add(rule.id())) {
        throw new IllegalStateException("Validation rule " + className + " reuses rule id '" + rule.id() + "'");
      }
      rules.add(rule);
    }
    return rules;
  }

  static Set<String> registeredClassNames(ClassLoader cl) {
    Set<String> names = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String value = read(url).getProperty(KEY);
      if (value == null) continue;
      int before = names.size();
      for (String part : value.split(",")) {
        if (!part.isBlank()) names.add(part.strip());
      }
      if (log.isDebugEnabled()) {
        log.debug("nativa.cypher.validation.factories url={} added={}", url, names.size() - before);
      }
    }
    return names;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Cannot list " + RESOURCE + " resources", e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read rule registrations from " + url, e);
    }
    return p;
  }

  private static ValidationRule instantiate(String className, ClassLoader cl) {
    Class<?> type;
    try {
      type = Class.forName(className, false, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Registered validation rule " + className + " is not on the classpath", e);
    }
    if (!ValidationRule.class.isAssignableFrom(type)) {
      throw new IllegalStateException("Registered class " + className + " does not implement ValidationRule");
    }
    if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
      throw new IllegalStateException("Registered validation rule " + className + " is abstract");
    }
    try {
      Constructor<?> ctor = type.getConstructor();
      return (ValidationRule) ctor.newInstance();
    } catch (NoSuchMethodException e) {
      throw new IllegalStateException("Validation rule " + className + " needs a public no-arg constructor", e);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot create validation rule " + className, e);
    }
  }
}
