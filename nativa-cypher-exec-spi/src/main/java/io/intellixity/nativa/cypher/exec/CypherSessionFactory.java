package io.intellixity.nativa.cypher.exec;

@FunctionalInterface
public interface CypherSessionFactory {
  CypherSession openSession();
}
