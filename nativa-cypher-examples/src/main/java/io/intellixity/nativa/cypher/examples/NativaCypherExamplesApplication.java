package io.intellixity.nativa.cypher.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

// The driver is wired by NativaCypherExampleConfig from nativa.neo4j.* instead of spring.neo4j.*.
@SpringBootApplication(excludeName = {"org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration"})
public class NativaCypherExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(NativaCypherExamplesApplication.class, args);
  }
}
