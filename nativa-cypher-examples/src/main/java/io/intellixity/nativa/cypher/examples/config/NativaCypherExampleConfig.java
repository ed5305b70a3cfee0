package io.intellixity.nativa.cypher.examples.config;

import io.intellixity.nativa.cypher.exec.CypherExecutor;
import io.intellixity.nativa.cypher.neo4j.Neo4jSessionFactory;
import io.intellixity.nativa.cypher.neo4j.Neo4jSettings;
import io.intellixity.nativa.cypher.validation.CypherValidator;
import org.neo4j.driver.Driver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(Neo4jProperties.class)
public class NativaCypherExampleConfig {
  private static final Logger log = LoggerFactory.getLogger(NativaCypherExampleConfig.class);

  @Bean
  public CypherValidator cypherValidator() {
    return CypherValidator.defaults();
  }

  // Without nativa.neo4j.uri the app only builds statements and never connects.
  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "nativa.neo4j", name = "uri")
  public Driver neo4jDriver(Neo4jProperties props) {
    Neo4jSettings settings = props.toSettings();
    log.info("nativa.cypher.examples neo4j={}", settings);
    return settings.createDriver();
  }

  @Bean
  @ConditionalOnProperty(prefix = "nativa.neo4j", name = "uri")
  public CypherExecutor cypherExecutor(Driver driver, Neo4jProperties props, CypherValidator validator) {
    return new CypherExecutor(new Neo4jSessionFactory(driver, props.getDatabase()), validator::requireValid);
  }
}
