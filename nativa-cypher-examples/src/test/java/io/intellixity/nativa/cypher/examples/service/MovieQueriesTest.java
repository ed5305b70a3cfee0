package io.intellixity.nativa.cypher.examples.service;

import io.intellixity.nativa.cypher.statement.Statement;
import io.intellixity.nativa.cypher.validation.CypherValidator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MovieQueriesTest {
  private final MovieQueries queries = new MovieQueries();

  @Test
  void findActorByName() {
    Statement s = queries.findActor("Tom Hanks");
    assertEquals("MATCH (p:`Person`) WHERE p.name = $name RETURN p", s.cypher());
    assertEquals(Map.of("name", "Tom Hanks"), s.params());
  }

  @Test
  void moviesOfActorWithOptionalReleaseFilter() {
    Statement all = queries.moviesOf("Tom Hanks", null);
    assertEquals("MATCH (p:`Person`)-[:`ACTED_IN`]->(m:`Movie`) WHERE p.name = $name "
        + "RETURN m.title AS title, m.released AS released ORDER BY m.released DESC", all.cypher());

    Statement recent = queries.moviesOf("Tom Hanks", 2000);
    assertEquals("MATCH (p:`Person`)-[:`ACTED_IN`]->(m:`Movie`) WHERE (p.name = $name AND m.released > $releasedAfter) "
        + "RETURN m.title AS title, m.released AS released ORDER BY m.released DESC", recent.cypher());
    assertEquals(Map.of("name", "Tom Hanks", "releasedAfter", 2000), recent.params());
  }

  @Test
  void coActorsRankedByMoviesTogether() {
    Statement s = queries.coActors("Tom Hanks", 5);
    assertEquals("MATCH (p:`Person`)-[:`ACTED_IN`]->(m:`Movie`)<-[:`ACTED_IN`]-(co:`Person`) WHERE p.name = $name "
        + "WITH co, count(m) AS movies ORDER BY movies DESC LIMIT 5 RETURN co.name AS coActor, movies", s.cypher());
  }

  @Test
  void recommendationsExcludeOwnMovies() {
    Statement s = queries.recommend("Tom Hanks", 3);
    assertEquals("MATCH (p:`Person`)-[:`ACTED_IN`]->(m:`Movie`)<-[:`ACTED_IN`]-(co:`Person`)-[:`ACTED_IN`]->(rec:`Movie`) "
        + "WHERE (p.name = $name AND NOT ((p)-[:`ACTED_IN`]->(rec))) "
        + "WITH rec, count(*) AS strength ORDER BY strength DESC LIMIT 3 "
        + "RETURN rec.title AS title, strength", s.cypher());
    assertEquals(Map.of("name", "Tom Hanks"), s.params());
  }

  @Test
  void createMovieMergesCastIdempotently() {
    Statement s = queries.createMovieWithCast("The Matrix", 1999, List.of("Keanu Reeves", "Carrie-Anne Moss"));
    assertEquals("MERGE (m:`Movie` {title: $title}) ON CREATE SET m.released = $released WITH m "
        + "UNWIND $cast AS actorName MERGE (a:`Person` {name: actorName}) WITH m, a "
        + "MERGE (a)-[:`ACTED_IN`]->(m) RETURN m.title AS title, count(a) AS castSize", s.cypher());
    assertEquals(Map.of("title", "The Matrix", "released", 1999, "cast", List.of("Keanu Reeves", "Carrie-Anne Moss")),
        s.params());
  }

  @Test
  void callerTextNeverReachesTheQueryText() {
    String hostile = "x' OR 1=1 //";
    Statement s = queries.deletePerson(hostile);
    assertEquals("MATCH (p:`Person`) WHERE p.name = $name DETACH DELETE p", s.cypher());
    assertEquals(hostile, s.params().get("name"));
  }

  @Test
  void schemaStatements() {
    List<String> cypher = queries.schema().stream().map(Statement::cypher).toList();
    assertEquals(List.of(
        "CREATE CONSTRAINT person_name IF NOT EXISTS FOR (n:Person) REQUIRE n.name IS UNIQUE",
        "CREATE CONSTRAINT movie_title IF NOT EXISTS FOR (n:Movie) REQUIRE n.title IS UNIQUE",
        "CREATE INDEX movie_released IF NOT EXISTS FOR (n:Movie) ON (n.released)"), cypher);
  }

  @Test
  void everyStatementPassesBasicValidation() {
    CypherValidator validator = CypherValidator.defaults();
    assertTrue(validator.isValid(queries.findActor("a").cypher()));
    assertTrue(validator.isValid(queries.moviesOf("a", 1990).cypher()));
    assertTrue(validator.isValid(queries.coActors("a", 1).cypher()));
    assertTrue(validator.isValid(queries.recommend("a", 1).cypher()));
    assertTrue(validator.isValid(queries.createMovieWithCast("t", null, null).cypher()));
    assertTrue(validator.isValid(queries.deletePerson("a").cypher()));
  }
}
