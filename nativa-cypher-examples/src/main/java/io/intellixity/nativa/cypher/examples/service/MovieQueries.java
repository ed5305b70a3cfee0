package io.intellixity.nativa.cypher.examples.service;

import io.intellixity.nativa.cypher.builder.Cypher;
import io.intellixity.nativa.cypher.builder.MatchBuilder;
import io.intellixity.nativa.cypher.expr.Expressions;
import io.intellixity.nativa.cypher.expr.Functions;
import io.intellixity.nativa.cypher.expr.Variable;
import io.intellixity.nativa.cypher.pattern.NodePattern;
import io.intellixity.nativa.cypher.pattern.Patterns;
import io.intellixity.nativa.cypher.schema.EntitySchema;
import io.intellixity.nativa.cypher.statement.Statement;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Statements over the classic movie graph: {@code (:Person)-[:ACTED_IN]->(:Movie)}.
 * <p>
 * Every caller-supplied value travels as a named parameter.
 */
@Service
public final class MovieQueries {
  public static final EntitySchema PERSON = EntitySchema.of("Person").withProperties("name", "born");
  public static final EntitySchema MOVIE = EntitySchema.of("Movie").withProperties("title", "released", "tagline");

  private static final String ACTED_IN = "ACTED_IN";

  public List<Statement> schema() {
    return List.of(
        PERSON.uniqueConstraint("person_name", "name"),
        MOVIE.uniqueConstraint("movie_title", "title"),
        MOVIE.index("movie_released", "released")
    );
  }

  public Statement findActor(String name) {
    NodePattern p = PERSON.node("p");
    return Cypher.match(p)
        .where(PERSON.property("name").of(p).eq(Expressions.namedParam("name", name)))
        .returning(p)
        .build();
  }

  /** Titles the actor played in, newest first, optionally only those released after {@code releasedAfter}. */
  public Statement moviesOf(String name, Integer releasedAfter) {
    NodePattern p = PERSON.node("p");
    NodePattern m = MOVIE.node("m");

    MatchBuilder match = Cypher.match(p.relationshipTo(m, ACTED_IN))
        .where(p.property("name").eq(Expressions.namedParam("name", name)));
    if (releasedAfter != null) {
      match = match.where(m.property("released").gt(Expressions.namedParam("releasedAfter", releasedAfter)));
    }
    return match
        .returning(m.property("title").as("title"), m.property("released").as("released"))
        .orderBy(m.property("released")).descending()
        .build();
  }

  public Statement coActors(String name, long limit) {
    NodePattern p = PERSON.node("p");
    NodePattern m = MOVIE.node("m");
    NodePattern co = PERSON.node("co");
    Variable movies = Expressions.variable("movies");

    return Cypher.match(p.relationshipTo(m, ACTED_IN).relationshipFrom(co, ACTED_IN))
        .where(p.property("name").eq(Expressions.namedParam("name", name)))
        .with(co, Functions.count(m).as("movies"))
        .orderBy(movies).descending()
        .limit(limit)
        .returning(co.property("name").as("coActor"), movies)
        .build();
  }

  /** Movies the actor's co-actors played in but the actor did not, ranked by how many co-actors link to them. */
  public Statement recommend(String name, long limit) {
    NodePattern p = PERSON.node("p");
    NodePattern m = MOVIE.node("m");
    NodePattern co = PERSON.node("co");
    NodePattern rec = MOVIE.node("rec");
    NodePattern pRef = Patterns.anyNode("p");
    NodePattern recRef = Patterns.anyNode("rec");
    Variable strength = Expressions.variable("strength");

    return Cypher.match(Patterns.path(
            p, p.relationshipTo(m, ACTED_IN),
            m, m.relationshipFrom(co, ACTED_IN),
            co, co.relationshipTo(rec, ACTED_IN), rec))
        .where(p.property("name").eq(Expressions.namedParam("name", name)))
        .where(Expressions.not(Patterns.path(pRef, pRef.relationshipTo(recRef, ACTED_IN), recRef)))
        .with(rec, Functions.countStar().as("strength"))
        .orderBy(strength).descending()
        .limit(limit)
        .returning(rec.property("title").as("title"), strength)
        .build();
  }

  /**
   * Creates the movie if missing and links each cast member, creating people as needed. Re-running with the
   * same input changes nothing.
   */
  public Statement createMovieWithCast(String title, Integer released, List<String> cast) {
    NodePattern m = MOVIE.node("m").withProperty("title", Expressions.namedParam("title", title));
    NodePattern a = PERSON.node("a").withProperty("name", Expressions.variable("actorName"));
    NodePattern aRef = Patterns.anyNode("a");
    NodePattern mRef = Patterns.anyNode("m");

    return Cypher.merge(m)
        .onCreate(m.property("released").to(Expressions.namedParam("released", released)))
        .with(m)
        .unwind(Expressions.namedParam("cast", cast == null ? List.of() : List.copyOf(cast)), "actorName")
        .merge(a)
        .with(m, a)
        .merge(Patterns.path(aRef, aRef.relationshipTo(mRef, ACTED_IN), mRef))
        .returning(m.property("title").as("title"), Functions.count(a).as("castSize"))
        .build();
  }

  public Statement deletePerson(String name) {
    NodePattern p = PERSON.node("p");
    return Cypher.match(p)
        .where(p.property("name").eq(Expressions.namedParam("name", name)))
        .detachDelete(p)
        .build();
  }
}
