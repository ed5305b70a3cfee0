package io.intellixity.nativa.cypher.examples.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.nativa.cypher.CypherException;
import io.intellixity.nativa.cypher.examples.service.MovieQueries;
import io.intellixity.nativa.cypher.exec.CypherExecutor;
import io.intellixity.nativa.cypher.exec.CypherResult;
import io.intellixity.nativa.cypher.statement.Statement;
import io.intellixity.nativa.cypher.validation.CypherValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * Serves the movie statements as JSON. With a configured executor each statement is also run and its
 * records are returned next to it; otherwise only the validated statement comes back.
 */
@RestController
@RequestMapping("/api/movies")
public final class MovieController {
  private final MovieQueries queries;
  private final CypherValidator validator;
  private final CypherExecutor executor;

  public MovieController(MovieQueries queries, CypherValidator validator, Optional<CypherExecutor> executor) {
    this.queries = queries;
    this.validator = validator;
    this.executor = executor.orElse(null);
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record MovieResponse(Statement statement, List<Map<String, Object>> records, Map<String, Object> counters) {}

  public record CreateMovieRequest(String title, Integer released, List<String> cast) {}

  @GetMapping("/actors/{name}")
  public MovieResponse actor(@PathVariable("name") String name) {
    return read(queries.findActor(name));
  }

  @GetMapping("/actors/{name}/movies")
  public MovieResponse movies(@PathVariable("name") String name,
                              @RequestParam(value = "releasedAfter", required = false) Integer releasedAfter) {
    return read(queries.moviesOf(name, releasedAfter));
  }

  @GetMapping("/actors/{name}/co-actors")
  public MovieResponse coActors(@PathVariable("name") String name,
                                @RequestParam(value = "limit", defaultValue = "10") long limit) {
    return read(queries.coActors(name, limit));
  }

  @GetMapping("/actors/{name}/recommendations")
  public MovieResponse recommendations(@PathVariable("name") String name,
                                       @RequestParam(value = "limit", defaultValue = "5") long limit) {
    return read(queries.recommend(name, limit));
  }

  @PostMapping
  public MovieResponse create(@RequestBody CreateMovieRequest req) {
    return write(queries.createMovieWithCast(req.title, req.released, req.cast));
  }

  @DeleteMapping("/actors/{name}")
  public MovieResponse deleteActor(@PathVariable("name") String name) {
    return write(queries.deletePerson(name));
  }

  @GetMapping("/schema")
  public List<Statement> schema() {
    return queries.schema();
  }

  /** Schema statements run one by one; constraint and index DDL cannot share a transaction with data. */
  @PostMapping("/schema")
  public List<MovieResponse> applySchema() {
    List<MovieResponse> out = new ArrayList<>();
    for (Statement s : queries.schema()) out.add(write(s));
    return out;
  }

  @ExceptionHandler(CypherException.class)
  public ResponseEntity<Map<String, Object>> failed(CypherException e) {
    HttpStatus status = (e.kind() == CypherException.Kind.EXECUTION) ? HttpStatus.BAD_GATEWAY : HttpStatus.BAD_REQUEST;
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("kind", e.kind().name());
    body.put("component", e.component());
    body.put("message", e.getMessage());
    return ResponseEntity.status(status).body(body);
  }

  private MovieResponse read(Statement s) {
    validator.requireValid(s);
    if (executor == null) return new MovieResponse(s, null, null);
    CypherResult r = executor.executeRead(s);
    return new MovieResponse(s, r.records(), r.counters());
  }

  private MovieResponse write(Statement s) {
    validator.requireValid(s);
    if (executor == null) return new MovieResponse(s, null, null);
    CypherResult r = executor.executeWrite(s);
    return new MovieResponse(s, r.records(), r.counters());
  }
}
