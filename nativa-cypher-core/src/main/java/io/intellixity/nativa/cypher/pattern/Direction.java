package io.intellixity.nativa.cypher.pattern;

/** Relationship direction as seen from the start node. */
public enum Direction {
  /** {@code -[..]->} */
  OUTGOING,
  /** {@code <-[..]-} */
  INCOMING,
  /** {@code -[..]-} */
  BIDIRECTIONAL
}
