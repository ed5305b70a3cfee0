package io.intellixity.nativa.cypher.builder;

public interface LimitBuilder extends Buildable {
}
