package io.intellixity.nativa.cypher.render;

public enum KeywordCase { AS_IS, UPPER, LOWER }
