package com.phonepe.memsight.core.retrieval;

/**
 * A hit from a keyword search. Scores are only comparable within one search.
 */
public record LexicalMatch(String id, double score) {
}
