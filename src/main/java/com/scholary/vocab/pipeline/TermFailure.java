package com.scholary.vocab.pipeline;

/**
 * A term that did not make it into the table.
 *
 * @param index position of the term in the parsed input
 */
public record TermFailure(int index, String term, FailureKind kind, String message) {}
