package com.scholary.vocab.api;

/**
 * Response for an asynchronous run request.
 *
 * <p>Returns the run ID and the URL to poll for its status.
 */
public record AsyncJobResponse(String runId, String statusUrl) {}
