package com.scholary.voice.api;

/**
 * Response for async translation request.
 *
 * <p>Returns a job ID that can be used to poll for status or to cancel the session.
 */
public record AsyncJobResponse(String jobId) {}
