package com.scholary.voice.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Protocol-level error reported by the server.
 *
 * <p>The server only sends this when it has decided the session cannot continue, so it is never
 * retried.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamError(
    @JsonProperty("request_type") String requestType,
    @JsonProperty("error_code") int errorCode,
    @JsonProperty("reason_code") int reasonCode,
    @JsonProperty("error_message") String errorMessage)
    implements ServerEvent {}
