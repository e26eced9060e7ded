package com.scholary.voice.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** The server will send no further updates for the given target language. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndOfTargetTranscript(String language) implements ServerEvent {}
