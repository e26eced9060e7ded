package com.scholary.voice.protocol;

/** The server will send no further source transcript updates. */
public record EndOfSourceTranscript() implements ServerEvent {}
