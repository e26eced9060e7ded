package com.scholary.voice.protocol;

/** All transcripts are concluded; the server is about to close the connection. */
public record EndOfStream() implements ServerEvent {}
