package com.scholary.voice.session;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Reads fixed-size chunks from an input stream.
 *
 * <p>Every chunk is exactly {@code chunkSize} bytes except the last, which carries whatever was
 * left. Works for files and for live streams such as standard input, where a read may block until
 * enough data arrives.
 */
public class InputStreamChunkSource implements AudioChunkSource, Closeable {

  private final InputStream input;
  private final int chunkSize;
  private boolean exhausted;

  public InputStreamChunkSource(InputStream input, int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
    }
    this.input = input;
    this.chunkSize = chunkSize;
  }

  @Override
  public Optional<byte[]> nextChunk() throws IOException {
    if (exhausted) {
      return Optional.empty();
    }
    byte[] chunk = input.readNBytes(chunkSize);
    if (chunk.length < chunkSize) {
      exhausted = true;
    }
    return chunk.length == 0 ? Optional.empty() : Optional.of(chunk);
  }

  @Override
  public void close() throws IOException {
    input.close();
  }
}
