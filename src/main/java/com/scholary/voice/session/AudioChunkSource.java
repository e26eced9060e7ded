package com.scholary.voice.session;

import java.io.IOException;
import java.util.Optional;

/**
 * Supplies audio to a session one chunk at a time.
 *
 * <p>Pulled from a single thread. May block, for example while reading from a live input.
 */
@FunctionalInterface
public interface AudioChunkSource {

  /**
   * Return the next chunk of audio.
   *
   * @return the chunk, or empty when the audio has ended
   * @throws IOException if reading fails; the session fails with this exact exception
   */
  Optional<byte[]> nextChunk() throws IOException;
}
