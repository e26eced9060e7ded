package com.scholary.voice.streaming;

import com.scholary.voice.client.VoiceConnection;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controls backpressure while uploading audio to a streaming connection.
 *
 * <p>When the connection's unsent data reaches its high-water mark, the uploader waits here before
 * pulling the next chunk from its source. The wait is bounded: after the configured number of
 * pauses the upload continues even if the buffer has not drained, so a stalled socket cannot hang
 * the uploader forever. A closed connection ends the wait immediately.
 */
public class BackpressureController {

  private static final Logger LOGGER = LoggerFactory.getLogger(BackpressureController.class);

  private final Duration pause;
  private final int maxWaits;

  public BackpressureController(Duration pause, int maxWaits) {
    if (pause.isNegative() || pause.isZero()) {
      throw new IllegalArgumentException("Backpressure pause must be positive");
    }
    if (maxWaits < 1) {
      throw new IllegalArgumentException("Backpressure max waits must be at least 1");
    }
    this.pause = pause;
    this.maxWaits = maxWaits;
  }

  /**
   * Check if uploading should pause.
   *
   * @return true if the connection is open and its buffer is at or above the high-water mark
   */
  public boolean shouldPause(VoiceConnection connection) {
    return connection.isOpen() && connection.isCongested();
  }

  /**
   * Wait while the connection is congested.
   *
   * @return the number of pauses taken
   * @throws InterruptedException if interrupted while waiting
   */
  public int waitForDrain(VoiceConnection connection) throws InterruptedException {
    int waits = 0;

    while (shouldPause(connection) && waits < maxWaits) {
      LOGGER.debug(
          "Send buffer above high-water mark ({} bytes), pausing (wait {}/{})",
          connection.bufferedBytes(),
          waits + 1,
          maxWaits);
      Thread.sleep(pause.toMillis());
      waits++;
    }

    if (waits >= maxWaits && shouldPause(connection)) {
      LOGGER.warn(
          "Send buffer did not drain after {}ms ({} bytes buffered), continuing anyway",
          pause.toMillis() * maxWaits,
          connection.bufferedBytes());
    }

    return waits;
  }
}
