package com.scholary.voice.session;

import com.scholary.voice.protocol.TranscriptSegment;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects concluded segments for one language.
 *
 * <p>Append-only until {@link #freeze()}; later segments are dropped. The first concluded segment
 * with a language tag fixes the detected language. Not thread-safe: only the session's event path
 * touches it.
 */
public class TranscriptAccumulator {

  private final String language;
  private final List<TranscriptSegment> segments = new ArrayList<>();
  private String detectedLanguage;
  private boolean frozen;

  public TranscriptAccumulator(String language) {
    this.language = language;
  }

  /**
   * Append newly concluded segments in arrival order.
   *
   * @return the number of segments actually appended
   */
  public int append(List<TranscriptSegment> concluded) {
    if (frozen) {
      return 0;
    }
    for (TranscriptSegment segment : concluded) {
      if (detectedLanguage == null && segment.hasLanguage()) {
        detectedLanguage = segment.language();
      }
      segments.add(segment);
    }
    return concluded.size();
  }

  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  public String getLanguage() {
    return language;
  }

  /** @return the detected language, or null if no segment carried one yet */
  public String getDetectedLanguage() {
    return detectedLanguage;
  }

  /** @return the detected language if known, otherwise the requested one */
  public String resolvedLanguage() {
    return detectedLanguage != null ? detectedLanguage : language;
  }

  public List<TranscriptSegment> getSegments() {
    return List.copyOf(segments);
  }

  public int segmentCount() {
    return segments.size();
  }

  /** Space-joined text of all concluded segments. */
  public String fullText() {
    return segments.stream().map(s -> s.text() == null ? "" : s.text()).collect(Collectors.joining(" "));
  }

  public VoiceTranscript toTranscript(String lang) {
    return new VoiceTranscript(lang, fullText(), segments);
  }
}
