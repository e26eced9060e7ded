package com.scholary.voice.session;

/**
 * Lifecycle of a voice session.
 *
 * <pre>
 * CONNECTING -&gt; STREAMING &lt;-&gt; RECONNECTING -&gt; COMPLETED
 *      \______________\_____________\______-&gt; FAILED
 * </pre>
 */
public enum SessionState {
  CONNECTING,
  STREAMING,
  RECONNECTING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
