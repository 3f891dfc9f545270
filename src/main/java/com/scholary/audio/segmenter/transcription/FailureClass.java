package com.scholary.audio.segmenter.transcription;

/** How a failed transcription call is treated. */
public enum FailureClass {
  /** Malformed request, authorization or payload-too-large. Never retried. */
  PERMANENT,
  /** The service asked us to slow down. Retried after the reset hint or a fixed delay. */
  RATE_LIMITED,
  /** Server, transport or parse failure. Retried with exponential backoff. */
  TRANSIENT
}
