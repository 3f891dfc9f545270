package com.scholary.audio.segmenter.whisper;

/**
 * Interface for the speech-to-text capability.
 *
 * <p>Implementations make exactly one call per invocation. Retrying is the caller's decision, made
 * from the status carried by {@link WhisperException}.
 */
public interface TranscriptionClient {

  /**
   * Transcribe one chunk of audio.
   *
   * @param audio the chunk bytes
   * @param chunkIndex the index of this chunk in the full audio, for logging
   * @return text, chunk-relative segments and decoded duration
   * @throws WhisperException if the call fails
   */
  WhisperResponse transcribe(byte[] audio, int chunkIndex);

  /**
   * Resolve the credentials the calls need, before any chunk is sent.
   *
   * @throws com.scholary.audio.segmenter.secrets.SecretException if they cannot be resolved
   */
  void resolveCredentials();
}
