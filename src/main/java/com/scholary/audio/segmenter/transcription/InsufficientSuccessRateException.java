package com.scholary.audio.segmenter.transcription;

/**
 * Thrown when too few chunks transcribed successfully for the job to be usable.
 *
 * <p>This is fatal for the job: no transcript is produced.
 */
public class InsufficientSuccessRateException extends RuntimeException {

  private final int attemptedChunks;
  private final int successfulChunks;
  private final int requiredChunks;

  public InsufficientSuccessRateException(
      int attemptedChunks, int successfulChunks, int requiredChunks) {
    super(
        String.format(
            "Transcription failed: %d/%d chunks succeeded, need %d",
            successfulChunks, attemptedChunks, requiredChunks));
    this.attemptedChunks = attemptedChunks;
    this.successfulChunks = successfulChunks;
    this.requiredChunks = requiredChunks;
  }

  public int getAttemptedChunks() {
    return attemptedChunks;
  }

  public int getSuccessfulChunks() {
    return successfulChunks;
  }

  public int getRequiredChunks() {
    return requiredChunks;
  }
}
