package com.scholary.audio.segmenter.transcription;

import com.scholary.audio.segmenter.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a partially failed job is still acceptable.
 *
 * <p>The tolerated failure share grows with the number of chunks:
 *
 * <pre>
 * chunks    required success rate
 * 1-3       100%
 * 4-5       80%
 * 6-10      70%
 * 11+       max(60%, 1 - 3/chunks), i.e. at most 3 failed chunks
 * </pre>
 *
 * <p>Only chunks that were actually submitted count. Chunks dropped for being too small are
 * neither successes nor failures.
 */
@Component
public class SuccessGate {

  private static final Logger LOGGER = LoggerFactory.getLogger(SuccessGate.class);
  private static final double EPSILON = 1e-9;

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /**
   * Minimum success ratio for a job with the given number of submitted chunks.
   *
   * @param totalChunks submitted chunks, at least 1
   * @return the required ratio in [0.6, 1.0]
   */
  public double threshold(int totalChunks) {
    if (totalChunks <= 3) {
      return 1.0;
    }
    if (totalChunks <= 5) {
      return 0.8;
    }
    if (totalChunks <= 10) {
      return 0.7;
    }
    return Math.max(0.6, 1.0 - 3.0 / totalChunks);
  }

  /**
   * Check a job's outcome against the threshold.
   *
   * @param outcome the scheduler's outcome
   * @throws InsufficientSuccessRateException if the success ratio is below the threshold, or if
   *     no chunk was submitted at all
   */
  public void verify(BatchOutcome outcome) {
    verify(outcome.submittedChunks(), outcome.successfulChunks());
  }

  public void verify(int totalChunks, int successfulChunks) {
    if (totalChunks <= 0) {
      LOGGER.error("No chunks were submitted for transcription");
      throw new InsufficientSuccessRateException(0, 0, 1);
    }

    double required = threshold(totalChunks);
    double actual = (double) successfulChunks / totalChunks;
    structuredLogger.logSuccessRate(successfulChunks, totalChunks, required, actual);

    if (actual + EPSILON < required) {
      int requiredChunks = (int) Math.ceil(totalChunks * required - EPSILON);
      LOGGER.error(
          "Insufficient success rate: {}/{} < {}% required",
          successfulChunks,
          totalChunks,
          String.format("%.1f", required * 100));
      throw new InsufficientSuccessRateException(totalChunks, successfulChunks, requiredChunks);
    }

    if (successfulChunks < totalChunks) {
      LOGGER.warn(
          "Some chunks failed ({}/{}) but meeting {}% threshold",
          totalChunks - successfulChunks,
          totalChunks,
          String.format("%.1f", required * 100));
    }
  }
}
