package com.scholary.audio.segmenter.transcript;

/**
 * {@code MM:SS} timecodes as used in the timestamped transcript and in topic segments.
 *
 * <p>Minutes are not wrapped into hours, so 75 minutes is {@code 75:00}.
 */
public final class Timecodes {

  private Timecodes() {}

  /** Format seconds as {@code MM:SS}, truncating fractions. */
  public static String format(double seconds) {
    long total = (long) Math.floor(Math.max(0, seconds));
    return String.format("%02d:%02d", total / 60, total % 60);
  }

  /**
   * Parse an {@code MM:SS} timecode.
   *
   * @return the timecode in whole seconds
   * @throws IllegalArgumentException if the value is not a valid timecode
   */
  public static int parse(String timecode) {
    if (timecode == null) {
      throw new IllegalArgumentException("Timecode is null");
    }
    String[] parts = timecode.trim().split(":");
    if (parts.length != 2) {
      throw new IllegalArgumentException("Invalid timecode: " + timecode);
    }
    try {
      int minutes = Integer.parseInt(parts[0]);
      int seconds = Integer.parseInt(parts[1]);
      if (minutes < 0 || seconds < 0 || seconds >= 60) {
        throw new IllegalArgumentException("Invalid timecode: " + timecode);
      }
      return minutes * 60 + seconds;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid timecode: " + timecode, e);
    }
  }
}
