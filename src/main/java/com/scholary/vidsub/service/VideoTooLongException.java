package com.scholary.vidsub.service;

/** The uploaded video exceeds the configured maximum duration. */
public class VideoTooLongException extends RuntimeException {

  private final double durationSeconds;
  private final int maxDurationSeconds;

  public VideoTooLongException(double durationSeconds, int maxDurationSeconds) {
    super(
        String.format(
            "Video is too long: %.1fs, the maximum is %ds", durationSeconds, maxDurationSeconds));
    this.durationSeconds = durationSeconds;
    this.maxDurationSeconds = maxDurationSeconds;
  }

  public double getDurationSeconds() {
    return durationSeconds;
  }

  public int getMaxDurationSeconds() {
    return maxDurationSeconds;
  }
}
