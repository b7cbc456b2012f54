package com.scholary.vidsub.segment;

/**
 * Subtitle timecode formatting.
 *
 * <p>Fractional seconds are truncated to whole milliseconds, never rounded. Hours are zero-padded
 * to two digits and widen past 99.
 */
public final class SubtitleTime {

  private SubtitleTime() {}

  /**
   * Format seconds as an SRT timecode.
   *
   * <p>Format: HH:MM:SS,mmm (hours:minutes:seconds,milliseconds)
   */
  public static String formatSrt(double seconds) {
    return format(seconds, ',');
  }

  /** Format seconds as a WebVTT timecode (HH:MM:SS.mmm). */
  public static String formatVtt(double seconds) {
    return format(seconds, '.');
  }

  private static String format(double seconds, char millisSeparator) {
    if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
      throw new IllegalArgumentException("Time must be a non-negative finite number: " + seconds);
    }
    // Small epsilon so values like 3725.4 (stored as 3725.39999...) keep their intended millis
    long totalMillis = (long) Math.floor(seconds * 1000 + 1e-6);

    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;

    return String.format("%02d:%02d:%02d%c%03d", hours, minutes, secs, millisSeparator, millis);
  }
}
