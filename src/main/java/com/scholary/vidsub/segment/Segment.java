package com.scholary.vidsub.segment;

/**
 * A time-coded unit of subtitle text.
 *
 * <p>Timing comes from the transcription service and never changes afterwards. Reconciliation only
 * swaps the text, see {@link #withText(String)}.
 */
public record Segment(double start, double end, String text) {

  public Segment {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end <= start) {
      throw new IllegalArgumentException("End time must be > start time");
    }
    if (text == null) {
      text = "";
    }
  }

  public double duration() {
    return end - start;
  }

  /** Copy of this segment with the same timing and different text. */
  public Segment withText(String newText) {
    return new Segment(start, end, newText);
  }
}
