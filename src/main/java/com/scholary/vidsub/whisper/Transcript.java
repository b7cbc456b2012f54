package com.scholary.vidsub.whisper;

import com.scholary.vidsub.segment.Segment;
import java.util.List;

/**
 * Source-language transcript of a video.
 *
 * @param text the full transcript
 * @param segments time-coded segments in chronological order, empty when the service returned no
 *     timing
 * @param language detected or requested source language
 */
public record Transcript(String text, List<Segment> segments, String language) {

  public Transcript {
    text = text == null ? "" : text.trim();
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  public boolean isBlank() {
    return text.isBlank() && segments.stream().allMatch(s -> s.text().isBlank());
  }

  public boolean hasTiming() {
    return !segments.isEmpty();
  }
}
