package com.scholary.vidsub.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Contains the full transcript text, the detected language, and segments when the service was
 * asked for {@code verbose_json}. Segments may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(
    String text, String language, Double duration, List<TranscriptSegment> segments) {

  public WhisperResponse {
    if (segments == null) {
      segments = List.of();
    }
  }
}
