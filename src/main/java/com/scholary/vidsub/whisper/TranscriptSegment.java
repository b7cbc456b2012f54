package com.scholary.vidsub.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Represents a single segment of transcribed audio.
 *
 * <p>This matches the segment objects of a {@code verbose_json} transcription response. Fields the
 * service adds beyond timing and text (tokens, log probabilities) are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(double start, double end, String text) {}
