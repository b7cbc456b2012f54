package com.scholary.vidsub.api;

import com.scholary.vidsub.reconcile.TranslationUnit;
import com.scholary.vidsub.reconcile.TranslationUnit.FullText;
import com.scholary.vidsub.reconcile.TranslationUnit.SegmentedText;
import com.scholary.vidsub.segment.Segment;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * Request for reconciling a translation with timed segments.
 *
 * <p>Exactly one of {@code translatedSegments} (one entry per segment) or {@code translatedText}
 * (free text, split into sentences) must be given. {@code durationSeconds} is only needed when
 * {@code segments} is empty; the whole translation is then shown from 0 to that duration.
 */
public record SubtitleRequest(
    @NotNull List<Segment> segments,
    List<String> translatedSegments,
    String translatedText,
    @Positive Double durationSeconds,
    @Min(16) @Max(7680) Integer canvasWidth,
    @Min(16) @Max(4320) Integer canvasHeight) {

  // Provide defaults
  public SubtitleRequest {
    if (canvasWidth == null) {
      canvasWidth = 1280;
    }
    if (canvasHeight == null) {
      canvasHeight = 720;
    }
  }

  /**
   * The translation in the shape the reconciler expects.
   *
   * @throws IllegalArgumentException unless exactly one translation form is present
   */
  public TranslationUnit translation() {
    boolean hasSegments = translatedSegments != null;
    boolean hasText = translatedText != null;
    if (hasSegments == hasText) {
      throw new IllegalArgumentException(
          "Exactly one of translatedSegments or translatedText is required");
    }
    return hasSegments ? new SegmentedText(translatedSegments) : new FullText(translatedText);
  }

  public double durationOrZero() {
    return durationSeconds == null ? 0 : durationSeconds;
  }
}
