package com.scholary.vidsub.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets an {@code event_type} plus its own fields for the duration of a single log
 * call, so subtitle jobs can be filtered by event in the log aggregator.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log which reconciliation policy was applied. */
  public void logReconciliation(String mode, int segmentCount, int translatedCount) {
    try {
      MDC.put("event_type", "reconciliation");
      MDC.put("mode", mode);
      MDC.put("segmentCount", String.valueOf(segmentCount));
      MDC.put("translatedCount", String.valueOf(translatedCount));

      logger.info(
          "Reconciliation: mode={}, segments={}, translated={}",
          mode,
          segmentCount,
          translatedCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log a degraded-mode substitution: a segment reuses the last assigned chunk. */
  public void logChunkRepeated(int segmentIndex, int chunkCount, String chunk) {
    try {
      MDC.put("event_type", "degraded_chunk_repeat");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("chunkCount", String.valueOf(chunkCount));

      logger.warn(
          "Degraded mode: segment {} has no chunk of its own ({} chunks), repeating '{}'",
          segmentIndex,
          chunkCount,
          truncate(chunk, 50));
    } finally {
      clearEventFields();
    }
  }

  /** Log a single word that does not fit the maximum line width. */
  public void logLayoutOverflow(String word, int width, int maxWidth) {
    try {
      MDC.put("event_type", "layout_overflow");
      MDC.put("width", String.valueOf(width));
      MDC.put("maxWidth", String.valueOf(maxWidth));

      logger.warn(
          "Layout overflow: word '{}' is {}px wide, max is {}px; emitting as its own line",
          truncate(word, 50),
          width,
          maxWidth);
    } finally {
      clearEventFields();
    }
  }

  /** Log a rendered subtitle block. */
  public void logBlockRendered(
      int segmentIndex, int lineCount, int panelWidth, int panelHeight, double start, double end) {
    try {
      MDC.put("event_type", "block_rendered");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("lineCount", String.valueOf(lineCount));
      MDC.put("panelWidth", String.valueOf(panelWidth));
      MDC.put("panelHeight", String.valueOf(panelHeight));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));

      logger.debug(
          "Block rendered: segment={}, lines={}, panel={}x{}, range=[{}-{}]",
          segmentIndex,
          lineCount,
          panelWidth,
          panelHeight,
          start,
          end);
    } finally {
      clearEventFields();
    }
  }

  /** Log completion of a pipeline stage. */
  public void logStageFinished(String stage, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Stage finished: stage={}, elapsed={}ms", stage, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String correlationId, String videoName) {
    MDC.put("correlationId", correlationId);
    MDC.put("video", videoName);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("correlationId");
    MDC.remove("video");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("mode");
    MDC.remove("segmentCount");
    MDC.remove("translatedCount");
    MDC.remove("segment_index");
    MDC.remove("chunkCount");
    MDC.remove("width");
    MDC.remove("maxWidth");
    MDC.remove("lineCount");
    MDC.remove("panelWidth");
    MDC.remove("panelHeight");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("stage");
    MDC.remove("elapsedMs");
  }

  private static String truncate(String text, int maxLength) {
    if (text == null || text.length() <= maxLength) {
      return text;
    }
    return text.substring(0, maxLength) + "...";
  }
}
