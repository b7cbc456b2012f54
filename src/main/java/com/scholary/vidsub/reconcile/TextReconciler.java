package com.scholary.vidsub.reconcile;

import com.scholary.vidsub.logging.StructuredLogger;
import com.scholary.vidsub.reconcile.TranslationUnit.FullText;
import com.scholary.vidsub.reconcile.TranslationUnit.SegmentedText;
import com.scholary.vidsub.segment.Segment;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps translated text back onto the original, time-coded segments.
 *
 * <p>Policy by input shape:
 *
 * <ul>
 *   <li>{@link SegmentedText} with one entry per segment: entry <i>i</i> replaces the text of
 *       segment <i>i</i>. This is the only exact alignment.
 *   <li>{@link SegmentedText} with a different count: {@link ReconciliationException} with kind
 *       {@code COUNT_MISMATCH}. Nothing is truncated or padded, the caller picks the fallback.
 *   <li>{@link FullText}: sentence chunks are dealt out to segments in order (degraded mode, see
 *       {@link #reconcileFullText}).
 *   <li>No segments at all: one segment spanning the whole video carries the whole translation.
 * </ul>
 *
 * <p>Output always has the input's length, order and timings. Chunk assignment is sequential and
 * must not be parallelised.
 */
@Component
public class TextReconciler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TextReconciler.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /**
   * Reconcile a translation with segments that are known to exist.
   *
   * @throws IllegalArgumentException if {@code segments} is empty; use {@link #reconcile(List,
   *     TranslationUnit, double)} when the transcript may lack timing
   */
  public List<Segment> reconcile(List<Segment> segments, TranslationUnit translation) {
    if (segments.isEmpty()) {
      throw new IllegalArgumentException(
          "Transcript has no segments; a video duration is required for the whole-text fallback");
    }
    return reconcile(segments, translation, 0.0);
  }

  /**
   * Reconcile a translation with the original segments.
   *
   * @param segments original segments in chronological order, possibly empty
   * @param translation the translated text
   * @param durationSeconds video duration, used only when {@code segments} is empty
   * @return translated segments with the original timings
   * @throws ReconciliationException if a segmented translation has the wrong length
   * @throws EmptyTranscriptException if the translation holds no text
   */
  public List<Segment> reconcile(
      List<Segment> segments, TranslationUnit translation, double durationSeconds) {
    if (segments.isEmpty()) {
      return wholeText(joined(translation), durationSeconds);
    }
    if (translation instanceof SegmentedText) {
      return reconcileSegmented(segments, (SegmentedText) translation);
    }
    if (translation instanceof FullText) {
      return reconcileFullText(segments, (FullText) translation);
    }
    throw new IllegalArgumentException(
        "Unsupported translation type: " + translation.getClass().getName());
  }

  /** Map a segment-aligned translation one to one. */
  public List<Segment> reconcileSegmented(List<Segment> segments, SegmentedText translation) {
    if (translation.size() != segments.size()) {
      throw ReconciliationException.countMismatch(segments.size(), translation.size());
    }

    structuredLogger.logReconciliation("exact", segments.size(), translation.size());

    List<Segment> reconciled = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      reconciled.add(segments.get(i).withText(translation.entries().get(i)));
    }
    return reconciled;
  }

  /**
   * Deal sentence chunks of a single translated block out to the segments in order.
   *
   * <p>Degraded mode: the chunk-to-segment correspondence is approximate. When chunks run out, each
   * remaining segment repeats the last assigned chunk (logged). When there are more chunks than
   * segments, the surplus is appended to the last segment so no translated text is lost.
   */
  public List<Segment> reconcileFullText(List<Segment> segments, FullText translation) {
    List<String> chunks = SentenceSplitter.split(translation.text());
    if (chunks.isEmpty()) {
      throw new EmptyTranscriptException("Translation contains no text");
    }

    structuredLogger.logReconciliation("sentence-split", segments.size(), chunks.size());

    List<Segment> reconciled = new ArrayList<>(segments.size());
    String lastAssigned = null;

    for (int i = 0; i < segments.size(); i++) {
      String text;
      if (i < chunks.size()) {
        text = chunks.get(i);
        lastAssigned = text;
      } else {
        text = lastAssigned;
        structuredLogger.logChunkRepeated(i, chunks.size(), text);
      }
      reconciled.add(segments.get(i).withText(text));
    }

    if (chunks.size() > segments.size()) {
      int lastIndex = reconciled.size() - 1;
      String surplus = String.join(" ", chunks.subList(segments.size(), chunks.size()));
      LOGGER.warn(
          "Degraded mode: {} surplus chunks appended to the last segment",
          chunks.size() - segments.size());
      Segment last = reconciled.get(lastIndex);
      reconciled.set(lastIndex, last.withText(last.text() + " " + surplus));
    }

    return reconciled;
  }

  /**
   * Collapse to a single segment spanning the whole video.
   *
   * @param text the entire translated text
   * @param durationSeconds the video duration, supplied by the caller
   */
  public List<Segment> wholeText(String text, double durationSeconds) {
    if (text == null || text.isBlank()) {
      throw new EmptyTranscriptException("Translation contains no text");
    }
    if (durationSeconds <= 0) {
      throw new IllegalArgumentException(
          "Video duration must be positive for the whole-text fallback: " + durationSeconds);
    }

    structuredLogger.logReconciliation("whole-text", 0, 1);
    return List.of(new Segment(0.0, durationSeconds, text.trim()));
  }

  private static String joined(TranslationUnit translation) {
    if (translation instanceof FullText) {
      return ((FullText) translation).text();
    }
    if (translation instanceof SegmentedText) {
      return String.join(" ", ((SegmentedText) translation).entries());
    }
    throw new IllegalArgumentException(
        "Unsupported translation type: " + translation.getClass().getName());
  }
}
