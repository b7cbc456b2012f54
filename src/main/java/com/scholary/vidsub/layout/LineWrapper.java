package com.scholary.vidsub.layout;

import com.scholary.vidsub.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy word wrapper that measures the visual rendering of every candidate line.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Split the text on whitespace, keeping reading order
 *   <li>Append words to the current line one at a time and measure its visual rendering, stroke
 *       included
 *   <li>When a word makes the line too wide, close the line with its last fitting rendering and
 *       start the next line with that word
 *   <li>Always emit the last line
 * </ol>
 *
 * <p>Words are never split. A word wider than the maximum becomes its own line and is reported as
 * a {@link LayoutOverflowWarning}. The result depends only on the word sequence, so wrapping the
 * joined lines of a previous result reproduces it.
 */
public class LineWrapper {

  private static final Logger LOGGER = LoggerFactory.getLogger(LineWrapper.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final GlyphMetrics metrics;
  private final float strokeWidth;

  public LineWrapper(GlyphMetrics metrics, float strokeWidth) {
    this.metrics = metrics;
    this.strokeWidth = strokeWidth;
  }

  /**
   * Wrap text to a maximum width.
   *
   * @param logicalText text in reading order
   * @param maxWidth maximum line width in pixels, stroke included
   * @return the lines in top-to-bottom order plus any overflow warnings
   */
  public LineLayout wrap(String logicalText, int maxWidth) {
    if (maxWidth <= 0) {
      throw new IllegalArgumentException("Max width must be positive: " + maxWidth);
    }
    if (logicalText == null || logicalText.isBlank()) {
      return new LineLayout(List.of(), List.of());
    }

    String[] words = logicalText.trim().split("\\s+");
    boolean rightToLeft = BidiReorderer.isRightToLeft(logicalText);

    List<Line> lines = new ArrayList<>();
    List<LayoutOverflowWarning> warnings = new ArrayList<>();

    StringBuilder current = new StringBuilder();
    String currentVisual = null;
    TextBounds currentBounds = null;

    for (String word : words) {
      String candidate = current.length() == 0 ? word : current + " " + word;
      String visual = BidiReorderer.toVisual(candidate, rightToLeft);
      TextBounds bounds = metrics.measure(visual, strokeWidth);

      if (current.length() == 0 || bounds.width() <= maxWidth) {
        current.setLength(0);
        current.append(candidate);
        currentVisual = visual;
        currentBounds = bounds;
      } else {
        lines.add(toLine(current.toString(), currentVisual, currentBounds));

        current.setLength(0);
        current.append(word);
        currentVisual = BidiReorderer.toVisual(word, rightToLeft);
        currentBounds = metrics.measure(currentVisual, strokeWidth);
      }

      // Only a line holding a single word can be over the limit
      if (currentBounds.width() > maxWidth && current.toString().equals(word)) {
        warnings.add(new LayoutOverflowWarning(word, currentBounds.width(), maxWidth));
        structuredLogger.logLayoutOverflow(word, currentBounds.width(), maxWidth);
      }
    }

    lines.add(toLine(current.toString(), currentVisual, currentBounds));

    LOGGER.debug(
        "Wrapped {} words into {} lines (maxWidth={}px, rtl={})",
        words.length,
        lines.size(),
        maxWidth,
        rightToLeft);

    return new LineLayout(lines, warnings);
  }

  private static Line toLine(String logical, String visual, TextBounds bounds) {
    return new Line(visual, logical, bounds.width(), bounds.height(), bounds.ascent());
  }
}
