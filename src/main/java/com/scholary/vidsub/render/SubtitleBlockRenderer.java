package com.scholary.vidsub.render;

import com.scholary.vidsub.layout.GlyphMetrics;
import com.scholary.vidsub.layout.Line;
import com.scholary.vidsub.layout.LineLayout;
import com.scholary.vidsub.layout.LineWrapper;
import com.scholary.vidsub.segment.Segment;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns a segment into a positioned {@link SubtitleBlock}.
 *
 * <p>Geometry:
 *
 * <ul>
 *   <li>panel width = widest line + 2 * horizontal padding, clamped to the canvas width
 *   <li>panel height = sum of line heights + vertical padding above, between and below lines
 *   <li>each line sits at x = panel width - horizontal padding - line width (right-aligned for
 *       every script)
 *   <li>the panel is centred horizontally, {@code bottomMargin} pixels above the bottom edge
 * </ul>
 *
 * <p>Stateless apart from the injected font capability, so blocks for different segments can be
 * rendered concurrently.
 */
@Component
public class SubtitleBlockRenderer {

  private final GlyphMetrics metrics;
  private final LayoutProperties properties;
  private final LineWrapper lineWrapper;

  public SubtitleBlockRenderer(GlyphMetrics metrics, LayoutProperties properties) {
    this.metrics = metrics;
    this.properties = properties;
    this.lineWrapper = new LineWrapper(metrics, properties.strokeWidth());
  }

  /**
   * Wrap a segment's text and place it on the canvas.
   *
   * @throws FontResolutionException if the font has no glyphs for part of the text
   */
  public SubtitleBlock render(Segment segment, Canvas canvas) {
    verifyGlyphCoverage(segment.text());
    LineLayout layout = lineWrapper.wrap(segment.text(), maxLineWidth(canvas));
    return layoutBlock(segment, layout.lines(), canvas);
  }

  /** Wrap a segment's text without placing it, e.g. to inspect overflow warnings. */
  public LineLayout wrap(Segment segment, Canvas canvas) {
    verifyGlyphCoverage(segment.text());
    return lineWrapper.wrap(segment.text(), maxLineWidth(canvas));
  }

  /** Size the panel around already wrapped lines and anchor it bottom-centre. */
  public SubtitleBlock layoutBlock(Segment segment, List<Line> lines, Canvas canvas) {
    int hPad = properties.horizontalPadding();
    int vPad = properties.verticalPadding();

    if (lines.isEmpty()) {
      return new SubtitleBlock(segment, lines, 0, 0, canvas.width() / 2, canvas.height(), hPad, vPad);
    }

    int maxLineWidth = lines.stream().mapToInt(Line::width).max().orElse(0);
    int panelWidth = Math.min(maxLineWidth + 2 * hPad, canvas.width());
    int panelHeight = vPad;
    for (Line line : lines) {
      panelHeight += line.height() + vPad;
    }

    int panelX = (canvas.width() - panelWidth) / 2;
    int panelY = canvas.height() - properties.bottomMargin() - panelHeight;

    return new SubtitleBlock(segment, lines, panelWidth, panelHeight, panelX, panelY, hPad, vPad);
  }

  /** Widest line that fits inside the panel once side margins and padding are taken off. */
  public int maxLineWidth(Canvas canvas) {
    int available =
        canvas.width() - 2 * properties.sideMargin() - 2 * properties.horizontalPadding();
    return Math.max(1, available);
  }

  private void verifyGlyphCoverage(String text) {
    if (text == null || text.isBlank() || metrics.canDisplay(text)) {
      return;
    }
    int firstMissing =
        text.codePoints()
            .filter(cp -> !Character.isWhitespace(cp) && !metrics.canDisplay(Character.toString(cp)))
            .findFirst()
            .orElse(text.codePointAt(0));
    throw new FontResolutionException(
        String.format(
            "Font '%s' has no glyph for U+%04X in subtitle text",
            metrics.fontName(), firstMissing));
  }
}
