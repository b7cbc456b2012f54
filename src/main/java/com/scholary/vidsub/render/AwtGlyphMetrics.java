package com.scholary.vidsub.render;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.vidsub.layout.GlyphMetrics;
import com.scholary.vidsub.layout.TextBounds;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.Shape;
import java.awt.font.FontRenderContext;
import java.awt.font.GlyphVector;
import java.awt.font.LineMetrics;

/**
 * {@link GlyphMetrics} backed by a Java2D {@link Font}.
 *
 * <p>Text arrives in visual order, so glyphs are laid out strictly left to right with no further
 * bidi processing. Outlines are stroked at twice the outline width and then filled over, leaving
 * exactly {@code outlineWidth} pixels of outline outside each glyph.
 *
 * <p>Measurements are cached in a bounded Caffeine cache; the font itself is immutable, so the
 * instance is safe for concurrent use.
 */
public class AwtGlyphMetrics implements GlyphMetrics {

  private static final FontRenderContext FRC = new FontRenderContext(null, true, true);

  private final Font font;
  private final Cache<String, TextBounds> measurements;

  public AwtGlyphMetrics(Font font, int cacheSize) {
    this.font = font;
    this.measurements = Caffeine.newBuilder().maximumSize(cacheSize).build();
  }

  @Override
  public TextBounds measure(String visualText, float strokeWidth) {
    return measurements.get(strokeWidth + "|" + visualText, k -> compute(visualText, strokeWidth));
  }

  private TextBounds compute(String visualText, float strokeWidth) {
    LineMetrics lineMetrics = font.getLineMetrics(visualText, FRC);
    double advance = visualText.isEmpty() ? 0 : layout(visualText).getLogicalBounds().getWidth();

    int width = (int) Math.ceil(advance + 2 * strokeWidth);
    int height = (int) Math.ceil(lineMetrics.getAscent() + lineMetrics.getDescent() + 2 * strokeWidth);
    int ascent = (int) Math.ceil(lineMetrics.getAscent() + strokeWidth);
    return new TextBounds(width, height, ascent);
  }

  @Override
  public boolean canDisplay(String text) {
    return font.canDisplayUpTo(text) == -1;
  }

  @Override
  public void draw(
      Graphics2D graphics,
      String visualText,
      float x,
      float baselineY,
      Color fill,
      Color outline,
      float outlineWidth) {
    if (visualText.isEmpty()) {
      return;
    }
    Shape glyphs = layout(visualText).getOutline(x + outlineWidth, baselineY);

    if (outlineWidth > 0) {
      graphics.setColor(outline);
      graphics.setStroke(
          new BasicStroke(2 * outlineWidth, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
      graphics.draw(glyphs);
    }
    graphics.setColor(fill);
    graphics.fill(glyphs);
  }

  @Override
  public String fontName() {
    return font.getFontName();
  }

  private GlyphVector layout(String visualText) {
    char[] chars = visualText.toCharArray();
    return font.layoutGlyphVector(FRC, chars, 0, chars.length, Font.LAYOUT_LEFT_TO_RIGHT);
  }
}
