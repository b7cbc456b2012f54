package com.scholary.vidsub.layout;

import java.awt.Color;
import java.awt.Graphics2D;

/**
 * Font capability used by layout and rasterization.
 *
 * <p>Implementations are bound to one resolved font and are read-only, so they may be called
 * concurrently from several rendering threads.
 */
public interface GlyphMetrics {

  /**
   * Measure a string that is already in visual order.
   *
   * @param visualText glyphs in left-to-right drawing order
   * @param strokeWidth outline width the renderer will draw around the glyphs
   * @return the bounding box, inflated by the stroke
   */
  TextBounds measure(String visualText, float strokeWidth);

  /** Whether the font has glyphs for every character of {@code text}. */
  boolean canDisplay(String text);

  /**
   * Draw a visual-order string: outline first, fill on top.
   *
   * @param graphics target surface
   * @param visualText glyphs in left-to-right drawing order
   * @param x left edge of the text box
   * @param baselineY baseline position
   * @param fill glyph fill colour
   * @param outline outline colour
   * @param outlineWidth outline stroke width, zero for none
   */
  void draw(
      Graphics2D graphics,
      String visualText,
      float x,
      float baselineY,
      Color fill,
      Color outline,
      float outlineWidth);

  /** Name of the font resource backing these metrics, for diagnostics. */
  String fontName();
}
