package com.scholary.vidsub.ffmpeg;

import com.scholary.vidsub.render.LayoutProperties;
import java.awt.Color;
import java.util.Locale;

/**
 * Builds the ASS {@code force_style} override for burning an SRT track with libass.
 *
 * <p>ffmpeg converts SRT into a script with a 288 line play resolution, and libass scales every
 * style size by {@code frameHeight / 288}. Sizes are divided by that factor here so the burned text
 * comes out at the same pixel size the line wrapper measured with.
 *
 * <p>{@code WrapStyle=2} turns libass's own wrapping off; only the line breaks written into the SRT
 * apply. {@code BorderStyle=3} draws an opaque box in the outline colour behind each line, which is
 * the closest libass gets to the panel. Lines are centred, not right-aligned, inside it.
 */
public final class AssStyle {

  static final int SCRIPT_PLAY_RES_Y = 288;

  private AssStyle() {}

  public static String forceStyle(LayoutProperties layout, String fontName, int frameHeight) {
    if (frameHeight <= 0) {
      throw new IllegalArgumentException("Frame height must be positive: " + frameHeight);
    }
    double scale = (double) SCRIPT_PLAY_RES_Y / frameHeight;
    return String.join(
        ",",
        "Fontname=" + fontName,
        "FontSize=" + String.format(Locale.ROOT, "%.2f", layout.fontSize() * scale),
        "PrimaryColour=" + toAssColour(layout.text()),
        "OutlineColour=" + toAssColour(layout.panel()),
        "BackColour=" + toAssColour(layout.panel()),
        "BorderStyle=3",
        "Outline=" + String.format(Locale.ROOT, "%.2f", layout.verticalPadding() * scale),
        "Shadow=0",
        "MarginV=" + Math.round(layout.bottomMargin() * scale),
        "Alignment=2",
        "WrapStyle=2");
  }

  /** ASS colours are {@code &HAABBGGRR} with alpha inverted: 00 is opaque. */
  static String toAssColour(Color color) {
    return String.format(
        "&H%02X%02X%02X%02X",
        255 - color.getAlpha(),
        color.getBlue(),
        color.getGreen(),
        color.getRed());
  }
}
