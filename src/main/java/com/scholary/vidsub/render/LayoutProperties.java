package com.scholary.vidsub.render;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.awt.Color;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for subtitle block geometry and colours.
 *
 * <p>Colours are hex strings, {@code #RRGGBB} or {@code #AARRGGBB}. The panel colour should carry
 * some transparency so the video stays visible behind it.
 */
@ConfigurationProperties(prefix = "subtitles.layout")
@Validated
public record LayoutProperties(
    @Positive float fontSize,
    @PositiveOrZero float strokeWidth,
    @PositiveOrZero int horizontalPadding,
    @PositiveOrZero int verticalPadding,
    @PositiveOrZero int bottomMargin,
    @PositiveOrZero int sideMargin,
    @NotBlank String panelColor,
    @NotBlank String textColor,
    @NotBlank String outlineColor) {

  public Color panel() {
    return parseColor(panelColor);
  }

  public Color text() {
    return parseColor(textColor);
  }

  public Color outline() {
    return parseColor(outlineColor);
  }

  /**
   * Parse {@code #RRGGBB} (opaque) or {@code #AARRGGBB}.
   *
   * @throws IllegalArgumentException for any other format
   */
  static Color parseColor(String hex) {
    String value = hex.trim();
    if (value.startsWith("#")) {
      value = value.substring(1);
    }
    try {
      if (value.length() == 6) {
        return new Color(Integer.parseInt(value, 16));
      }
      if (value.length() == 8) {
        return new Color((int) Long.parseLong(value, 16), true);
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid colour: " + hex, e);
    }
    throw new IllegalArgumentException("Invalid colour: " + hex);
  }
}
