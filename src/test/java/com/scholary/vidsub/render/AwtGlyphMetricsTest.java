package com.scholary.vidsub.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.scholary.vidsub.layout.TextBounds;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AwtGlyphMetricsTest {

  private AwtGlyphMetrics metrics;

  @BeforeEach
  void setUp() {
    metrics = new AwtGlyphMetrics(new Font(Font.DIALOG, Font.PLAIN, 20), 100);
    assumeTrue(fontsAvailable(), "No fonts installed on this host");
  }

  @Test
  void measure_shouldGrowWithText() {
    TextBounds shorter = metrics.measure("Hi", 0f);
    TextBounds longer = metrics.measure("Hello there", 0f);

    assertThat(shorter.width()).isPositive();
    assertThat(longer.width()).isGreaterThan(shorter.width());
    assertThat(longer.height()).isEqualTo(shorter.height());
    assertThat(shorter.ascent()).isLessThanOrEqualTo(shorter.height());
  }

  @Test
  void measure_shouldIncludeStrokeOnBothSides() {
    TextBounds plain = metrics.measure("Hello", 0f);
    TextBounds stroked = metrics.measure("Hello", 2f);

    assertThat(stroked.width() - plain.width()).isBetween(3, 5);
    assertThat(stroked.height() - plain.height()).isBetween(3, 5);
  }

  @Test
  void measure_shouldReturnCachedBounds() {
    assertThat(metrics.measure("cached", 1f)).isSameAs(metrics.measure("cached", 1f));
  }

  @Test
  void draw_shouldPaintInsideMeasuredBox() {
    TextBounds bounds = metrics.measure("Hello", 2f);
    BufferedImage image =
        new BufferedImage(bounds.width(), bounds.height(), BufferedImage.TYPE_INT_ARGB);
    Graphics2D g2d = image.createGraphics();
    try {
      metrics.draw(g2d, "Hello", 0, bounds.ascent(), Color.WHITE, Color.BLACK, 2f);
    } finally {
      g2d.dispose();
    }

    boolean painted = false;
    for (int x = 0; x < image.getWidth() && !painted; x++) {
      for (int y = 0; y < image.getHeight() && !painted; y++) {
        painted = (image.getRGB(x, y) >>> 24) != 0;
      }
    }
    assertThat(painted).isTrue();
  }

  @Test
  void canDisplay_shouldAcceptLatinText() {
    assertThat(metrics.canDisplay("Hello")).isTrue();
    assertThat(metrics.fontName()).isNotBlank();
  }

  private boolean fontsAvailable() {
    try {
      return metrics.measure("A", 0f).width() > 0;
    } catch (RuntimeException | Error e) {
      return false;
    }
  }
}
