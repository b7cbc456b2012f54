package com.scholary.vidsub.render;

import com.scholary.vidsub.layout.GlyphMetrics;
import com.scholary.vidsub.layout.Line;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Paints subtitle blocks into ARGB images for overlay compositing.
 *
 * <p>Each image is exactly the panel: a semi-opaque fill, then every line drawn as an outlined
 * glyph run at the block's right-aligned offsets.
 */
@Component
public class SubtitleRasterizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleRasterizer.class);

  private final GlyphMetrics metrics;
  private final LayoutProperties properties;

  public SubtitleRasterizer(GlyphMetrics metrics, LayoutProperties properties) {
    this.metrics = metrics;
    this.properties = properties;
  }

  /**
   * Paint one block.
   *
   * @throws IllegalArgumentException if the block has no lines
   */
  public BufferedImage rasterize(SubtitleBlock block) {
    if (block.isEmpty()) {
      throw new IllegalArgumentException("Cannot rasterize an empty subtitle block");
    }

    BufferedImage image =
        new BufferedImage(block.panelWidth(), block.panelHeight(), BufferedImage.TYPE_INT_ARGB);
    Graphics2D g2d = image.createGraphics();
    try {
      g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      g2d.setRenderingHint(
          RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
      g2d.setRenderingHint(
          RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
      g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);

      g2d.setColor(properties.panel());
      g2d.fillRect(0, 0, block.panelWidth(), block.panelHeight());

      for (int i = 0; i < block.lines().size(); i++) {
        Line line = block.lines().get(i);
        metrics.draw(
            g2d,
            line.text(),
            block.lineX(i),
            block.lineY(i) + line.ascent(),
            properties.text(),
            properties.outline(),
            properties.strokeWidth());
      }
    } finally {
      g2d.dispose();
    }
    return image;
  }

  /**
   * Paint blocks to PNG files in {@code directory}, skipping blocks without text.
   *
   * @return one overlay per non-empty block, in block order, indexed from 1
   */
  public List<RasterOverlay> writeOverlays(List<SubtitleBlock> blocks, Path directory)
      throws IOException {
    Files.createDirectories(directory);
    List<RasterOverlay> overlays = new ArrayList<>();

    int index = 1;
    for (SubtitleBlock block : blocks) {
      if (block.isEmpty()) {
        continue;
      }
      Path file = directory.resolve(String.format("subtitle_%04d.png", index));
      if (!ImageIO.write(rasterize(block), "PNG", file.toFile())) {
        throw new IOException("No PNG writer available for " + file);
      }
      overlays.add(
          new RasterOverlay(
              index,
              file,
              block.panelX(),
              block.panelY(),
              block.segment().start(),
              block.segment().end()));
      index++;
    }

    LOGGER.info("Wrote {} subtitle overlays to {}", overlays.size(), directory);
    return overlays;
  }
}
