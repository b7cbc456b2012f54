package com.scholary.vidsub.render;

import java.nio.file.Path;

/**
 * A rendered subtitle image with its placement and display window.
 *
 * @param index 1-based position in the subtitle track
 * @param image PNG file holding the panel and text
 * @param x left edge on the video frame
 * @param y top edge on the video frame
 * @param start first second the overlay is shown
 * @param end second the overlay disappears
 */
public record RasterOverlay(int index, Path image, int x, int y, double start, double end) {

  public double duration() {
    return end - start;
  }
}
