package com.scholary.vidsub.render;

/** Pixel size of the video frame subtitles are placed on. */
public record Canvas(int width, int height) {

  public Canvas {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException(
          String.format("Canvas dimensions must be positive: %dx%d", width, height));
    }
  }
}
