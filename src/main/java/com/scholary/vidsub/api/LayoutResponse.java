package com.scholary.vidsub.api;

import java.util.List;

/**
 * Reconciled subtitles with their on-screen geometry.
 *
 * <p>Panel coordinates are canvas pixels; line coordinates are relative to the panel.
 */
public record LayoutResponse(int canvasWidth, int canvasHeight, List<BlockView> blocks) {

  public record BlockView(
      double start,
      double end,
      String text,
      int panelX,
      int panelY,
      int panelWidth,
      int panelHeight,
      List<LineView> lines,
      List<String> overflowingWords) {}

  /**
   * One wrapped line.
   *
   * @param text the line in reading order
   * @param visualText the line in display order, left to right
   */
  public record LineView(String text, String visualText, int x, int y, int width, int height) {}
}
