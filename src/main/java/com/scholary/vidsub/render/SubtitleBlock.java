package com.scholary.vidsub.render;

import com.scholary.vidsub.layout.Line;
import com.scholary.vidsub.segment.Segment;
import java.util.List;

/**
 * A laid-out subtitle: wrapped lines inside a sized background panel, placed on the canvas.
 *
 * <p>Lines are right-aligned inside the panel and stacked top to bottom with {@code
 * verticalPadding} above, between and below them. Coordinates of lines are relative to the panel;
 * {@code panelX}/{@code panelY} place the panel on the canvas.
 */
public record SubtitleBlock(
    Segment segment,
    List<Line> lines,
    int panelWidth,
    int panelHeight,
    int panelX,
    int panelY,
    int horizontalPadding,
    int verticalPadding) {

  public SubtitleBlock {
    lines = List.copyOf(lines);
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  /** Left edge of line {@code index} inside the panel. */
  public int lineX(int index) {
    return panelWidth - horizontalPadding - lines.get(index).width();
  }

  /** Top edge of line {@code index} inside the panel. */
  public int lineY(int index) {
    int y = verticalPadding;
    for (int i = 0; i < index; i++) {
      y += lines.get(i).height() + verticalPadding;
    }
    return y;
  }

  /** The block's text in reading order, one wrapped line per row. */
  public String logicalText() {
    return String.join("\n", lines.stream().map(Line::logicalText).toList());
  }
}
