package com.scholary.vidsub.layout;

import java.util.List;

/** Result of wrapping one subtitle text. */
public record LineLayout(List<Line> lines, List<LayoutOverflowWarning> warnings) {

  public LineLayout {
    lines = List.copyOf(lines);
    warnings = List.copyOf(warnings);
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  public boolean hasOverflow() {
    return !warnings.isEmpty();
  }

  /** The wrapped text in reading order, one line per row. */
  public String logicalText() {
    return String.join("\n", lines.stream().map(Line::logicalText).toList());
  }
}
