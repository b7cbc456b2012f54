package com.scholary.vidsub.layout;

import java.text.Bidi;
import java.util.Map;

/**
 * Converts logical (reading) order text to visual (drawing) order.
 *
 * <p>Runs are resolved with the Unicode bidirectional algorithm ({@link Bidi}). Right-to-left runs
 * have their characters reversed and paired brackets mirrored; left-to-right runs inside them, such
 * as numbers or Latin words, keep their character order. Runs are then placed in visual order.
 */
public final class BidiReorderer {

  private static final Map<Integer, Integer> MIRRORED =
      Map.ofEntries(
          Map.entry((int) '(', (int) ')'),
          Map.entry((int) ')', (int) '('),
          Map.entry((int) '[', (int) ']'),
          Map.entry((int) ']', (int) '['),
          Map.entry((int) '{', (int) '}'),
          Map.entry((int) '}', (int) '{'),
          Map.entry((int) '<', (int) '>'),
          Map.entry((int) '>', (int) '<'),
          Map.entry((int) '«', (int) '»'),
          Map.entry((int) '»', (int) '«'));

  private BidiReorderer() {}

  /**
   * Whether the paragraph direction of {@code text} is right-to-left, judged by its first strong
   * character. Text without strong characters is left-to-right.
   */
  public static boolean isRightToLeft(String text) {
    if (text == null || text.isEmpty()) {
      return false;
    }
    return !new Bidi(text, Bidi.DIRECTION_DEFAULT_LEFT_TO_RIGHT).baseIsLeftToRight();
  }

  /**
   * Reorder one line of text for drawing.
   *
   * @param logical the line in reading order
   * @param rightToLeftBase paragraph direction, shared by every line of a subtitle
   * @return the same characters in left-to-right drawing order
   */
  public static String toVisual(String logical, boolean rightToLeftBase) {
    if (logical == null || logical.isEmpty()) {
      return logical;
    }

    int flags = rightToLeftBase ? Bidi.DIRECTION_RIGHT_TO_LEFT : Bidi.DIRECTION_LEFT_TO_RIGHT;
    Bidi bidi = new Bidi(logical, flags);
    if (bidi.isLeftToRight()) {
      return logical;
    }

    int runCount = bidi.getRunCount();
    byte[] levels = new byte[runCount];
    Object[] runs = new Object[runCount];

    for (int i = 0; i < runCount; i++) {
      String run = logical.substring(bidi.getRunStart(i), bidi.getRunLimit(i));
      int level = bidi.getRunLevel(i);
      levels[i] = (byte) level;
      runs[i] = (level & 1) == 1 ? reverseMirrored(run) : run;
    }

    Bidi.reorderVisually(levels, 0, runs, 0, runCount);

    StringBuilder visual = new StringBuilder(logical.length());
    for (Object run : runs) {
      visual.append((String) run);
    }
    return visual.toString();
  }

  /** Reverse by code point so surrogate pairs stay intact. */
  private static String reverseMirrored(String run) {
    int[] codePoints = run.codePoints().toArray();
    StringBuilder reversed = new StringBuilder(run.length());
    for (int i = codePoints.length - 1; i >= 0; i--) {
      int cp = codePoints[i];
      reversed.appendCodePoint(MIRRORED.getOrDefault(cp, cp));
    }
    return reversed.toString();
  }
}
