package com.scholary.vidsub.reconcile;

import com.scholary.vidsub.SubtitleEngineException;

/**
 * Thrown when translated text cannot be mapped onto the original segments.
 *
 * <p>Recoverable: the caller can fall back to the whole-text heuristic or abort.
 */
public class ReconciliationException extends SubtitleEngineException {

  public enum Kind {
    COUNT_MISMATCH
  }

  private final Kind kind;
  private final int expected;
  private final int actual;

  private ReconciliationException(Kind kind, int expected, int actual, String message) {
    super(message);
    this.kind = kind;
    this.expected = expected;
    this.actual = actual;
  }

  public static ReconciliationException countMismatch(int expected, int actual) {
    return new ReconciliationException(
        Kind.COUNT_MISMATCH,
        expected,
        actual,
        String.format(
            "Translated segment count mismatch: expected %d, got %d", expected, actual));
  }

  public Kind getKind() {
    return kind;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
