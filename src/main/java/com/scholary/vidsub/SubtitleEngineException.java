package com.scholary.vidsub;

/**
 * Base type for failures raised by the subtitle synchronization and layout engine.
 *
 * <p>Unchecked, like the rest of the service's exceptions: callers that can recover (count
 * mismatch, font fallback) catch the concrete subtype, everything else propagates to the API layer.
 */
public class SubtitleEngineException extends RuntimeException {

  public SubtitleEngineException(String message) {
    super(message);
  }

  public SubtitleEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
