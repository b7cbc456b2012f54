package com.scholary.vidsub.ffmpeg;

/**
 * Exception thrown when an ffmpeg or ffprobe invocation fails.
 *
 * <p>The message carries the tail of the tool's output, capped so it can be shown to a user.
 */
public class TranscoderException extends RuntimeException {

  public TranscoderException(String message) {
    super(message);
  }

  public TranscoderException(String message, Throwable cause) {
    super(message, cause);
  }
}
