package com.scholary.vidsub.translation;

/**
 * Exception thrown when translation API calls fail.
 *
 * <p>Covers transport errors, non-200 responses and responses that cannot be parsed. Calls are not
 * retried.
 */
public class TranslationException extends RuntimeException {

  public TranslationException(String message) {
    super(message);
  }

  public TranslationException(String message, Throwable cause) {
    super(message, cause);
  }
}
