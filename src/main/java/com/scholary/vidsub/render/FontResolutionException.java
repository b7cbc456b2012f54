package com.scholary.vidsub.render;

import com.scholary.vidsub.SubtitleEngineException;

/**
 * No usable font has glyphs for the text's script.
 *
 * <p>Fatal for the block being rendered. The caller may retry with a different font resource.
 */
public class FontResolutionException extends SubtitleEngineException {

  public FontResolutionException(String message) {
    super(message);
  }

  public FontResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
