package com.scholary.vidsub.reconcile;

import com.scholary.vidsub.SubtitleEngineException;

/** Transcription produced no usable text, so there is nothing to subtitle. */
public class EmptyTranscriptException extends SubtitleEngineException {

  public EmptyTranscriptException(String message) {
    super(message);
  }
}
