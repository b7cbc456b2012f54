package com.scholary.vidsub.whisper;

import java.nio.file.Path;

/**
 * Interface for transcription services.
 *
 * <p>This abstraction allows us to swap transcription providers (Groq, OpenAI, a local
 * faster-whisper server) without changing the subtitle pipeline.
 */
public interface TranscriptionService {

  /**
   * Transcribe an audio file.
   *
   * @param audioFile the extracted audio track
   * @return the transcript, with segments when the provider supplies timing
   * @throws WhisperException if the service is unreachable or returns a malformed response
   */
  Transcript transcribe(Path audioFile);
}
