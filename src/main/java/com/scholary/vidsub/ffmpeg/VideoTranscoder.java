package com.scholary.vidsub.ffmpeg;

import com.scholary.vidsub.render.RasterOverlay;
import java.nio.file.Path;
import java.util.List;

/**
 * Video probing, audio extraction and subtitle compositing.
 *
 * <p>All methods block until the external tool exits and throw {@link TranscoderException} on
 * failure.
 */
public interface VideoTranscoder {

  /** Read duration and frame size. */
  VideoInfo probe(Path video);

  /** Extract the audio track into {@code audioOut} for transcription. */
  Path extractAudio(Path video, Path audioOut);

  /**
   * Burn an SRT file into the video and re-encode it.
   *
   * @param frameHeight video height in pixels, used to scale the subtitle style
   */
  Path burnSubtitles(Path video, Path srtFile, Path output, int frameHeight);

  /** Composite positioned subtitle images, each visible during its own time window. */
  Path overlaySubtitles(Path video, List<RasterOverlay> overlays, Path output);
}
