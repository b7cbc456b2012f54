package com.scholary.vidsub.service;

/** How the subtitle track is put onto the video. */
public enum OutputMode {
  /** Write an SRT file and burn it in with ffmpeg's subtitles filter. */
  BURN_SRT,
  /** Rasterize each block to a PNG and composite the images with timed overlays. */
  RASTER_OVERLAY
}
