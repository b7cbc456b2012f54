package com.scholary.vidsub.service;

import com.scholary.vidsub.segment.Segment;
import java.nio.file.Path;
import java.util.List;

/**
 * Result of subtitling a video.
 *
 * @param output the re-encoded video; the caller owns and deletes it
 * @param segments translated segments with the original timing
 * @param originalText the source-language transcript
 * @param mode how the subtitles were composited
 */
public record SubtitledVideo(
    Path output, List<Segment> segments, String originalText, OutputMode mode) {}
