package com.scholary.vidsub.service;

import com.scholary.vidsub.ffmpeg.VideoInfo;
import com.scholary.vidsub.ffmpeg.VideoTranscoder;
import com.scholary.vidsub.logging.StructuredLogger;
import com.scholary.vidsub.reconcile.EmptyTranscriptException;
import com.scholary.vidsub.reconcile.ReconciliationException;
import com.scholary.vidsub.reconcile.TranslationUnit.FullText;
import com.scholary.vidsub.reconcile.TranslationUnit.SegmentedText;
import com.scholary.vidsub.render.Canvas;
import com.scholary.vidsub.render.RasterOverlay;
import com.scholary.vidsub.render.SubtitleBlock;
import com.scholary.vidsub.render.SubtitleRasterizer;
import com.scholary.vidsub.segment.Segment;
import com.scholary.vidsub.translation.TranslationService;
import com.scholary.vidsub.whisper.Transcript;
import com.scholary.vidsub.whisper.TranscriptionService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Subtitles a short video end to end.
 *
 * <p>Stages:
 *
 * <ol>
 *   <li>Probe the video and reject anything longer than the configured maximum
 *   <li>Extract audio and transcribe it
 *   <li>Translate, preferring one translated entry per segment
 *   <li>Reconcile the translation with the segment timing
 *   <li>Lay out one subtitle block per segment
 *   <li>Burn an SRT track or composite rendered overlays, re-encoding the video
 * </ol>
 *
 * <p>Intermediate files live in a per-job working directory that is always deleted. The output
 * video is written next to it and handed to the caller.
 */
@Service
public class VideoSubtitlingService {

  private static final Logger LOGGER = LoggerFactory.getLogger(VideoSubtitlingService.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final VideoTranscoder transcoder;
  private final TranscriptionService transcriptionService;
  private final TranslationService translationService;
  private final SubtitleEngine engine;
  private final SubtitleWriter subtitleWriter;
  private final SubtitleRasterizer rasterizer;
  private final PipelineProperties properties;
  private final Path tempDir;

  public VideoSubtitlingService(
      VideoTranscoder transcoder,
      TranscriptionService transcriptionService,
      TranslationService translationService,
      SubtitleEngine engine,
      SubtitleWriter subtitleWriter,
      SubtitleRasterizer rasterizer,
      PipelineProperties properties) {
    this.transcoder = transcoder;
    this.transcriptionService = transcriptionService;
    this.translationService = translationService;
    this.engine = engine;
    this.subtitleWriter = subtitleWriter;
    this.rasterizer = rasterizer;
    this.properties = properties;
    this.tempDir = Paths.get(properties.tempDir());

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create temp directory: " + tempDir, e);
    }
  }

  /** Subtitle a video with the configured output mode. */
  public SubtitledVideo subtitle(Path video) throws IOException {
    return subtitle(video, properties.outputMode());
  }

  /**
   * Subtitle a video.
   *
   * @param video the source video
   * @param mode burn an SRT track or composite raster overlays
   * @return the subtitled video and the data it was built from
   * @throws VideoTooLongException if the video exceeds the maximum duration
   * @throws EmptyTranscriptException if nothing intelligible was said
   */
  public SubtitledVideo subtitle(Path video, OutputMode mode) throws IOException {
    String correlationId = UUID.randomUUID().toString();
    StructuredLogger.setJobContext(correlationId, video.getFileName().toString());

    Path workDir = null;
    try {
      workDir = Files.createTempDirectory(tempDir, "job-");
      LOGGER.info("Starting subtitle job: video={}, mode={}", video.getFileName(), mode);

      long stageStart = System.currentTimeMillis();
      VideoInfo info = transcoder.probe(video);
      if (info.durationSeconds() > properties.maxDurationSeconds()) {
        throw new VideoTooLongException(info.durationSeconds(), properties.maxDurationSeconds());
      }

      Path audio = transcoder.extractAudio(video, workDir.resolve("audio.ogg"));
      structuredLogger.logStageFinished("extract-audio", System.currentTimeMillis() - stageStart);

      stageStart = System.currentTimeMillis();
      Transcript transcript = transcriptionService.transcribe(audio);
      if (transcript.isBlank()) {
        throw new EmptyTranscriptException("No speech found to transcribe");
      }
      structuredLogger.logStageFinished("transcribe", System.currentTimeMillis() - stageStart);

      stageStart = System.currentTimeMillis();
      List<Segment> translated = translate(transcript, info.durationSeconds());
      structuredLogger.logStageFinished("translate", System.currentTimeMillis() - stageStart);

      stageStart = System.currentTimeMillis();
      List<SubtitleBlock> blocks =
          engine.renderBlocks(translated, new Canvas(info.width(), info.height()));
      structuredLogger.logStageFinished("layout", System.currentTimeMillis() - stageStart);
      if (blocks.stream().allMatch(SubtitleBlock::isEmpty)) {
        throw new EmptyTranscriptException("Translation produced no subtitle text");
      }

      stageStart = System.currentTimeMillis();
      Path output = tempDir.resolve(correlationId + "_subbed.mp4");
      compose(video, info, blocks, workDir, output, mode);
      structuredLogger.logStageFinished("compose", System.currentTimeMillis() - stageStart);

      LOGGER.info("Subtitle job finished: {} segments, output={}", translated.size(), output);
      return new SubtitledVideo(output, translated, transcript.text(), mode);
    } finally {
      deleteRecursively(workDir);
      StructuredLogger.clearJobContext();
    }
  }

  /**
   * Translate and reconcile.
   *
   * <p>Segment-aligned translation is tried first. If its length does not match, the full text is
   * translated and split into sentences instead (degraded mode). A transcript without timing is
   * translated as a whole and shown for the entire video.
   */
  List<Segment> translate(Transcript transcript, double durationSeconds) {
    if (!transcript.hasTiming()) {
      LOGGER.warn("Transcript has no segment timing; showing the whole translation throughout");
      FullText fullText = translationService.translateText(transcript.text());
      return engine.reconcile(List.of(), fullText, durationSeconds);
    }

    List<String> sourceTexts = transcript.segments().stream().map(Segment::text).toList();
    SegmentedText segmented = translationService.translateSegments(sourceTexts);
    try {
      return engine.reconcile(transcript.segments(), segmented, durationSeconds);
    } catch (ReconciliationException e) {
      LOGGER.warn(
          "{}; falling back to sentence-split full-text translation (degraded mode)",
          e.getMessage());
      String sourceText =
          transcript.text().isBlank() ? String.join(" ", sourceTexts) : transcript.text();
      FullText fullText = translationService.translateText(sourceText);
      return engine.reconcile(transcript.segments(), fullText, durationSeconds);
    }
  }

  private void compose(
      Path video,
      VideoInfo info,
      List<SubtitleBlock> blocks,
      Path workDir,
      Path output,
      OutputMode mode)
      throws IOException {
    if (mode == OutputMode.BURN_SRT) {
      Path srt = subtitleWriter.writeSrtFile(blocks, workDir.resolve("subtitles.srt"));
      transcoder.burnSubtitles(video, srt, output, info.height());
      return;
    }

    List<RasterOverlay> overlays = rasterizer.writeOverlays(blocks, workDir.resolve("overlays"));
    transcoder.overlaySubtitles(video, overlays, output);
  }

  private static void deleteRecursively(Path dir) {
    if (dir == null) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(VideoSubtitlingService::deleteFile);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up working directory {}: {}", dir, e.getMessage());
    }
  }

  private static void deleteFile(Path path) {
    try {
      Files.deleteIfExists(path);
      LOGGER.debug("Cleaned up temporary file: {}", path);
    } catch (IOException e) {
      LOGGER.warn("Error during cleanup of {}: {}", path, e.getMessage());
    }
  }
}
