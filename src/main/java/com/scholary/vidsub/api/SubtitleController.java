package com.scholary.vidsub.api;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.scholary.vidsub.api.LayoutResponse.BlockView;
import com.scholary.vidsub.api.LayoutResponse.LineView;
import com.scholary.vidsub.layout.LayoutOverflowWarning;
import com.scholary.vidsub.layout.Line;
import com.scholary.vidsub.layout.LineLayout;
import com.scholary.vidsub.render.Canvas;
import com.scholary.vidsub.render.SubtitleBlock;
import com.scholary.vidsub.render.SubtitleBlockRenderer;
import com.scholary.vidsub.segment.Segment;
import com.scholary.vidsub.service.OutputMode;
import com.scholary.vidsub.service.PipelineProperties;
import com.scholary.vidsub.service.SubtitleEngine;
import com.scholary.vidsub.service.SubtitleWriter;
import com.scholary.vidsub.service.SubtitledVideo;
import com.scholary.vidsub.service.VideoSubtitlingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for subtitle generation.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Reconciling a translation with timed segments and rendering it as SRT or WebVTT
 *   <li>Previewing the on-screen layout of each subtitle block
 *   <li>Subtitling an uploaded video end to end (synchronous, the video is short)
 * </ul>
 */
@RestController
@Tag(name = "Subtitles", description = "Translated subtitle reconciliation, layout and burn-in API")
public class SubtitleController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleController.class);

  private static final MediaType SRT = new MediaType("application", "x-subrip", UTF_8);
  private static final MediaType VTT = new MediaType("text", "vtt", UTF_8);
  private static final MediaType MP4 = new MediaType("video", "mp4");

  private final SubtitleEngine engine;
  private final SubtitleBlockRenderer renderer;
  private final SubtitleWriter subtitleWriter;
  private final VideoSubtitlingService videoSubtitlingService;
  private final Path tempDir;

  public SubtitleController(
      SubtitleEngine engine,
      SubtitleBlockRenderer renderer,
      SubtitleWriter subtitleWriter,
      VideoSubtitlingService videoSubtitlingService,
      PipelineProperties pipelineProperties) {
    this.engine = engine;
    this.renderer = renderer;
    this.subtitleWriter = subtitleWriter;
    this.videoSubtitlingService = videoSubtitlingService;
    this.tempDir = Paths.get(pipelineProperties.tempDir());
  }

  @GetMapping("/")
  @Operation(summary = "Health check")
  public HealthResponse health() {
    return new HealthResponse("OK");
  }

  @PostMapping("/api/subtitles/srt")
  @Operation(
      summary = "Generate SRT",
      description = "Reconcile a translation with timed segments and return SubRip text")
  public ResponseEntity<String> srt(@Valid @RequestBody SubtitleRequest request) {
    List<Segment> segments = reconcile(request);
    return ResponseEntity.ok().contentType(SRT).body(subtitleWriter.writeSrt(segments));
  }

  @PostMapping("/api/subtitles/vtt")
  @Operation(
      summary = "Generate WebVTT",
      description = "Reconcile a translation with timed segments and return WebVTT text")
  public ResponseEntity<String> vtt(@Valid @RequestBody SubtitleRequest request) {
    List<Segment> segments = reconcile(request);
    return ResponseEntity.ok().contentType(VTT).body(subtitleWriter.writeVtt(segments));
  }

  /**
   * Reconcile and lay out.
   *
   * <p>Returns the wrapped lines and panel geometry of every block on the requested canvas, plus
   * any words too wide to fit on a line of their own.
   */
  @PostMapping("/api/subtitles/layout")
  @Operation(
      summary = "Preview subtitle layout",
      description = "Reconcile a translation and return block geometry for a canvas size")
  public LayoutResponse layout(@Valid @RequestBody SubtitleRequest request) {
    List<Segment> segments = reconcile(request);
    Canvas canvas = new Canvas(request.canvasWidth(), request.canvasHeight());

    List<BlockView> blocks = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      LineLayout lineLayout = renderer.wrap(segment, canvas);
      SubtitleBlock block = renderer.layoutBlock(segment, lineLayout.lines(), canvas);
      blocks.add(toView(block, lineLayout.warnings()));
    }
    return new LayoutResponse(canvas.width(), canvas.height(), blocks);
  }

  /**
   * Subtitle an uploaded video.
   *
   * <p>Transcribes, translates and burns subtitles in one request. The uploaded file and the result
   * are deleted once the response body has been read into memory.
   */
  @PostMapping(value = "/api/videos/subtitle", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Subtitle a video",
      description = "Upload a short video and receive it back with translated subtitles burned in")
  public ResponseEntity<byte[]> subtitleVideo(
      @RequestPart("video") MultipartFile video,
      @RequestParam(value = "mode", required = false) OutputMode mode)
      throws IOException {
    if (video.isEmpty()) {
      throw new IllegalArgumentException("Uploaded video is empty");
    }
    LOGGER.info(
        "Video upload: name={}, size={} bytes, mode={}",
        video.getOriginalFilename(),
        video.getSize(),
        mode);

    Files.createDirectories(tempDir);
    Path upload = Files.createTempFile(tempDir, "upload-", suffixOf(video.getOriginalFilename()));
    Path output = null;
    try {
      video.transferTo(upload);
      SubtitledVideo result =
          mode == null
              ? videoSubtitlingService.subtitle(upload)
              : videoSubtitlingService.subtitle(upload, mode);
      output = result.output();
      byte[] body = Files.readAllBytes(output);

      return ResponseEntity.ok()
          .contentType(MP4)
          .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"subbed.mp4\"")
          .header("X-Subtitle-Segments", String.valueOf(result.segments().size()))
          .body(body);
    } finally {
      deleteFile(upload);
      deleteFile(output);
    }
  }

  private List<Segment> reconcile(SubtitleRequest request) {
    return engine.reconcile(request.segments(), request.translation(), request.durationOrZero());
  }

  private static BlockView toView(SubtitleBlock block, List<LayoutOverflowWarning> warnings) {
    List<LineView> lines = new ArrayList<>(block.lines().size());
    for (int i = 0; i < block.lines().size(); i++) {
      Line line = block.lines().get(i);
      lines.add(
          new LineView(
              line.logicalText(),
              line.text(),
              block.lineX(i),
              block.lineY(i),
              line.width(),
              line.height()));
    }
    return new BlockView(
        block.segment().start(),
        block.segment().end(),
        block.segment().text(),
        block.panelX(),
        block.panelY(),
        block.panelWidth(),
        block.panelHeight(),
        lines,
        warnings.stream().map(LayoutOverflowWarning::word).toList());
  }

  private static String suffixOf(String filename) {
    if (filename == null) {
      return ".mp4";
    }
    int dot = filename.lastIndexOf('.');
    if (dot < 0 || dot == filename.length() - 1) {
      return ".mp4";
    }
    String suffix = filename.substring(dot);
    return suffix.matches("\\.[A-Za-z0-9]{1,8}") ? suffix : ".mp4";
  }

  private static void deleteFile(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }
}
