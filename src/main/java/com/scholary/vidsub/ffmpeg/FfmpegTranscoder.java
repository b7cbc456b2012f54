package com.scholary.vidsub.ffmpeg;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vidsub.render.LayoutProperties;
import com.scholary.vidsub.render.RasterOverlay;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link VideoTranscoder} driving the ffmpeg and ffprobe binaries.
 *
 * <p>Each call runs one process with stdout and stderr redirected to a temporary log file, waits up
 * to {@code timeoutSeconds}, and turns a non-zero exit or a timeout into a {@link
 * TranscoderException} carrying the end of the log.
 *
 * <p>Video is always re-encoded with libx264/yuv420p so the result plays everywhere; audio is
 * copied untouched.
 */
@Component
public class FfmpegTranscoder implements VideoTranscoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegTranscoder.class);

  // Keeps error messages short enough to be relayed to a chat client
  private static final int MAX_ERROR_OUTPUT = 3500;

  private final FfmpegProperties properties;
  private final LayoutProperties layout;
  private final ObjectMapper objectMapper;

  public FfmpegTranscoder(
      FfmpegProperties properties, LayoutProperties layout, ObjectMapper objectMapper) {
    this.properties = properties;
    this.layout = layout;
    this.objectMapper = objectMapper;
  }

  @Override
  public VideoInfo probe(Path video) {
    String output =
        run(
            List.of(
                properties.ffprobePath(),
                "-v",
                "error",
                "-select_streams",
                "v:0",
                "-show_entries",
                "stream=width,height:format=duration",
                "-of",
                "json",
                video.toString()),
            "probe");
    VideoInfo info = parseProbe(output);
    LOGGER.info(
        "Probed {}: duration={}s, size={}x{}",
        video.getFileName(),
        info.durationSeconds(),
        info.width(),
        info.height());
    return info;
  }

  /** Parse ffprobe's JSON output. */
  VideoInfo parseProbe(String json) {
    try {
      JsonNode root = objectMapper.readTree(json);
      JsonNode stream = root.path("streams").path(0);
      double duration = root.path("format").path("duration").asDouble(-1);
      int width = stream.path("width").asInt(0);
      int height = stream.path("height").asInt(0);
      if (duration <= 0 || width <= 0 || height <= 0) {
        throw new TranscoderException("ffprobe output lacks duration or frame size: " + json);
      }
      return new VideoInfo(duration, width, height);
    } catch (IOException e) {
      throw new TranscoderException("Unparseable ffprobe output", e);
    }
  }

  @Override
  public Path extractAudio(Path video, Path audioOut) {
    run(
        List.of(
            properties.ffmpegPath(),
            "-y",
            "-i",
            video.toString(),
            "-vn",
            "-c:a",
            properties.audioCodec(),
            "-b:a",
            properties.audioBitrate(),
            audioOut.toString()),
        "extract-audio");
    return audioOut;
  }

  @Override
  public Path burnSubtitles(Path video, Path srtFile, Path output, int frameHeight) {
    run(buildBurnCommand(video, srtFile, output, frameHeight), "burn-subtitles");
    return output;
  }

  @Override
  public Path overlaySubtitles(Path video, List<RasterOverlay> overlays, Path output) {
    if (overlays.isEmpty()) {
      throw new IllegalArgumentException("At least one overlay is required");
    }
    run(buildOverlayCommand(video, overlays, output), "overlay-subtitles");
    return output;
  }

  List<String> buildBurnCommand(Path video, Path srtFile, Path output, int frameHeight) {
    String filter =
        String.format(
            "subtitles='%s':force_style='%s'",
            escapeFilterValue(srtFile.toString()),
            AssStyle.forceStyle(layout, properties.fontName(), frameHeight));

    List<String> command = new ArrayList<>();
    command.add(properties.ffmpegPath());
    command.add("-y");
    command.add("-i");
    command.add(video.toString());
    command.add("-vf");
    command.add(filter);
    addEncodingArgs(command);
    command.add(output.toString());
    return command;
  }

  /**
   * Chain one overlay filter per image.
   *
   * <p>Example for two images:
   *
   * <pre>
   * [0:v][1:v]overlay=x=10:y=600:enable='between(t,0.000,2.000)'[v1];
   * [v1][2:v]overlay=x=12:y=600:enable='between(t,2.000,4.000)'[v2]
   * </pre>
   */
  List<String> buildOverlayCommand(Path video, List<RasterOverlay> overlays, Path output) {
    List<String> command = new ArrayList<>();
    command.add(properties.ffmpegPath());
    command.add("-y");
    command.add("-i");
    command.add(video.toString());
    for (RasterOverlay overlay : overlays) {
      command.add("-i");
      command.add(overlay.image().toString());
    }

    StringBuilder graph = new StringBuilder();
    String previous = "0:v";
    for (int i = 0; i < overlays.size(); i++) {
      RasterOverlay overlay = overlays.get(i);
      String label = "v" + (i + 1);
      if (i > 0) {
        graph.append(';');
      }
      graph.append(
          String.format(
              Locale.ROOT,
              "[%s][%d:v]overlay=x=%d:y=%d:enable='between(t,%.3f,%.3f)'[%s]",
              previous,
              i + 1,
              overlay.x(),
              overlay.y(),
              overlay.start(),
              overlay.end(),
              label));
      previous = label;
    }

    command.add("-filter_complex");
    command.add(graph.toString());
    command.add("-map");
    command.add("[" + previous + "]");
    command.add("-map");
    command.add("0:a?");
    addEncodingArgs(command);
    command.add(output.toString());
    return command;
  }

  private void addEncodingArgs(List<String> command) {
    command.add("-c:v");
    command.add("libx264");
    command.add("-c:a");
    command.add("copy");
    command.add("-pix_fmt");
    command.add("yuv420p");
    command.add("-preset");
    command.add(properties.preset());
    command.add("-crf");
    command.add(String.valueOf(properties.crf()));
  }

  /** Escape a value for use inside a single-quoted filter argument. */
  static String escapeFilterValue(String value) {
    return value.replace("'", "'\\''");
  }

  private String run(List<String> command, String operation) {
    LOGGER.debug("Executing {}: {}", operation, String.join(" ", command));
    long started = System.currentTimeMillis();

    Path log = null;
    try {
      log = Files.createTempFile("ffmpeg-" + operation + "-", ".log");
      Process process =
          new ProcessBuilder(command).redirectErrorStream(true).redirectOutput(log.toFile()).start();

      boolean finished = process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS);
      String output = new String(Files.readAllBytes(log), StandardCharsets.UTF_8);

      if (!finished) {
        process.destroyForcibly();
        throw new TranscoderException(
            String.format(
                "%s timed out after %ds: %s",
                operation, properties.timeoutSeconds(), tail(output)));
      }
      if (process.exitValue() != 0) {
        throw new TranscoderException(
            String.format(
                "%s failed with exit code %d: %s", operation, process.exitValue(), tail(output)));
      }

      LOGGER.info("{} finished in {}ms", operation, System.currentTimeMillis() - started);
      return output;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscoderException(operation + " interrupted", e);
    } catch (IOException e) {
      throw new TranscoderException(operation + " could not be started: " + e.getMessage(), e);
    } finally {
      deleteQuietly(log);
    }
  }

  private static String tail(String output) {
    if (output.length() <= MAX_ERROR_OUTPUT) {
      return output;
    }
    return "... " + output.substring(output.length() - MAX_ERROR_OUTPUT);
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete ffmpeg log {}: {}", path, e.getMessage());
    }
  }
}
