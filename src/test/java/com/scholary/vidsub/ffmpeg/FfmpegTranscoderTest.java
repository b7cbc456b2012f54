package com.scholary.vidsub.ffmpeg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vidsub.render.LayoutProperties;
import com.scholary.vidsub.render.RasterOverlay;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FfmpegTranscoderTest {

  private static final LayoutProperties LAYOUT =
      new LayoutProperties(28f, 2f, 16, 8, 40, 24, "#99000000", "#FFFFFF", "#000000");

  private FfmpegTranscoder transcoder;

  @BeforeEach
  void setUp() {
    transcoder = new FfmpegTranscoder(properties("ffmpeg", "ffprobe"), LAYOUT, new ObjectMapper());
  }

  @Test
  void parseProbe_shouldReadDurationAndFrameSize() {
    String json =
        "{\"streams\":[{\"width\":1280,\"height\":720}],"
            + "\"format\":{\"duration\":\"12.480000\"}}";

    VideoInfo info = transcoder.parseProbe(json);

    assertThat(info).isEqualTo(new VideoInfo(12.48, 1280, 720));
  }

  @Test
  void parseProbe_shouldRejectOutputWithoutVideoStream() {
    String json = "{\"streams\":[],\"format\":{\"duration\":\"3.0\"}}";

    assertThatThrownBy(() -> transcoder.parseProbe(json))
        .isInstanceOf(TranscoderException.class);
    assertThatThrownBy(() -> transcoder.parseProbe("not json"))
        .isInstanceOf(TranscoderException.class);
  }

  @Test
  void buildBurnCommand_shouldUseSubtitlesFilterWithStyleScaledToFrame() {
    List<String> command =
        transcoder.buildBurnCommand(
            Path.of("/tmp/in.mp4"),
            Path.of("/tmp/job/subtitles.srt"),
            Path.of("/tmp/out.mp4"),
            720);

    assertThat(command).startsWith("ffmpeg", "-y", "-i", "/tmp/in.mp4", "-vf");
    assertThat(command.get(5))
        .isEqualTo(
            "subtitles='/tmp/job/subtitles.srt':force_style='"
                + AssStyle.forceStyle(LAYOUT, "Noto Sans Hebrew", 720)
                + "'");
    assertThat(command.get(5)).contains("FontSize=11.20", "WrapStyle=2");
    assertThat(command).containsSequence("-c:v", "libx264");
    assertThat(command).containsSequence("-c:a", "copy");
    assertThat(command).containsSequence("-preset", "ultrafast");
    assertThat(command).containsSequence("-crf", "23");
    assertThat(command).endsWith("/tmp/out.mp4");
  }

  @Test
  void buildOverlayCommand_shouldChainTimedOverlays() {
    List<RasterOverlay> overlays =
        List.of(
            new RasterOverlay(1, Path.of("/tmp/o/subtitle_0001.png"), 10, 600, 0.0, 2.0),
            new RasterOverlay(2, Path.of("/tmp/o/subtitle_0002.png"), 12, 590, 2.0, 4.5));

    List<String> command =
        transcoder.buildOverlayCommand(Path.of("/tmp/in.mp4"), overlays, Path.of("/tmp/out.mp4"));

    assertThat(command)
        .containsSequence(
            "-i", "/tmp/in.mp4",
            "-i", "/tmp/o/subtitle_0001.png",
            "-i", "/tmp/o/subtitle_0002.png");
    int graphIndex = command.indexOf("-filter_complex") + 1;
    assertThat(command.get(graphIndex))
        .isEqualTo(
            "[0:v][1:v]overlay=x=10:y=600:enable='between(t,0.000,2.000)'[v1];"
                + "[v1][2:v]overlay=x=12:y=590:enable='between(t,2.000,4.500)'[v2]");
    assertThat(command).containsSequence("-map", "[v2]", "-map", "0:a?");
  }

  @Test
  void overlaySubtitles_shouldRequireAtLeastOneOverlay() {
    assertThatThrownBy(
            () ->
                transcoder.overlaySubtitles(
                    Path.of("/tmp/in.mp4"), List.of(), Path.of("/tmp/out.mp4")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void escapeFilterValue_shouldEscapeSingleQuotes() {
    assertThat(FfmpegTranscoder.escapeFilterValue("/tmp/it's.srt")).isEqualTo("/tmp/it'\\''s.srt");
  }

  @Test
  void probe_shouldFailWhenBinaryIsMissing() {
    FfmpegTranscoder missing =
        new FfmpegTranscoder(
            properties("/nonexistent/ffmpeg", "/nonexistent/ffprobe"),
            LAYOUT,
            new ObjectMapper());

    assertThatThrownBy(() -> missing.probe(Path.of("/tmp/in.mp4")))
        .isInstanceOf(TranscoderException.class)
        .hasMessageContaining("could not be started");
  }

  private static FfmpegProperties properties(String ffmpeg, String ffprobe) {
    return new FfmpegProperties(
        ffmpeg, ffprobe, 30, "ultrafast", 23, "libopus", "64k", "Noto Sans Hebrew");
  }
}
