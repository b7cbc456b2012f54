package com.scholary.vidsub.service;

import com.scholary.vidsub.render.SubtitleBlock;
import com.scholary.vidsub.segment.Segment;
import com.scholary.vidsub.segment.SubtitleTime;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Writes subtitle tracks as text.
 *
 * <p>Supports SRT (SubRip, consumed by the burn-in filter) and WebVTT. Output is UTF-8 and depends
 * only on the segment data, so the same segments always produce the same bytes. Segments without
 * text are skipped and do not consume an SRT index.
 */
@Component
public class SubtitleWriter {

  private static final Pattern LINE_BREAKS = Pattern.compile("[ \\t]*(\\R[ \\t]*)+");

  /**
   * Write segments as SRT (SubRip subtitle format).
   *
   * <p>Format:
   *
   * <pre>
   * 1
   * 00:00:00,000 --> 00:00:05,200
   * Hello world
   *
   * 2
   * 00:00:05,200 --> 00:00:10,300
   * This is a test
   * </pre>
   */
  public String writeSrt(List<Segment> segments) {
    StringBuilder srt = new StringBuilder();

    int index = 0;
    for (Segment segment : segments) {
      String text = entryText(segment.text());
      if (text.isEmpty()) {
        continue;
      }

      // Sequence number
      srt.append(++index).append("\n");

      // Timecodes
      srt.append(SubtitleTime.formatSrt(segment.start()))
          .append(" --> ")
          .append(SubtitleTime.formatSrt(segment.end()))
          .append("\n");

      // Text
      srt.append(text).append("\n");

      // Blank line between entries
      srt.append("\n");
    }

    return srt.toString();
  }

  /**
   * Write rendered blocks as SRT, keeping the block's line breaks.
   *
   * <p>Blocks without text are skipped and do not consume an index.
   */
  public String writeSrtFromBlocks(List<SubtitleBlock> blocks) {
    return writeSrt(
        blocks.stream()
            .filter(block -> !block.isEmpty())
            .map(block -> block.segment().withText(block.logicalText()))
            .toList());
  }

  /** Write segments as WebVTT. */
  public String writeVtt(List<Segment> segments) {
    StringBuilder vtt = new StringBuilder("WEBVTT\n\n");

    for (Segment segment : segments) {
      String text = entryText(segment.text());
      if (text.isEmpty()) {
        continue;
      }
      vtt.append(SubtitleTime.formatVtt(segment.start()))
          .append(" --> ")
          .append(SubtitleTime.formatVtt(segment.end()))
          .append("\n")
          .append(text)
          .append("\n\n");
    }

    return vtt.toString();
  }

  /**
   * Text of one entry. A blank line ends an entry in both formats, so line breaks inside the text
   * collapse to single newlines.
   */
  static String entryText(String text) {
    if (text == null) {
      return "";
    }
    return LINE_BREAKS.matcher(text.strip()).replaceAll("\n");
  }

  /** Write SRT content to a UTF-8 file. */
  public Path writeSrtFile(List<SubtitleBlock> blocks, Path target) throws IOException {
    Files.writeString(target, writeSrtFromBlocks(blocks), StandardCharsets.UTF_8);
    return target;
  }
}
