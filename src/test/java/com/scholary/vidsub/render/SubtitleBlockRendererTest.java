package com.scholary.vidsub.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.vidsub.layout.FixedAdvanceGlyphMetrics;
import com.scholary.vidsub.layout.Line;
import com.scholary.vidsub.segment.Segment;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SubtitleBlockRendererTest {

  private static final Canvas CANVAS = new Canvas(1280, 720);

  private LayoutProperties properties;
  private SubtitleBlockRenderer renderer;

  @BeforeEach
  void setUp() {
    properties =
        new LayoutProperties(28f, 0f, 20, 5, 40, 0, "#99000000", "#FFFFFF", "#000000");
    renderer = new SubtitleBlockRenderer(new FixedAdvanceGlyphMetrics(10), properties);
  }

  @Test
  void layoutBlock_shouldRightAlignEachLineInsidePanel() {
    List<Line> lines =
        List.of(line("abcdefghijklmnop", 160), line("abcdefghij", 100));

    SubtitleBlock block = renderer.layoutBlock(new Segment(0, 2, "x"), lines, CANVAS);

    assertThat(block.panelWidth()).isEqualTo(200);
    assertThat(block.lineX(0)).isEqualTo(20);
    assertThat(block.lineX(1)).isEqualTo(200 - 20 - 100);
  }

  @Test
  void layoutBlock_shouldStackLinesWithVerticalPadding() {
    List<Line> lines = List.of(line("a", 10), line("b", 10));

    SubtitleBlock block = renderer.layoutBlock(new Segment(0, 2, "x"), lines, CANVAS);

    // 5 + (20 + 5) * 2
    assertThat(block.panelHeight()).isEqualTo(55);
    assertThat(block.lineY(0)).isEqualTo(5);
    assertThat(block.lineY(1)).isEqualTo(30);
  }

  @Test
  void layoutBlock_shouldAnchorPanelBottomCentre() {
    List<Line> lines = List.of(line("abcdefghijklmnop", 160));

    SubtitleBlock block = renderer.layoutBlock(new Segment(0, 2, "x"), lines, CANVAS);

    assertThat(block.panelX()).isEqualTo((1280 - 200) / 2);
    assertThat(block.panelY()).isEqualTo(720 - 40 - block.panelHeight());
  }

  @Test
  void layoutBlock_shouldClampPanelToCanvasWidth() {
    List<Line> lines = List.of(line("overlong", 1300));

    SubtitleBlock block = renderer.layoutBlock(new Segment(0, 2, "x"), lines, CANVAS);

    assertThat(block.panelWidth()).isEqualTo(1280);
    assertThat(block.panelX()).isZero();
  }

  @Test
  void layoutBlock_shouldProduceEmptyBlockWithoutLines() {
    SubtitleBlock block = renderer.layoutBlock(new Segment(0, 2, ""), List.of(), CANVAS);

    assertThat(block.isEmpty()).isTrue();
    assertThat(block.panelWidth()).isZero();
    assertThat(block.panelHeight()).isZero();
  }

  @Test
  void render_shouldLayOutHebrewSegmentAsSingleRightAlignedLine() {
    SubtitleBlock block = renderer.render(new Segment(0, 2, "שלום"), CANVAS);

    assertThat(block.lines()).hasSize(1);
    Line line = block.lines().get(0);
    assertThat(line.logicalText()).isEqualTo("שלום");
    assertThat(line.text()).isEqualTo("םולש");
    assertThat(block.panelWidth()).isEqualTo(40 + 2 * 20);
    assertThat(block.lineX(0)).isEqualTo(block.panelWidth() - 20 - line.width());
  }

  @Test
  void render_shouldWrapToCanvasMinusMarginsAndPadding() {
    LayoutProperties narrow =
        new LayoutProperties(28f, 0f, 10, 5, 40, 15, "#99000000", "#FFFFFF", "#000000");
    SubtitleBlockRenderer narrowRenderer =
        new SubtitleBlockRenderer(new FixedAdvanceGlyphMetrics(10), narrow);
    Canvas canvas = new Canvas(100, 100);

    // 100 - 2 * 15 - 2 * 10 = 50px, i.e. five characters per line
    assertThat(narrowRenderer.maxLineWidth(canvas)).isEqualTo(50);
    SubtitleBlock block = narrowRenderer.render(new Segment(0, 1, "ab cd ef"), canvas);
    assertThat(block.lines()).extracting(Line::logicalText).containsExactly("ab cd", "ef");
  }

  @Test
  void render_shouldFailWhenFontLacksGlyphs() {
    SubtitleBlockRenderer latinOnly =
        new SubtitleBlockRenderer(new FixedAdvanceGlyphMetrics(10, "שלום"), properties);

    assertThatThrownBy(() -> latinOnly.render(new Segment(0, 2, "Hi שלום"), CANVAS))
        .isInstanceOf(FontResolutionException.class)
        .hasMessageContaining("U+05E9");
  }

  @Test
  void wrap_shouldReportOverflowingWords() {
    Canvas canvas = new Canvas(100, 100);

    var layout = renderer.wrap(new Segment(0, 1, "abcdefghijklmnop"), canvas);

    assertThat(layout.hasOverflow()).isTrue();
    assertThat(layout.warnings().get(0).word()).isEqualTo("abcdefghijklmnop");
  }

  private static Line line(String text, int width) {
    return new Line(text, text, width, FixedAdvanceGlyphMetrics.LINE_HEIGHT, 15);
  }
}
