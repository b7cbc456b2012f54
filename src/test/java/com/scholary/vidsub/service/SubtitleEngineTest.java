package com.scholary.vidsub.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.vidsub.layout.FixedAdvanceGlyphMetrics;
import com.scholary.vidsub.reconcile.TextReconciler;
import com.scholary.vidsub.reconcile.TranslationUnit.SegmentedText;
import com.scholary.vidsub.render.Canvas;
import com.scholary.vidsub.render.FontResolutionException;
import com.scholary.vidsub.render.LayoutProperties;
import com.scholary.vidsub.render.SubtitleBlock;
import com.scholary.vidsub.render.SubtitleBlockRenderer;
import com.scholary.vidsub.segment.Segment;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SubtitleEngineTest {

  private static final LayoutProperties LAYOUT =
      new LayoutProperties(28f, 0f, 20, 5, 40, 0, "#99000000", "#FFFFFF", "#000000");

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void reconcileAndRender_shouldProduceOneRightAlignedBlockPerSegment() {
    SubtitleEngine engine = engine(new FixedAdvanceGlyphMetrics(10));
    List<Segment> original = List.of(new Segment(0, 2, "Hi"), new Segment(2, 4, "Bye"));

    List<Segment> translated =
        engine.reconcile(original, new SegmentedText(List.of("שלום", "להתראות")), 4);
    List<SubtitleBlock> blocks = engine.renderBlocks(translated, new Canvas(1280, 720));

    assertThat(translated)
        .containsExactly(new Segment(0, 2, "שלום"), new Segment(2, 4, "להתראות"));
    assertThat(blocks).hasSize(2);
    assertThat(blocks).allSatisfy(block -> assertThat(block.lines()).hasSize(1));
    assertThat(blocks)
        .allSatisfy(
            block ->
                assertThat(block.lineX(0))
                    .isEqualTo(block.panelWidth() - 20 - block.lines().get(0).width()));
  }

  @Test
  void renderBlocks_shouldKeepSegmentOrder() {
    SubtitleEngine engine = engine(new FixedAdvanceGlyphMetrics(10));
    List<Segment> segments =
        List.of(
            new Segment(0, 1, "one"),
            new Segment(1, 2, "two"),
            new Segment(2, 3, "three"),
            new Segment(3, 4, "four"),
            new Segment(4, 5, "five"));

    List<SubtitleBlock> blocks = engine.renderBlocks(segments, new Canvas(640, 360));

    assertThat(blocks).extracting(SubtitleBlock::segment).containsExactlyElementsOf(segments);
  }

  @Test
  void renderBlocks_shouldRethrowRenderingFailureUnwrapped() {
    SubtitleEngine engine = engine(new FixedAdvanceGlyphMetrics(10, "ש"));
    List<Segment> segments = List.of(new Segment(0, 1, "fine"), new Segment(1, 2, "שלום"));

    assertThatThrownBy(() -> engine.renderBlocks(segments, new Canvas(640, 360)))
        .isInstanceOf(FontResolutionException.class);
  }

  private SubtitleEngine engine(FixedAdvanceGlyphMetrics metrics) {
    return new SubtitleEngine(
        new TextReconciler(), new SubtitleBlockRenderer(metrics, LAYOUT), executor);
  }
}
