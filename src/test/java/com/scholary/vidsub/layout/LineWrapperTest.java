package com.scholary.vidsub.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LineWrapperTest {

  private LineWrapper wrapper;

  @BeforeEach
  void setUp() {
    // 10px per character, no outline
    wrapper = new LineWrapper(new FixedAdvanceGlyphMetrics(10), 0f);
  }

  @Test
  void wrap_shouldBreakBetweenWordsAtMaxWidth() {
    LineLayout layout = wrapper.wrap("aaa bbb ccc", 70);

    assertThat(layout.lines()).extracting(Line::logicalText).containsExactly("aaa bbb", "ccc");
    assertThat(layout.lines()).extracting(Line::width).containsExactly(70, 30);
    assertThat(layout.hasOverflow()).isFalse();
  }

  @Test
  void wrap_shouldKeepEveryLineWithinMaxWidth() {
    String text = "the quick brown fox jumps over the lazy dog and keeps running far away";

    LineLayout layout = wrapper.wrap(text, 120);

    assertThat(layout.lines()).allSatisfy(line -> assertThat(line.width()).isLessThanOrEqualTo(120));
    assertThat(String.join(" ", layout.lines().stream().map(Line::logicalText).toList()))
        .isEqualTo(text);
  }

  @Test
  void wrap_shouldPutOverlongWordOnItsOwnLineWithWarning() {
    LineLayout layout = wrapper.wrap("a verylongword b", 50);

    assertThat(layout.lines())
        .extracting(Line::logicalText)
        .containsExactly("a", "verylongword", "b");
    assertThat(layout.warnings()).containsExactly(new LayoutOverflowWarning("verylongword", 120, 50));
  }

  @Test
  void wrap_shouldBeIdempotent() {
    String text = "שלום לכולם וברוכים הבאים לסרטון הקצר שלנו על תרגום כתוביות";

    LineLayout first = wrapper.wrap(text, 100);
    String joined = first.lines().stream().map(Line::logicalText).collect(Collectors.joining(" "));
    LineLayout second = wrapper.wrap(joined, 100);

    assertThat(second.lines()).hasSameSizeAs(first.lines());
    assertThat(second.lines()).extracting(Line::logicalText)
        .containsExactlyElementsOf(first.lines().stream().map(Line::logicalText).toList());
  }

  @Test
  void wrap_shouldReturnVisualOrderForRightToLeftText() {
    LineLayout layout = wrapper.wrap("שלום עולם", 1000);

    Line line = layout.lines().get(0);
    assertThat(line.logicalText()).isEqualTo("שלום עולם");
    assertThat(line.text()).isEqualTo("םלוע םולש");
  }

  @Test
  void wrap_shouldIncludeStrokeInMeasuredWidth() {
    LineWrapper stroked = new LineWrapper(new FixedAdvanceGlyphMetrics(10), 2f);

    LineLayout layout = stroked.wrap("aaa bbb", 70);

    // "aaa bbb" would be 70px plus 4px of outline, so it no longer fits
    assertThat(layout.lines()).extracting(Line::logicalText).containsExactly("aaa", "bbb");
    assertThat(layout.lines().get(0).width()).isEqualTo(34);
  }

  @Test
  void wrap_shouldReturnEmptyLayoutForBlankText() {
    assertThat(wrapper.wrap("   ", 100).isEmpty()).isTrue();
    assertThat(wrapper.wrap(null, 100).isEmpty()).isTrue();
  }

  @Test
  void wrap_shouldRejectNonPositiveMaxWidth() {
    assertThatThrownBy(() -> wrapper.wrap("text", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
