package com.scholary.vidsub.ffmpeg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.vidsub.render.LayoutProperties;
import java.awt.Color;
import org.junit.jupiter.api.Test;

class AssStyleTest {

  private static final LayoutProperties LAYOUT =
      new LayoutProperties(28f, 2f, 16, 8, 40, 24, "#99000000", "#FFFFFF", "#000000");

  @Test
  void forceStyle_shouldScaleSizesToScriptResolution() {
    // 720p: libass scales script sizes by 720 / 288 = 2.5
    String style = AssStyle.forceStyle(LAYOUT, "Noto Sans Hebrew", 720);

    assertThat(style)
        .isEqualTo(
            "Fontname=Noto Sans Hebrew,FontSize=11.20,PrimaryColour=&H00FFFFFF,"
                + "OutlineColour=&H66000000,BackColour=&H66000000,BorderStyle=3,"
                + "Outline=3.20,Shadow=0,MarginV=16,Alignment=2,WrapStyle=2");
  }

  @Test
  void forceStyle_shouldKeepSizesAtNativeScriptHeight() {
    String style = AssStyle.forceStyle(LAYOUT, "DejaVu Sans", 288);

    assertThat(style).contains("FontSize=28.00", "Outline=8.00", "MarginV=40");
  }

  @Test
  void forceStyle_shouldRejectNonPositiveHeight() {
    assertThatThrownBy(() -> AssStyle.forceStyle(LAYOUT, "DejaVu Sans", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toAssColour_shouldInvertAlphaAndSwapChannels() {
    assertThat(AssStyle.toAssColour(new Color(0x12, 0x34, 0x56))).isEqualTo("&H00563412");
    assertThat(AssStyle.toAssColour(new Color(0, 0, 0, 0))).isEqualTo("&HFF000000");
  }
}
