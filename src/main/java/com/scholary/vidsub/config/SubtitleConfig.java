package com.scholary.vidsub.config;

import com.scholary.vidsub.layout.GlyphMetrics;
import com.scholary.vidsub.render.AwtGlyphMetrics;
import com.scholary.vidsub.render.FontProperties;
import com.scholary.vidsub.render.FontResolver;
import com.scholary.vidsub.render.LayoutProperties;
import com.scholary.vidsub.service.PipelineProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the subtitle layout engine.
 *
 * <p>The font is resolved once at startup, so a host without a usable font fails fast instead of on
 * the first request.
 */
@Configuration
@EnableConfigurationProperties({
  LayoutProperties.class,
  FontProperties.class,
  PipelineProperties.class
})
public class SubtitleConfig {

  @Bean
  public GlyphMetrics glyphMetrics(
      FontResolver fontResolver, LayoutProperties layout, FontProperties fonts) {
    return new AwtGlyphMetrics(
        fontResolver.resolve(layout.fontSize()), fonts.measurementCacheSize());
  }
}
