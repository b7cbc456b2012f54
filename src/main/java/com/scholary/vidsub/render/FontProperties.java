package com.scholary.vidsub.render;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for font resolution.
 *
 * <p>Candidates are tried in order. Supported forms:
 *
 * <ul>
 *   <li>{@code classpath:fonts/NotoSansHebrew-Regular.ttf} - font packaged with the application
 *   <li>{@code /usr/share/fonts/...ttf} - font file on the host
 *   <li>{@code family:DejaVu Sans} - font family installed on the host
 * </ul>
 *
 * <p>The first candidate that loads and can display {@code probeText} wins.
 */
@ConfigurationProperties(prefix = "subtitles.font")
@Validated
public record FontProperties(
    @NotEmpty List<String> candidates,
    @NotBlank String probeText,
    @Positive int measurementCacheSize) {}
