package com.scholary.vidsub.ffmpeg;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>{@code fontName} is the family libass looks up through fontconfig when an SRT track is burned
 * in. It must support the target script.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int timeoutSeconds,
    @NotBlank String preset,
    @PositiveOrZero int crf,
    @NotBlank String audioCodec,
    @NotBlank String audioBitrate,
    @NotBlank String fontName) {}
