package com.scholary.vidsub.service;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the video subtitling pipeline.
 *
 * <p>Controls limits, working storage and the thread pool used to render subtitle blocks.
 */
@ConfigurationProperties(prefix = "subtitles.pipeline")
@Validated
public record PipelineProperties(
    @Positive int maxDurationSeconds,
    @NotBlank String tempDir,
    @Positive int renderThreads,
    @Positive int renderQueueSize,
    @NotNull OutputMode outputMode) {}
