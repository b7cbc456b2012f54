package com.scholary.vidsub.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper API client.
 *
 * <p>The client speaks the OpenAI-compatible {@code /audio/transcriptions} protocol, so {@code
 * baseUrl} can point at Groq, OpenAI or a self-hosted server.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @NotBlank String language,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
