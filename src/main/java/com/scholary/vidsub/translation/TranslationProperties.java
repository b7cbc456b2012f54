package com.scholary.vidsub.translation;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the translation client.
 *
 * <p>The client speaks the OpenAI-compatible {@code /chat/completions} protocol. {@code
 * systemPrompt} may contain {@code %s}, replaced by {@code targetLanguage}.
 */
@ConfigurationProperties(prefix = "translation")
@Validated
public record TranslationProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @NotBlank String targetLanguage,
    @NotBlank String systemPrompt,
    @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
    @Positive int connectTimeout,
    @Positive int readTimeout) {

  public String resolvedSystemPrompt() {
    return systemPrompt.contains("%s") ? String.format(systemPrompt, targetLanguage) : systemPrompt;
  }
}
