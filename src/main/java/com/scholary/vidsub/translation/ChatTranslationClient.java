package com.scholary.vidsub.translation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vidsub.reconcile.TranslationUnit.FullText;
import com.scholary.vidsub.reconcile.TranslationUnit.SegmentedText;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HTTP client translating text through an OpenAI-compatible chat completion API.
 *
 * <p>Segment-aligned translation sends the source segments as a JSON array and asks for a JSON
 * array of the same length back. The model may still merge or split entries; the returned list is
 * passed on as-is and the reconciler decides what a length mismatch means.
 */
@Component
public class ChatTranslationClient implements TranslationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChatTranslationClient.class);

  private static final String SEGMENTED_INSTRUCTION =
      "The user message is a JSON array of subtitle lines. Translate every element separately and"
          + " reply with only a JSON array of strings with exactly the same number of elements, in"
          + " the same order.";

  private final HttpClient httpClient;
  private final TranslationProperties properties;
  private final ObjectMapper objectMapper;

  @Autowired
  public ChatTranslationClient(TranslationProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  ChatTranslationClient(
      TranslationProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;

    LOGGER.info(
        "Initialized translation client: baseUrl={}, model={}, target={}",
        properties.baseUrl(),
        properties.model(),
        properties.targetLanguage());
  }

  @Override
  public FullText translateText(String text) {
    LOGGER.info("Translating full text: {} chars", text.length());

    String content = complete(properties.resolvedSystemPrompt(), text);
    if (content.isBlank()) {
      throw new TranslationException("Translation service returned empty content");
    }
    return new FullText(content.trim());
  }

  @Override
  public SegmentedText translateSegments(List<String> texts) {
    LOGGER.info("Translating {} segments", texts.size());

    String payload;
    try {
      payload = objectMapper.writeValueAsString(texts);
    } catch (JsonProcessingException e) {
      throw new TranslationException("Failed to encode segments", e);
    }

    String content =
        complete(properties.resolvedSystemPrompt() + "\n" + SEGMENTED_INSTRUCTION, payload);
    List<String> entries = parseArray(content);

    LOGGER.info("Segmented translation returned {} entries for {} segments", entries.size(), texts.size());
    return new SegmentedText(entries);
  }

  /** Parse a JSON array of strings, tolerating a Markdown code fence around it. */
  List<String> parseArray(String content) {
    String json = content.trim();
    if (json.startsWith("```")) {
      int firstNewline = json.indexOf('\n');
      int closingFence = json.lastIndexOf("```");
      if (firstNewline < 0 || closingFence <= firstNewline) {
        throw new TranslationException("Malformed segmented translation: unterminated code fence");
      }
      json = json.substring(firstNewline + 1, closingFence).trim();
    }
    try {
      return objectMapper.readValue(json, new TypeReference<List<String>>() {});
    } catch (JsonProcessingException e) {
      throw new TranslationException("Malformed segmented translation: expected a JSON array", e);
    }
  }

  private String complete(String systemPrompt, String userContent) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", properties.model());
    body.put(
        "messages",
        List.of(
            Map.of("role", "system", "content", systemPrompt),
            Map.of("role", "user", "content", userContent)));
    body.put("temperature", properties.temperature());

    try {
      HttpRequest.Builder builder =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/chat/completions"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .POST(
                  HttpRequest.BodyPublishers.ofString(
                      objectMapper.writeValueAsString(body), StandardCharsets.UTF_8));
      if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
        builder.header("Authorization", "Bearer " + properties.apiKey());
      }

      HttpResponse<String> response =
          httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

      if (response.statusCode() != 200) {
        throw new TranslationException(
            String.format(
                "Translation API returned status %d: %s", response.statusCode(), response.body()));
      }

      JsonNode content = objectMapper.readTree(response.body()).at("/choices/0/message/content");
      if (content.isMissingNode() || !content.isTextual()) {
        throw new TranslationException("Translation response has no message content");
      }
      return content.asText();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranslationException("Translation interrupted", e);
    } catch (IOException e) {
      throw new TranslationException("Translation request failed: " + e.getMessage(), e);
    }
  }
}
