package com.scholary.vidsub.whisper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vidsub.segment.Segment;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HTTP client for an OpenAI-compatible Whisper transcription API.
 *
 * <p>This handles the low-level HTTP communication: building the multipart request, sending the
 * audio file, and mapping the {@code verbose_json} response onto {@link Segment}s.
 *
 * <p>Failures are not retried. Any transport error, non-200 status or unparseable body becomes a
 * {@link WhisperException} for the caller to handle.
 */
@Component
public class WhisperClient implements TranscriptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  @Autowired
  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  WhisperClient(WhisperProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  /**
   * Transcribe an audio file.
   *
   * @param audioFile the audio file to transcribe
   * @return the transcript with segment timing when available
   * @throws WhisperException if transcription fails
   */
  @Override
  public Transcript transcribe(Path audioFile) {
    LOGGER.info("Transcribing audio: file={}", audioFile.getFileName());

    try {
      WhisperResponse response = send(audioFile);
      return toTranscript(response);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WhisperException("Transcription interrupted", e);
    } catch (IOException e) {
      throw new WhisperException("Transcription request failed: " + e.getMessage(), e);
    }
  }

  private WhisperResponse send(Path audioFile) throws IOException, InterruptedException {
    String boundary = UUID.randomUUID().toString();
    BodyPublisher bodyPublisher = buildMultipartBody(audioFile, boundary);

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/audio/transcriptions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(bodyPublisher);
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }
    HttpRequest request = builder.build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new WhisperException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }

    try {
      return objectMapper.readValue(response.body(), WhisperResponse.class);
    } catch (JsonProcessingException e) {
      throw new WhisperException("Malformed transcription response", e);
    }
  }

  /** Map the API response, dropping segments whose timing is unusable. */
  Transcript toTranscript(WhisperResponse response) {
    List<Segment> segments = new ArrayList<>();
    for (TranscriptSegment segment : response.segments()) {
      if (segment.start() < 0 || segment.end() <= segment.start()) {
        LOGGER.warn(
            "Dropping segment with invalid timing [{}-{}]: '{}'",
            segment.start(),
            segment.end(),
            segment.text());
        continue;
      }
      String text = segment.text() == null ? "" : segment.text().trim();
      segments.add(new Segment(segment.start(), segment.end(), text));
    }

    LOGGER.info(
        "Transcription successful: {} segments, language={}", segments.size(), response.language());

    String language = response.language() != null ? response.language() : properties.language();
    return new Transcript(response.text(), segments, language);
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <p>Java's HttpClient has no built-in multipart support, so the parts are assembled by hand:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="audio.ogg"
   * Content-Type: application/octet-stream
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * whisper-large-v3
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(Path audioFile, String boundary) throws IOException {
    String filename = audioFile.getFileName().toString();
    byte[] fileBytes = Files.readAllBytes(audioFile);

    StringBuilder sb = new StringBuilder();

    // File part
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: application/octet-stream\r\n\r\n");

    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    appendField(sb, boundary, "model", properties.model());
    appendField(sb, boundary, "response_format", "verbose_json");
    appendField(sb, boundary, "language", properties.language());

    // End boundary
    sb.append("--").append(boundary).append("--\r\n");

    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    // Combine all parts
    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }
}
