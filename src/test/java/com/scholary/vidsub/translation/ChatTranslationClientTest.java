package com.scholary.vidsub.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vidsub.reconcile.TranslationUnit.FullText;
import com.scholary.vidsub.reconcile.TranslationUnit.SegmentedText;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatTranslationClientTest {

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> response;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private ChatTranslationClient client;

  @BeforeEach
  void setUp() {
    TranslationProperties properties =
        new TranslationProperties(
            "https://api.example.test/v1",
            "secret",
            "test-model",
            "Hebrew",
            "Translate into %s.",
            0.2,
            5,
            60);
    client = new ChatTranslationClient(properties, objectMapper, httpClient);
  }

  @Test
  void translateText_shouldReturnTrimmedMessageContent() throws Exception {
    stubResponse(200, completion(" שלום עולם. \n"));

    FullText result = client.translateText("Hello world.");

    assertThat(result.text()).isEqualTo("שלום עולם.");
    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(request.capture(), any());
    assertThat(request.getValue().uri().toString())
        .isEqualTo("https://api.example.test/v1/chat/completions");
    assertThat(request.getValue().headers().firstValue("Authorization")).hasValue("Bearer secret");
  }

  @Test
  void translateSegments_shouldReturnEntriesAsGiven() throws Exception {
    stubResponse(200, completion("[\"שלום\", \"להתראות\", \"תודה\"]"));

    SegmentedText result = client.translateSegments(List.of("Hi", "Bye"));

    // A length mismatch is left for the reconciler to report
    assertThat(result.entries()).containsExactly("שלום", "להתראות", "תודה");
  }

  @Test
  void translateText_shouldFailOnNonOkStatus() throws Exception {
    stubResponse(500, "{\"error\":\"boom\"}");

    assertThatThrownBy(() -> client.translateText("Hello"))
        .isInstanceOf(TranslationException.class)
        .hasMessageContaining("500");
  }

  @Test
  void translateText_shouldFailWithoutMessageContent() throws Exception {
    stubResponse(200, "{\"choices\":[]}");

    assertThatThrownBy(() -> client.translateText("Hello"))
        .isInstanceOf(TranslationException.class);
  }

  @Test
  void parseArray_shouldAcceptPlainAndFencedArrays() {
    assertThat(client.parseArray("[\"a\",\"b\"]")).containsExactly("a", "b");
    assertThat(client.parseArray("```json\n[\"a\", \"b\"]\n```")).containsExactly("a", "b");
  }

  @Test
  void parseArray_shouldRejectNonArrayContent() {
    assertThatThrownBy(() -> client.parseArray("Sure! Here is the translation: a, b"))
        .isInstanceOf(TranslationException.class);
    assertThatThrownBy(() -> client.parseArray("```json\n[\"a\"]"))
        .isInstanceOf(TranslationException.class);
  }

  @Test
  void resolvedSystemPrompt_shouldSubstituteTargetLanguage() {
    TranslationProperties properties =
        new TranslationProperties("u", null, "m", "Hebrew", "Translate into %s.", 0.2, 5, 60);

    assertThat(properties.resolvedSystemPrompt()).isEqualTo("Translate into Hebrew.");
  }

  private void stubResponse(int status, String body) throws Exception {
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
  }

  private String completion(String content) throws Exception {
    return objectMapper.writeValueAsString(
        Map.of(
            "choices",
            List.of(Map.of("message", Map.of("content", content)))));
  }
}
