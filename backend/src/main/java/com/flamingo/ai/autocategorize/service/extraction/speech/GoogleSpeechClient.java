package com.flamingo.ai.autocategorize.service.extraction.speech;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.model.TranscriptWord;
import com.flamingo.ai.autocategorize.exception.ExternalServiceException;
import com.flamingo.ai.autocategorize.service.extraction.ProviderStatus;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** Google Cloud Speech-to-Text {@code speech:recognize} REST client with word time offsets. */
@Component
@ConditionalOnProperty(name = "categorization.speech.enabled", havingValue = "true")
@Slf4j
public class GoogleSpeechClient implements SpeechClient {

  static final String PROVIDER = "speech";

  private final WebClient webClient;
  private final CategorizationConfig.Speech settings;
  private final MeterRegistry meterRegistry;

  public GoogleSpeechClient(CategorizationConfig config, MeterRegistry meterRegistry) {
    this.settings = config.getSpeech();
    this.meterRegistry = meterRegistry;
    this.webClient =
        WebClient.builder()
            .baseUrl(settings.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
            .build();
    log.info(
        "Speech client initialized: baseUrl={}, language={}",
        settings.getBaseUrl(),
        settings.getLanguageCode());
  }

  @Override
  @CircuitBreaker(name = "speech")
  @Retry(name = "speech", fallbackMethod = "transcribeFallback")
  public Transcription transcribe(byte[] audioBytes, AudioEncoding encoding) {
    Map<String, Object> recognitionConfig = new LinkedHashMap<>();
    recognitionConfig.put("encoding", encoding.name());
    recognitionConfig.put("languageCode", settings.getLanguageCode());
    recognitionConfig.put("enableWordTimeOffsets", true);
    recognitionConfig.put("enableAutomaticPunctuation", true);
    if (settings.getSampleRateHertz() > 0) {
      recognitionConfig.put("sampleRateHertz", settings.getSampleRateHertz());
    }
    Map<String, Object> request =
        Map.of(
            "config",
            recognitionConfig,
            "audio",
            Map.of("content", Base64.getEncoder().encodeToString(audioBytes)));

    JsonNode body;
    try {
      body =
          webClient
              .post()
              .uri(
                  uri ->
                      uri.path("/v1/speech:recognize")
                          .queryParam("key", settings.getApiKey())
                          .build())
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(request)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(Duration.ofMillis(settings.getReadTimeoutMs()))
              .block();
    } catch (WebClientResponseException e) {
      throw new ExternalServiceException(
          PROVIDER,
          "Speech API returned " + e.getStatusCode().value(),
          e.getStatusCode().value() == 429);
    }
    if (body == null) {
      throw new ExternalServiceException(PROVIDER, "Speech API returned no body");
    }
    meterRegistry.counter("extraction.provider.success", "provider", PROVIDER).increment();
    return new Transcription(parseWords(body), ProviderStatus.OK);
  }

  @SuppressWarnings("unused")
  private Transcription transcribeFallback(
      byte[] audioBytes, AudioEncoding encoding, Throwable t) {
    log.error("Speech transcription failed: {}", t.getMessage());
    meterRegistry.counter("extraction.provider.failure", "provider", PROVIDER).increment();
    return Transcription.failed();
  }

  static List<TranscriptWord> parseWords(JsonNode body) {
    List<TranscriptWord> words = new ArrayList<>();
    for (JsonNode result : body.path("results")) {
      for (JsonNode word : result.path("alternatives").path(0).path("words")) {
        words.add(
            new TranscriptWord(
                word.path("word").asText(""),
                parseOffset(word.path("startTime").asText("")),
                parseOffset(word.path("endTime").asText(""))));
      }
    }
    return words;
  }

  /** Parses protobuf JSON durations such as {@code "1.300s"}; blank means zero. */
  static double parseOffset(String duration) {
    if (duration == null || duration.isBlank()) {
      return 0.0;
    }
    String value = duration.endsWith("s") ? duration.substring(0, duration.length() - 1) : duration;
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      log.warn("Unparseable speech offset '{}'", duration);
      return 0.0;
    }
  }
}
