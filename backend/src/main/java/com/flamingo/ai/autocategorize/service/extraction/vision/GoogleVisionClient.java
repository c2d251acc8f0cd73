package com.flamingo.ai.autocategorize.service.extraction.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.enums.DetectionKind;
import com.flamingo.ai.autocategorize.domain.model.BoundingBox;
import com.flamingo.ai.autocategorize.domain.model.DetectedObject;
import com.flamingo.ai.autocategorize.domain.model.Point;
import com.flamingo.ai.autocategorize.domain.model.TextDetection;
import com.flamingo.ai.autocategorize.exception.ExternalServiceException;
import com.flamingo.ai.autocategorize.service.extraction.ProviderStatus;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Google Cloud Vision {@code images:annotate} REST client. Requests text detection, object
 * localisation and logo detection in a single call.
 */
@Component
@ConditionalOnProperty(name = "categorization.vision.enabled", havingValue = "true")
@Slf4j
public class GoogleVisionClient implements VisionClient {

  static final String PROVIDER = "vision";

  private final WebClient webClient;
  private final String apiKey;
  private final int maxTextResults;
  private final int readTimeoutMs;
  private final MeterRegistry meterRegistry;

  public GoogleVisionClient(CategorizationConfig config, MeterRegistry meterRegistry) {
    CategorizationConfig.Vision vision = config.getVision();
    this.apiKey = vision.getApiKey();
    this.maxTextResults = vision.getMaxTextResults();
    this.readTimeoutMs = vision.getReadTimeoutMs();
    this.meterRegistry = meterRegistry;
    this.webClient =
        WebClient.builder()
            .baseUrl(vision.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
    log.info("Vision client initialized: baseUrl={}", vision.getBaseUrl());
  }

  @Override
  @CircuitBreaker(name = "vision")
  @Retry(name = "vision", fallbackMethod = "annotateFallback")
  public VisionAnnotations annotate(byte[] imageBytes, int width, int height) {
    Map<String, Object> request =
        Map.of(
            "requests",
            List.of(
                Map.of(
                    "image", Map.of("content", Base64.getEncoder().encodeToString(imageBytes)),
                    "features",
                    List.of(
                        Map.of("type", "TEXT_DETECTION", "maxResults", maxTextResults),
                        Map.of("type", "OBJECT_LOCALIZATION"),
                        Map.of("type", "LOGO_DETECTION")))));

    JsonNode body;
    try {
      body =
          webClient
              .post()
              .uri(uri -> uri.path("/v1/images:annotate").queryParam("key", apiKey).build())
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(request)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(Duration.ofMillis(readTimeoutMs))
              .block();
    } catch (WebClientResponseException e) {
      throw new ExternalServiceException(
          PROVIDER,
          "Vision API returned " + e.getStatusCode().value(),
          e.getStatusCode().value() == 429);
    }

    JsonNode response = body == null ? null : body.path("responses").path(0);
    if (response == null || response.isMissingNode()) {
      throw new ExternalServiceException(PROVIDER, "Vision API returned no response");
    }
    if (response.has("error")) {
      throw new ExternalServiceException(
          PROVIDER, "Vision API error: " + response.path("error").path("message").asText());
    }
    meterRegistry.counter("extraction.provider.success", "provider", PROVIDER).increment();
    return parse(response, width, height);
  }

  @SuppressWarnings("unused")
  private VisionAnnotations annotateFallback(
      byte[] imageBytes, int width, int height, Throwable t) {
    log.error("Vision annotation failed: {}", t.getMessage());
    meterRegistry.counter("extraction.provider.failure", "provider", PROVIDER).increment();
    return VisionAnnotations.failed();
  }

  static VisionAnnotations parse(JsonNode response, int width, int height) {
    String fullText = "";
    List<TextDetection> detections = new ArrayList<>();
    JsonNode texts = response.path("textAnnotations");
    for (int i = 0; i < texts.size(); i++) {
      JsonNode text = texts.get(i);
      if (i == 0) {
        // First entry holds the whole text of the image
        fullText = text.path("description").asText("");
        continue;
      }
      detections.add(
          new TextDetection(
              text.path("description").asText(""),
              vertices(text.path("boundingPoly").path("vertices"), 1, 1)));
    }

    List<DetectedObject> objects = new ArrayList<>();
    for (JsonNode object : response.path("localizedObjectAnnotations")) {
      objects.add(
          new DetectedObject(
              object.path("name").asText(""),
              object.path("score").asDouble(0),
              DetectionKind.OBJECT,
              BoundingBox.fromVertices(
                  vertices(
                      object.path("boundingPoly").path("normalizedVertices"), width, height))));
    }
    for (JsonNode logo : response.path("logoAnnotations")) {
      objects.add(
          new DetectedObject(
              logo.path("description").asText(""),
              logo.path("score").asDouble(0),
              DetectionKind.LOGO,
              BoundingBox.fromVertices(
                  vertices(logo.path("boundingPoly").path("vertices"), 1, 1))));
    }
    return new VisionAnnotations(fullText, detections, objects, ProviderStatus.OK);
  }

  // Missing coordinates are zero in the Vision API
  private static List<Point> vertices(JsonNode node, double scaleX, double scaleY) {
    List<Point> points = new ArrayList<>();
    for (JsonNode vertex : node) {
      points.add(
          new Point(vertex.path("x").asDouble(0) * scaleX, vertex.path("y").asDouble(0) * scaleY));
    }
    return points;
  }
}
