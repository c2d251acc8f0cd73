package com.flamingo.ai.autocategorize.service.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.autocategorize.domain.enums.PatternKind;
import com.flamingo.ai.autocategorize.domain.model.AnnotationPattern;
import com.flamingo.ai.autocategorize.domain.model.AudioSegmentPattern;
import com.flamingo.ai.autocategorize.domain.model.BoundingBox;
import com.flamingo.ai.autocategorize.domain.model.ImagePattern;
import com.flamingo.ai.autocategorize.domain.model.JsonPattern;
import com.flamingo.ai.autocategorize.domain.model.PdfPattern;
import com.flamingo.ai.autocategorize.domain.model.VisualPattern;
import com.flamingo.ai.autocategorize.exception.MalformedPatternException;
import org.springframework.stereotype.Component;

/**
 * Parses stored annotation JSON into typed patterns.
 *
 * <p>Stored annotations carry every field of every kind in one loose object; the {@code
 * annotationType} tag selects which fields are read. Annotations without a tag but with a box are
 * treated as image annotations. Audio segments fall back to {@code metadata.text}, {@code
 * metadata.startTime} and {@code metadata.endTime}.
 */
@Component
public class AnnotationPatternParser {

  /**
   * Parses one stored annotation.
   *
   * @throws MalformedPatternException if the id is missing, the type is unknown or a field the
   *     type requires is absent
   */
  public AnnotationPattern parse(JsonNode node) {
    String id = text(node, "id");
    if (id == null) {
      throw new MalformedPatternException(null, "Annotation has no id");
    }
    String label = text(node, "label");
    PatternKind kind = kindOf(id, node);

    return switch (kind) {
      case IMAGE -> new ImagePattern(
          id,
          label,
          text(node, "ocrText"),
          requireBox(id, node),
          number(node, "ocrConfidence"));
      case VISUAL -> new VisualPattern(id, label, requireBox(id, node));
      case PDF -> new PdfPattern(
          id,
          label,
          require(id, text(node, "keywordText"), "keywordText"),
          integer(node, "pageNumber"));
      case JSON -> new JsonPattern(
          id,
          label,
          require(id, text(node, "jsonKey"), "jsonKey"),
          require(id, text(node, "jsonValue"), "jsonValue"));
      case AUDIO_SEGMENT -> audioSegment(id, label, node);
    };
  }

  private AudioSegmentPattern audioSegment(String id, String label, JsonNode node) {
    JsonNode metadata = node.path("metadata");
    String text = firstNonNull(text(node, "text"), text(metadata, "text"));
    String keyword = text(node, "keywordText");
    if (text == null && keyword == null) {
      throw new MalformedPatternException(id, "Audio segment needs text or keywordText");
    }
    return new AudioSegmentPattern(
        id,
        label,
        text,
        keyword,
        firstNonNull(number(node, "startTime"), number(metadata, "startTime")),
        firstNonNull(number(node, "endTime"), number(metadata, "endTime")));
  }

  private PatternKind kindOf(String id, JsonNode node) {
    String tag = text(node, "annotationType");
    if (tag == null) {
      if (hasBox(node)) {
        return PatternKind.IMAGE;
      }
      throw new MalformedPatternException(id, "Annotation has no annotationType");
    }
    return PatternKind.fromTag(tag)
        .orElseThrow(
            () -> new MalformedPatternException(id, "Unknown annotationType '" + tag + "'"));
  }

  private static boolean hasBox(JsonNode node) {
    return node.path("x1").isNumber()
        && node.path("y1").isNumber()
        && node.path("x2").isNumber()
        && node.path("y2").isNumber();
  }

  private static BoundingBox requireBox(String id, JsonNode node) {
    if (!hasBox(node)) {
      throw new MalformedPatternException(id, "Annotation needs x1, y1, x2 and y2");
    }
    return new BoundingBox(
        node.path("x1").asDouble(),
        node.path("y1").asDouble(),
        node.path("x2").asDouble(),
        node.path("y2").asDouble());
  }

  private static String require(String id, String value, String field) {
    if (value == null) {
      throw new MalformedPatternException(id, "Annotation needs " + field);
    }
    return value;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return null;
    }
    String text = value.asText();
    return text.isBlank() ? null : text;
  }

  private static Double number(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isNumber() ? value.asDouble() : null;
  }

  private static Integer integer(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isNumber() ? value.asInt() : null;
  }

  private static <T> T firstNonNull(T first, T second) {
    return first != null ? first : second;
  }
}
