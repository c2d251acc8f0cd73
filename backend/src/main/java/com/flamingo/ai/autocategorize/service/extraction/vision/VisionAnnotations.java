package com.flamingo.ai.autocategorize.service.extraction.vision;

import com.flamingo.ai.autocategorize.domain.model.DetectedObject;
import com.flamingo.ai.autocategorize.domain.model.TextDetection;
import com.flamingo.ai.autocategorize.service.extraction.ProviderStatus;
import java.util.List;

/**
 * OCR and object/logo localisation for one image.
 *
 * @param fullText complete OCR text
 * @param textDetections word-level detections, without the full-text entry
 * @param detectedObjects objects and logos in image pixel coordinates
 * @param status whether the provider answered
 */
public record VisionAnnotations(
    String fullText,
    List<TextDetection> textDetections,
    List<DetectedObject> detectedObjects,
    ProviderStatus status) {

  public VisionAnnotations {
    fullText = fullText == null ? "" : fullText;
    textDetections = textDetections == null ? List.of() : List.copyOf(textDetections);
    detectedObjects = detectedObjects == null ? List.of() : List.copyOf(detectedObjects);
  }

  public static VisionAnnotations disabled() {
    return new VisionAnnotations("", List.of(), List.of(), ProviderStatus.DISABLED);
  }

  public static VisionAnnotations failed() {
    return new VisionAnnotations("", List.of(), List.of(), ProviderStatus.FAILED);
  }
}
