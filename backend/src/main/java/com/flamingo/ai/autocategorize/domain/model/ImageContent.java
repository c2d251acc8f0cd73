package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import java.util.List;

/**
 * Extracted content of an image.
 *
 * @param ocrText full OCR text of the image
 * @param textDetections word-level OCR detections with polygons (full-text entry excluded)
 * @param detectedObjects objects and logos localised by the detector
 * @param imageBytes the original encoded image, used for cropping and whole-image comparison
 * @param width decoded width in pixels
 * @param height decoded height in pixels
 * @param detectorAvailable whether an object/logo detector answered for this image
 */
public record ImageContent(
    String ocrText,
    List<TextDetection> textDetections,
    List<DetectedObject> detectedObjects,
    byte[] imageBytes,
    int width,
    int height,
    boolean detectorAvailable)
    implements CandidateContent {

  public ImageContent {
    ocrText = ocrText == null ? "" : ocrText;
    textDetections = textDetections == null ? List.of() : List.copyOf(textDetections);
    detectedObjects = detectedObjects == null ? List.of() : List.copyOf(detectedObjects);
  }

  /** Image content without any provider output, used when OCR and detection are unavailable. */
  public static ImageContent pixelsOnly(byte[] imageBytes, int width, int height) {
    return new ImageContent("", List.of(), List.of(), imageBytes, width, height, false);
  }

  @Override
  public FileType fileType() {
    return FileType.IMAGE;
  }

  @Override
  public boolean isEmpty() {
    return ocrText.isBlank() && (imageBytes == null || imageBytes.length == 0);
  }
}
