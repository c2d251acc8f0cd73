package com.flamingo.ai.autocategorize.service.image;

import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.enums.DetectionKind;
import com.flamingo.ai.autocategorize.domain.enums.MatchType;
import com.flamingo.ai.autocategorize.domain.model.BoundingBox;
import com.flamingo.ai.autocategorize.domain.model.DetectedObject;
import java.awt.image.BufferedImage;
import java.awt.image.RasterFormatException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether a stored visual region of the candidate image holds a meaningful visual element.
 *
 * <p>Rules, first applicable wins:
 *
 * <ol>
 *   <li>an object localised by the detector overlaps the region;
 *   <li>a logo localised by the detector overlaps the region;
 *   <li>pixel features of the cropped region pass the texture, edge or histogram thresholds (the
 *       stricter set when a detector answered for the image);
 *   <li>the region could not be cropped but is large enough to be assumed a visual element.
 * </ol>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VisualRegionAnalyzer {

  static final String PIXEL_PATTERN = "Visual Pattern (pixel features)";
  static final String PIXEL_ONLY_PATTERN = "Visual Pattern (pixel features only)";
  static final String FALLBACK_ELEMENT = "Visual Element (fallback)";

  private final ImageFeatureExtractor featureExtractor;
  private final CategorizationConfig config;

  /**
   * Analyses one stored region.
   *
   * @param image decoded candidate image; null when it could not be decoded
   * @param region stored annotation box in image pixels
   * @param detections objects and logos localised on the whole image
   * @param detectorAvailable whether the detector answered for the image
   * @return the finding, or empty when nothing meaningful is in the region
   */
  public Optional<VisualFinding> analyze(
      BufferedImage image,
      BoundingBox region,
      List<DetectedObject> detections,
      boolean detectorAvailable) {
    CategorizationConfig.Image settings = config.getImage();
    try {
      if (image == null) {
        throw new RasterFormatException("Candidate image is not decodable");
      }
      int cropX = Math.max(0, (int) Math.round(region.x1()));
      int cropY = Math.max(0, (int) Math.round(region.y1()));
      int cropWidth = Math.min((int) Math.round(region.width()), image.getWidth() - cropX);
      int cropHeight = Math.min((int) Math.round(region.height()), image.getHeight() - cropY);

      if (cropWidth <= settings.getMinCropSide() || cropHeight <= settings.getMinCropSide()) {
        log.debug("Region too small for analysis: {}x{}", cropWidth, cropHeight);
        return Optional.empty();
      }

      if (detectorAvailable) {
        Optional<VisualFinding> detected = fromDetections(region, detections);
        if (detected.isPresent()) {
          return detected;
        }
      }

      BufferedImage crop = image.getSubimage(cropX, cropY, cropWidth, cropHeight);
      ImageFeatures features = featureExtractor.extractFeatures(crop);
      double area = (double) cropWidth * cropHeight;
      CategorizationConfig.VisualThresholds thresholds =
          detectorAvailable ? settings.getWithDetector() : settings.getPixelsOnly();

      if (passes(features, area, thresholds)) {
        log.debug(
            "Visual pattern in {}: texture={}, edges={}",
            region,
            features.textureComplexity(),
            features.edgeDensity());
        return Optional.of(
            new VisualFinding(
                detectorAvailable ? PIXEL_PATTERN : PIXEL_ONLY_PATTERN,
                thresholds.getConfidence(),
                MatchType.VISUAL_PATTERN));
      }
      return Optional.empty();
    } catch (RasterFormatException e) {
      log.warn("Could not crop region {}: {}", region, e.getMessage());
      if (region.area() >= settings.getFallbackMinArea()) {
        return Optional.of(
            new VisualFinding(
                FALLBACK_ELEMENT, settings.getFallbackConfidence(), MatchType.VISUAL_FALLBACK));
      }
      return Optional.empty();
    }
  }

  private Optional<VisualFinding> fromDetections(
      BoundingBox region, List<DetectedObject> detections) {
    Optional<DetectedObject> object = bestOverlapping(region, detections, DetectionKind.OBJECT);
    if (object.isPresent()) {
      double confidence = Math.min(0.9, 0.5 + object.get().score() * 0.4);
      return Optional.of(
          new VisualFinding(
              "Object: " + object.get().name(), confidence, MatchType.VISUAL_OBJECT));
    }
    Optional<DetectedObject> logo = bestOverlapping(region, detections, DetectionKind.LOGO);
    if (logo.isPresent()) {
      double confidence = Math.min(0.9, 0.6 + logo.get().score() * 0.3);
      return Optional.of(
          new VisualFinding("Logo: " + logo.get().name(), confidence, MatchType.VISUAL_LOGO));
    }
    return Optional.empty();
  }

  private static Optional<DetectedObject> bestOverlapping(
      BoundingBox region, List<DetectedObject> detections, DetectionKind kind) {
    return detections.stream()
        .filter(d -> d.kind() == kind)
        .filter(d -> d.boundingBox() != null && d.boundingBox().overlaps(region))
        .max(Comparator.comparingDouble(DetectedObject::score));
  }

  private static boolean passes(
      ImageFeatures features, double area, CategorizationConfig.VisualThresholds thresholds) {
    boolean texture = features.textureComplexity() > thresholds.getTexture();
    boolean edges = features.edgeDensity() > thresholds.getEdges();
    boolean distinctColors = features.maxHistogramBin() > thresholds.getHistogramPeak();
    return (texture || edges || distinctColors) && area >= thresholds.getMinArea();
  }
}
