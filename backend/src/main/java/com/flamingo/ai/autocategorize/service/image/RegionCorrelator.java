package com.flamingo.ai.autocategorize.service.image;

import com.flamingo.ai.autocategorize.domain.model.BoundingBox;
import com.flamingo.ai.autocategorize.domain.model.TextDetection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Correlates OCR detections of the candidate image with the box and text of a stored image
 * pattern.
 */
@Component
public class RegionCorrelator {

  /**
   * Picks the detection that best reproduces the stored text inside the stored region.
   *
   * <p>A detection qualifies when its box overlaps {@code storedBox} and either text contains the
   * other, ignoring case. Among qualifying detections the one with the highest shorter/longer
   * length ratio wins; the first one wins ties.
   *
   * @param storedText OCR text recorded with the pattern
   * @param storedBox region recorded with the pattern
   * @param detections OCR detections of the candidate image
   * @return the best detection, or empty when none qualifies
   */
  public Optional<RegionMatch> bestTextMatch(
      String storedText, BoundingBox storedBox, List<TextDetection> detections) {
    if (storedText == null || storedText.isBlank() || storedBox == null) {
      return Optional.empty();
    }
    String stored = storedText.toLowerCase(Locale.ROOT);

    RegionMatch best = null;
    for (TextDetection detection : detections) {
      BoundingBox box = detection.boundingBox();
      if (box == null || !box.overlaps(storedBox) || detection.text().isEmpty()) {
        continue;
      }
      String detected = detection.text().toLowerCase(Locale.ROOT);
      if (!detected.contains(stored) && !stored.contains(detected)) {
        continue;
      }
      double score =
          (double) Math.min(detected.length(), stored.length())
              / Math.max(detected.length(), stored.length());
      if (best == null || score > best.score()) {
        best = new RegionMatch(detection.text(), box, score);
      }
    }
    return Optional.ofNullable(best);
  }
}
