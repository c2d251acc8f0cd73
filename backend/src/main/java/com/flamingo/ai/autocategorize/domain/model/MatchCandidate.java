package com.flamingo.ai.autocategorize.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.autocategorize.domain.enums.EvidenceKind;
import com.flamingo.ai.autocategorize.domain.enums.MatchType;
import lombok.Builder;

/**
 * One scored piece of evidence linking the candidate file to a category through a stored pattern.
 * Only the fields relevant to the producing modality are set.
 *
 * @param patternRef id of the stored pattern (or a synthetic id for propagated image evidence)
 * @param category resolved category name
 * @param confidence score in [0, 1]; clamped on construction
 * @param evidenceKind matcher that produced the evidence
 * @param matchType how the pattern matched
 * @param text the stored pattern text, or a description of the visual finding
 * @param snippet excerpt of the candidate content around the match
 * @param boundingBox region in the candidate image
 * @param annotationBoundingBox region of the stored annotation
 * @param pageNumber 1-based PDF page holding the keyword
 * @param startTime audio span start copied from the stored pattern
 * @param endTime audio span end copied from the stored pattern
 * @param matchedKey flattened JSON path that matched
 * @param matchedValue JSON value at that path
 * @param ocrConfidence recognition confidence stored with an OCR text pattern, when known
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchCandidate(
    String patternRef,
    String category,
    double confidence,
    EvidenceKind evidenceKind,
    MatchType matchType,
    String text,
    String snippet,
    BoundingBox boundingBox,
    BoundingBox annotationBoundingBox,
    Integer pageNumber,
    Double startTime,
    Double endTime,
    String matchedKey,
    String matchedValue,
    Double ocrConfidence) {

  public MatchCandidate {
    confidence = clamp(confidence);
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
