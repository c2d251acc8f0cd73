package com.flamingo.ai.autocategorize.service.image;

import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.enums.EvidenceKind;
import com.flamingo.ai.autocategorize.domain.enums.MatchType;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import com.flamingo.ai.autocategorize.domain.model.ReferenceImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Carries visual evidence over from previously categorised images that look like the candidate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimilarImagePropagator {

  private final ImageFeatureExtractor featureExtractor;
  private final ImageComparator comparator;
  private final CategorizationConfig config;

  /**
   * Builds propagated candidates.
   *
   * @param candidate features of the whole candidate image
   * @param references previously categorised images
   * @param existing visual candidates already found for the candidate image
   * @return new candidates, never duplicating an existing (text, category) pair
   */
  public List<MatchCandidate> propagate(
      ImageFeatures candidate, List<ReferenceImage> references, List<MatchCandidate> existing) {
    CategorizationConfig.Image settings = config.getImage();
    Set<String> seen = new HashSet<>();
    existing.forEach(match -> seen.add(key(match.text(), match.category())));

    List<MatchCandidate> propagated = new ArrayList<>();
    for (ReferenceImage reference : references) {
      if (reference.visualMatches().isEmpty()) {
        continue;
      }
      double similarity;
      try {
        similarity =
            comparator
                .compare(candidate, featureExtractor.extractFeatures(reference.imageBytes()))
                .similarity();
      } catch (IOException e) {
        log.warn("Skipping reference image {}: {}", reference.name(), e.getMessage());
        continue;
      }
      log.debug("Similarity with {}: {}", reference.name(), similarity);
      if (similarity < settings.getPropagationThreshold()) {
        continue;
      }

      for (MatchCandidate match : reference.visualMatches()) {
        String text = match.text() + " (similar to " + reference.name() + ")";
        if (seen.contains(key(match.text(), match.category()))
            || !seen.add(key(text, match.category()))) {
          continue;
        }
        propagated.add(
            match.toBuilder()
                .patternRef("similar_" + reference.imageId() + "_" + match.patternRef())
                .text(text)
                .confidence(
                    Math.min(
                        settings.getPropagationMaxConfidence(), match.confidence() * similarity))
                .evidenceKind(EvidenceKind.IMAGE_SIMILARITY)
                .matchType(MatchType.SIMILAR_IMAGE)
                .build());
      }
    }
    return propagated;
  }

  private static String key(String text, String category) {
    return text + '\u0000' + category;
  }
}
