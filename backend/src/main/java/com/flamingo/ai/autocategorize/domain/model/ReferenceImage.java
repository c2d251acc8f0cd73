package com.flamingo.ai.autocategorize.domain.model;

import java.util.List;

/**
 * A previously categorised image whose visual matches may be propagated to a similar upload.
 *
 * @param imageId identifier of the stored image
 * @param name file name, used in propagated evidence descriptions
 * @param imageBytes encoded image
 * @param visualMatches visual evidence recorded when the image itself was analysed
 */
public record ReferenceImage(
    String imageId, String name, byte[] imageBytes, List<MatchCandidate> visualMatches) {

  public ReferenceImage {
    visualMatches = visualMatches == null ? List.of() : List.copyOf(visualMatches);
  }
}
