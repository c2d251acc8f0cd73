package com.flamingo.ai.autocategorize.service.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.enums.EvidenceKind;
import com.flamingo.ai.autocategorize.domain.enums.MatchType;
import com.flamingo.ai.autocategorize.domain.model.BoundingBox;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import com.flamingo.ai.autocategorize.domain.model.ReferenceImage;
import com.flamingo.ai.autocategorize.support.TestImages;
import java.awt.Color;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link SimilarImagePropagator}. */
class SimilarImagePropagatorTest {

  private ImageFeatureExtractor extractor;
  private SimilarImagePropagator propagator;
  private byte[] candidatePng;
  private ImageFeatures candidate;

  @BeforeEach
  void setUp() throws IOException {
    extractor = new ImageFeatureExtractor();
    propagator =
        new SimilarImagePropagator(extractor, new ImageComparator(), new CategorizationConfig());
    candidatePng = TestImages.png(TestImages.checkerboard(120, 120, 12));
    candidate = extractor.extractFeatures(candidatePng);
  }

  @Test
  void shouldPropagateVisualMatches_whenReferenceIsIdentical() {
    ReferenceImage reference =
        new ReferenceImage(
            "img-1", "truck.png", candidatePng, List.of(visual("p1", "Logo: Acme", 0.8)));

    List<MatchCandidate> propagated =
        propagator.propagate(candidate, List.of(reference), List.of());

    assertThat(propagated).hasSize(1);
    MatchCandidate match = propagated.get(0);
    assertThat(match.text()).isEqualTo("Logo: Acme (similar to truck.png)");
    assertThat(match.patternRef()).isEqualTo("similar_img-1_p1");
    assertThat(match.category()).isEqualTo("Logistics");
    assertThat(match.confidence()).isCloseTo(0.8, within(1e-6));
    assertThat(match.evidenceKind()).isEqualTo(EvidenceKind.IMAGE_SIMILARITY);
    assertThat(match.matchType()).isEqualTo(MatchType.SIMILAR_IMAGE);
    assertThat(match.boundingBox()).isEqualTo(new BoundingBox(0, 0, 50, 50));
  }

  @Test
  void shouldCapPropagatedConfidence() {
    ReferenceImage reference =
        new ReferenceImage(
            "img-1", "truck.png", candidatePng, List.of(visual("p1", "Logo: Acme", 1.0)));

    List<MatchCandidate> propagated =
        propagator.propagate(candidate, List.of(reference), List.of());

    assertThat(propagated.get(0).confidence()).isEqualTo(0.9);
  }

  @Test
  void shouldSkipReference_whenSimilarityIsBelowThreshold() throws IOException {
    ImageFeatures black = extractor.extractFeatures(TestImages.solidPng(64, 64, Color.BLACK));
    ReferenceImage white =
        new ReferenceImage(
            "img-2",
            "white.png",
            TestImages.solidPng(64, 64, Color.WHITE),
            List.of(visual("p1", "Logo: Acme", 0.8)));

    assertThat(propagator.propagate(black, List.of(white), List.of())).isEmpty();
  }

  @Test
  void shouldNotDuplicate_existingTextAndCategory() {
    MatchCandidate existing = visual("p9", "Logo: Acme", 0.7);
    ReferenceImage reference =
        new ReferenceImage(
            "img-1",
            "truck.png",
            candidatePng,
            List.of(visual("p1", "Logo: Acme", 0.8), visual("p2", "Object: Truck", 0.6)));

    List<MatchCandidate> propagated =
        propagator.propagate(candidate, List.of(reference), List.of(existing));

    assertThat(propagated).extracting(MatchCandidate::text)
        .containsExactly("Object: Truck (similar to truck.png)");
  }

  @Test
  void shouldPropagateOnce_whenTwoReferencesShareName() {
    ReferenceImage first =
        new ReferenceImage(
            "img-1", "truck.png", candidatePng, List.of(visual("p1", "Logo: Acme", 0.8)));
    ReferenceImage second =
        new ReferenceImage(
            "img-2", "truck.png", candidatePng, List.of(visual("p1", "Logo: Acme", 0.8)));

    List<MatchCandidate> propagated =
        propagator.propagate(candidate, List.of(first, second), List.of());

    assertThat(propagated).hasSize(1);
    assertThat(propagated.get(0).patternRef()).isEqualTo("similar_img-1_p1");
  }

  @Test
  void shouldSkipUndecodableReference_andContinue() {
    ReferenceImage broken =
        new ReferenceImage(
            "img-0",
            "broken.png",
            "not an image".getBytes(),
            List.of(visual("p1", "Logo: Acme", 0.8)));
    ReferenceImage good =
        new ReferenceImage(
            "img-1", "truck.png", candidatePng, List.of(visual("p1", "Logo: Acme", 0.8)));

    List<MatchCandidate> propagated =
        propagator.propagate(candidate, List.of(broken, good), List.of());

    assertThat(propagated)
        .extracting(MatchCandidate::patternRef)
        .containsExactly("similar_img-1_p1");
  }

  @Test
  void shouldSkipReference_withoutVisualMatches() {
    ReferenceImage reference = new ReferenceImage("img-1", "truck.png", candidatePng, List.of());

    assertThat(propagator.propagate(candidate, List.of(reference), List.of())).isEmpty();
  }

  private static MatchCandidate visual(String patternRef, String text, double confidence) {
    return MatchCandidate.builder()
        .patternRef(patternRef)
        .category("Logistics")
        .confidence(confidence)
        .evidenceKind(EvidenceKind.IMAGE_VISUAL)
        .matchType(MatchType.VISUAL_LOGO)
        .text(text)
        .boundingBox(new BoundingBox(0, 0, 50, 50))
        .build();
  }
}
