package com.flamingo.ai.autocategorize.service.matching;

import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.enums.EvidenceKind;
import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.enums.MatchType;
import com.flamingo.ai.autocategorize.domain.model.AnalysisRequest;
import com.flamingo.ai.autocategorize.domain.model.ImageContent;
import com.flamingo.ai.autocategorize.domain.model.ImagePattern;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import com.flamingo.ai.autocategorize.domain.model.VisualPattern;
import com.flamingo.ai.autocategorize.service.image.ImageFeatureExtractor;
import com.flamingo.ai.autocategorize.service.image.RegionCorrelator;
import com.flamingo.ai.autocategorize.service.image.SimilarImagePropagator;
import com.flamingo.ai.autocategorize.service.image.VisualRegionAnalyzer;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Image modality: OCR text regions, visual regions and evidence propagated from similar images.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImageRegionMatcher implements ModalityMatcher {

  private final CorpusScanner scanner;
  private final RegionCorrelator correlator;
  private final VisualRegionAnalyzer visualAnalyzer;
  private final SimilarImagePropagator propagator;
  private final ImageFeatureExtractor featureExtractor;
  private final CategorizationConfig config;

  @Override
  public boolean supports(FileType fileType) {
    return fileType == FileType.IMAGE;
  }

  @Override
  public MatchOutcome match(AnalysisRequest request) {
    ImageContent content = (ImageContent) request.content();
    Map<String, Object> diagnostics = new LinkedHashMap<>();
    diagnostics.put("ocrTextLength", content.ocrText().length());
    diagnostics.put("detectedObjects", content.detectedObjects().size());
    diagnostics.put("width", content.width());
    diagnostics.put("height", content.height());

    BufferedImage image = decodeQuietly(content.imageBytes());

    List<MatchCandidate> textMatches = uniqueByPattern(textMatches(request, content));
    List<MatchCandidate> visualMatches =
        uniqueByLabel(uniqueByPattern(visualMatches(request, content, image)), request);

    List<MatchCandidate> propagated = List.of();
    if (image != null && !visualMatches.isEmpty() && !request.referenceImages().isEmpty()) {
      propagated =
          propagator.propagate(
              featureExtractor.extractFeatures(image), request.referenceImages(), visualMatches);
    }

    diagnostics.put("textMatches", textMatches.size());
    diagnostics.put("visualMatches", visualMatches.size() + propagated.size());
    log.debug(
        "Image matching: {} text, {} visual, {} propagated",
        textMatches.size(),
        visualMatches.size(),
        propagated.size());

    List<MatchCandidate> all = new ArrayList<>(textMatches);
    all.addAll(visualMatches);
    all.addAll(propagated);
    return new MatchOutcome(all, diagnostics);
  }

  private List<MatchCandidate> textMatches(AnalysisRequest request, ImageContent content) {
    if (content.textDetections().isEmpty()) {
      return List.of();
    }
    double confidence = config.getImage().getTextMatchConfidence();
    return scanner.scan(
        request.corpus(),
        ImagePattern.class,
        request.directory(),
        (pattern, category) ->
            correlator
                .bestTextMatch(pattern.ocrText(), pattern.boundingBox(), content.textDetections())
                .map(
                    match ->
                        MatchCandidate.builder()
                            .patternRef(pattern.id())
                            .category(category)
                            .confidence(confidence)
                            .evidenceKind(EvidenceKind.IMAGE_TEXT)
                            .matchType(MatchType.OCR_TEXT)
                            .text(pattern.ocrText())
                            .snippet(match.detectedText())
                            .boundingBox(match.detectedBox())
                            .annotationBoundingBox(pattern.boundingBox())
                            .ocrConfidence(pattern.ocrConfidence())
                            .build()));
  }

  private List<MatchCandidate> visualMatches(
      AnalysisRequest request, ImageContent content, BufferedImage image) {
    return scanner.scan(
        request.corpus(),
        VisualPattern.class,
        request.directory(),
        (pattern, category) ->
            visualAnalyzer
                .analyze(
                    image,
                    pattern.boundingBox(),
                    content.detectedObjects(),
                    content.detectorAvailable())
                .map(
                    finding ->
                        MatchCandidate.builder()
                            .patternRef(pattern.id())
                            .category(category)
                            .confidence(finding.confidence())
                            .evidenceKind(EvidenceKind.IMAGE_VISUAL)
                            .matchType(finding.matchType())
                            .text(finding.description())
                            .boundingBox(pattern.boundingBox())
                            .annotationBoundingBox(pattern.boundingBox())
                            .build()));
  }

  // A pattern id shared by several records is only counted once
  private static List<MatchCandidate> uniqueByPattern(List<MatchCandidate> candidates) {
    Set<String> seen = new HashSet<>();
    List<MatchCandidate> unique = new ArrayList<>();
    for (MatchCandidate candidate : candidates) {
      if (candidate.patternRef() == null || seen.add(candidate.patternRef())) {
        unique.add(candidate);
      }
    }
    return unique;
  }

  private static List<MatchCandidate> uniqueByLabel(
      List<MatchCandidate> candidates, AnalysisRequest request) {
    Map<String, String> labels = new HashMap<>();
    request
        .corpus()
        .forEach(
            record ->
                record
                    .patternsOf(VisualPattern.class)
                    .filter(p -> p.id() != null && p.label() != null)
                    .forEach(p -> labels.putIfAbsent(p.id(), p.label())));

    Set<String> seen = new HashSet<>();
    List<MatchCandidate> unique = new ArrayList<>();
    for (MatchCandidate candidate : candidates) {
      String label = labels.get(candidate.patternRef());
      if (label == null || seen.add(label)) {
        unique.add(candidate);
      } else {
        log.debug("Skipping duplicate visual label '{}'", label);
      }
    }
    return unique;
  }

  private BufferedImage decodeQuietly(byte[] imageBytes) {
    try {
      return featureExtractor.decode(imageBytes);
    } catch (IOException e) {
      log.warn("Candidate image could not be decoded for region analysis: {}", e.getMessage());
      return null;
    }
  }
}
