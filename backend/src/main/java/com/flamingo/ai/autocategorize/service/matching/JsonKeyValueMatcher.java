package com.flamingo.ai.autocategorize.service.matching;

import com.flamingo.ai.autocategorize.domain.enums.EvidenceKind;
import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.enums.MatchType;
import com.flamingo.ai.autocategorize.domain.model.AnalysisRequest;
import com.flamingo.ai.autocategorize.domain.model.FlattenedEntry;
import com.flamingo.ai.autocategorize.domain.model.JsonContent;
import com.flamingo.ai.autocategorize.domain.model.JsonPattern;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import com.flamingo.ai.autocategorize.exception.MalformedPatternException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Matches stored JSON key/value pairs against the flattened candidate document.
 *
 * <p>Each pattern is tried tier by tier (exact key, exact value, partial key, partial value). The
 * first entry satisfying the highest satisfiable tier becomes the pattern's only candidate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonKeyValueMatcher implements ModalityMatcher {

  private final CorpusScanner scanner;

  enum Tier {
    EXACT_KEY(0.95, MatchType.EXACT_KEY),
    EXACT_VALUE(0.9, MatchType.EXACT_VALUE),
    PARTIAL_KEY(0.8, MatchType.PARTIAL_KEY),
    PARTIAL_VALUE(0.7, MatchType.PARTIAL_VALUE);

    final double confidence;
    final MatchType matchType;

    Tier(double confidence, MatchType matchType) {
      this.confidence = confidence;
      this.matchType = matchType;
    }

    boolean test(String patternKey, String patternValue, LowerEntry entry) {
      return switch (this) {
        case EXACT_KEY -> entry.key().equals(patternKey);
        case EXACT_VALUE -> entry.value().equals(patternValue);
        case PARTIAL_KEY -> TextSimilarity.mutuallyContains(entry.key(), patternKey);
        case PARTIAL_VALUE -> TextSimilarity.mutuallyContains(entry.value(), patternValue);
      };
    }
  }

  @Override
  public boolean supports(FileType fileType) {
    return fileType == FileType.JSON;
  }

  @Override
  public MatchOutcome match(AnalysisRequest request) {
    JsonContent content = (JsonContent) request.content();
    Map<String, Object> diagnostics = new LinkedHashMap<>();
    diagnostics.put("extractedKeyCount", content.entries().size());

    if (content.isEmpty()) {
      return MatchOutcome.empty(diagnostics);
    }
    List<LowerEntry> entries = content.entries().stream().map(LowerEntry::of).toList();

    List<MatchCandidate> candidates =
        scanner.scan(
            request.corpus(),
            JsonPattern.class,
            request.directory(),
            (pattern, category) -> score(pattern, category, entries));
    return new MatchOutcome(candidates, diagnostics);
  }

  private Optional<MatchCandidate> score(
      JsonPattern pattern, String category, List<LowerEntry> entries) {
    if (pattern.jsonKey() == null || pattern.jsonValue() == null) {
      throw new MalformedPatternException(pattern.id(), "JSON pattern needs both key and value");
    }
    String key = pattern.jsonKey().toLowerCase(Locale.ROOT);
    String value = pattern.jsonValue().toLowerCase(Locale.ROOT);

    for (Tier tier : Tier.values()) {
      for (LowerEntry entry : entries) {
        if (tier.test(key, value, entry)) {
          log.debug(
              "JSON pattern {}={} matched {} as {}",
              pattern.jsonKey(),
              pattern.jsonValue(),
              entry.source().path(),
              tier);
          return Optional.of(candidate(pattern, category, tier, entry.source()));
        }
      }
    }
    return Optional.empty();
  }

  private static MatchCandidate candidate(
      JsonPattern pattern, String category, Tier tier, FlattenedEntry entry) {
    String matchedValue = entry.valueText();
    return MatchCandidate.builder()
        .patternRef(pattern.id())
        .category(category)
        .confidence(tier.confidence)
        .evidenceKind(EvidenceKind.JSON_KEY_VALUE)
        .matchType(tier.matchType)
        .text(pattern.jsonKey() + ": " + pattern.jsonValue())
        .snippet("Key: \"" + entry.path() + "\" = Value: \"" + matchedValue + "\"")
        .matchedKey(entry.path())
        .matchedValue(matchedValue)
        .build();
  }

  record LowerEntry(String key, String value, FlattenedEntry source) {
    static LowerEntry of(FlattenedEntry entry) {
      return new LowerEntry(
          entry.path().toLowerCase(Locale.ROOT),
          entry.valueText().toLowerCase(Locale.ROOT),
          entry);
    }
  }
}
