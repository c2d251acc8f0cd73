package com.flamingo.ai.autocategorize.service.categorization;

import com.flamingo.ai.autocategorize.domain.model.AnalysisRequest;
import com.flamingo.ai.autocategorize.domain.model.AnalysisResult;
import com.flamingo.ai.autocategorize.service.aggregation.EvidenceAggregator;
import com.flamingo.ai.autocategorize.service.aggregation.Verdict;
import com.flamingo.ai.autocategorize.service.matching.MatchOutcome;
import com.flamingo.ai.autocategorize.service.matching.ModalityMatcher;
import com.flamingo.ai.autocategorize.service.matching.ModalityMatcherRouter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * In-process categorization engine. Selects the matcher for the request's file type, lets it score
 * the corpus and aggregates the resulting evidence. Performs no I/O of its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategorizationEngine {

  private final ModalityMatcherRouter router;
  private final EvidenceAggregator aggregator;
  private final MeterRegistry meterRegistry;

  /**
   * Analyses extracted content against the corpus carried by the request.
   *
   * @param request file type, content, corpus, category snapshot and reference images
   * @return the categorization result; {@code uncategorized} with confidence 0 without evidence
   * @throws IllegalArgumentException if the content does not belong to the declared file type
   */
  @Timed(value = "categorization.engine", description = "Time to match and aggregate evidence")
  public AnalysisResult analyze(AnalysisRequest request) {
    if (request.content() == null || request.content().fileType() != request.fileType()) {
      throw new IllegalArgumentException(
          "Content does not match declared file type " + request.fileType());
    }

    ModalityMatcher matcher = router.route(request.fileType());
    MatchOutcome outcome = matcher.match(request);
    Verdict verdict = aggregator.aggregate(outcome.candidates());

    Map<String, Object> diagnostics = new LinkedHashMap<>();
    diagnostics.put("fileType", request.fileType().name().toLowerCase(Locale.ROOT));
    diagnostics.putAll(outcome.diagnostics());
    diagnostics.put("matchCount", outcome.candidates().size());
    diagnostics.put("votes", verdict.votes());
    diagnostics.put("destPath", destinationPath(verdict.category()));

    AnalysisResult result =
        new AnalysisResult(
            verdict.category(), verdict.confidence(), outcome.candidates(), diagnostics);

    meterRegistry
        .counter(
            "categorization.requests",
            "file_type",
            request.fileType().name().toLowerCase(Locale.ROOT),
            "outcome",
            result.isCategorized() ? "categorized" : "uncategorized")
        .increment();
    log.info(
        "Categorized {} content as '{}' (confidence={}, matches={}, corpus records={})",
        request.fileType(),
        result.category(),
        String.format(Locale.ROOT, "%.2f", result.confidence()),
        outcome.candidates().size(),
        request.corpus().size());
    return result;
  }

  /** Folder path for a category name: lower-cased, whitespace runs replaced by dashes. */
  static String destinationPath(String category) {
    return "/category/" + category.toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
  }
}
