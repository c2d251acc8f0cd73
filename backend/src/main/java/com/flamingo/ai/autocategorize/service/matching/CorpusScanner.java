package com.flamingo.ai.autocategorize.service.matching;

import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.model.AnnotationPattern;
import com.flamingo.ai.autocategorize.domain.model.AnnotationRecord;
import com.flamingo.ai.autocategorize.domain.model.CategoryLookup;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Applies a {@link PatternScorer} to every pattern of one kind in the corpus.
 *
 * <p>Large corpora are split into batches scored on the corpus scan executor. Results are always
 * returned in corpus order, whichever batch finishes first. A pattern whose scoring throws is
 * logged, counted and skipped; it never fails the scan.
 */
@Component
@Slf4j
public class CorpusScanner {

  private final Executor executor;
  private final CategorizationConfig config;
  private final MeterRegistry meterRegistry;

  public CorpusScanner(
      @Qualifier("corpusScanExecutor") Executor executor,
      CategorizationConfig config,
      MeterRegistry meterRegistry) {
    this.executor = executor;
    this.config = config;
    this.meterRegistry = meterRegistry;
  }

  public <P extends AnnotationPattern> List<MatchCandidate> scan(
      List<AnnotationRecord> corpus,
      Class<P> kind,
      CategoryLookup directory,
      PatternScorer<P> scorer) {
    List<ScanItem<P>> items = new ArrayList<>();
    for (AnnotationRecord record : corpus) {
      String category = directory.resolve(record.categoryId());
      record.patternsOf(kind).forEach(pattern -> items.add(new ScanItem<>(pattern, category)));
    }
    if (items.isEmpty()) {
      return List.of();
    }

    CategorizationConfig.Scan settings = config.getScan();
    if (items.size() < settings.getParallelThreshold()) {
      return scoreBatch(items, scorer);
    }

    int batchSize = Math.max(1, settings.getBatchSize());
    List<CompletableFuture<List<MatchCandidate>>> futures = new ArrayList<>();
    for (int start = 0; start < items.size(); start += batchSize) {
      List<ScanItem<P>> batch = items.subList(start, Math.min(items.size(), start + batchSize));
      futures.add(CompletableFuture.supplyAsync(() -> scoreBatch(batch, scorer), executor));
    }
    log.debug(
        "Scanning {} {} patterns in {} batches",
        items.size(),
        kind.getSimpleName(),
        futures.size());

    List<MatchCandidate> candidates = new ArrayList<>();
    for (CompletableFuture<List<MatchCandidate>> future : futures) {
      candidates.addAll(future.join());
    }
    return candidates;
  }

  private <P extends AnnotationPattern> List<MatchCandidate> scoreBatch(
      List<ScanItem<P>> batch, PatternScorer<P> scorer) {
    List<MatchCandidate> candidates = new ArrayList<>();
    for (ScanItem<P> item : batch) {
      scoreSafely(item, scorer).ifPresent(candidates::add);
    }
    return candidates;
  }

  private <P extends AnnotationPattern> Optional<MatchCandidate> scoreSafely(
      ScanItem<P> item, PatternScorer<P> scorer) {
    try {
      return scorer.score(item.pattern(), item.category());
    } catch (RuntimeException e) {
      log.warn("Skipping pattern {} during scoring: {}", item.pattern().id(), e.getMessage());
      meterRegistry
          .counter("categorization.patterns.skipped", "reason", "scoring_error")
          .increment();
      return Optional.empty();
    }
  }

  private record ScanItem<P>(P pattern, String category) {}
}
