package com.flamingo.ai.autocategorize.service.matching;

import static com.flamingo.ai.autocategorize.support.TestCorpus.directory;
import static com.flamingo.ai.autocategorize.support.TestCorpus.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.enums.EvidenceKind;
import com.flamingo.ai.autocategorize.domain.model.AnnotationRecord;
import com.flamingo.ai.autocategorize.domain.model.CategoryLookup;
import com.flamingo.ai.autocategorize.domain.model.JsonPattern;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import com.flamingo.ai.autocategorize.domain.model.PdfPattern;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CorpusScanner}. */
class CorpusScannerTest {

  private CategorizationConfig config;
  private SimpleMeterRegistry meterRegistry;
  private ExecutorService executor;
  private CorpusScanner scanner;

  @BeforeEach
  void setUp() {
    config = new CategorizationConfig();
    meterRegistry = new SimpleMeterRegistry();
    executor = Executors.newFixedThreadPool(4);
    scanner = new CorpusScanner(executor, config, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void shouldResolveCategories_andOnlyVisitRequestedKind() {
    List<AnnotationRecord> corpus =
        List.of(
            record("c1", new PdfPattern("p1", null, "invoice", null), json("j1")),
            record("missing", new PdfPattern("p2", null, "receipt", null)));
    CategoryLookup categories = directory("c1", "Finance");

    List<MatchCandidate> candidates = scanner.scan(corpus, PdfPattern.class, categories, this::hit);

    assertThat(candidates)
        .extracting(MatchCandidate::patternRef, MatchCandidate::category)
        .containsExactly(
            tuple("p1", "Finance"),
            tuple("p2", "unknown"));
  }

  @Test
  @DisplayName("Parallel scans return candidates in corpus order")
  void shouldPreserveCorpusOrder_whenScanningInParallel() {
    config.getScan().setParallelThreshold(10);
    config.getScan().setBatchSize(7);
    List<AnnotationRecord> corpus = new ArrayList<>();
    List<String> expected = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      corpus.add(record("c" + (i % 3), new PdfPattern("p" + i, null, "kw" + i, null)));
      expected.add("p" + i);
    }

    List<MatchCandidate> candidates =
        scanner.scan(
            corpus,
            PdfPattern.class,
            CategoryLookup.empty(),
            (pattern, category) -> {
              // Later batches finish first
              sleepQuietly(100 - Integer.parseInt(pattern.id().substring(1)));
              return hit(pattern, category);
            });

    assertThat(candidates)
        .extracting(MatchCandidate::patternRef)
        .containsExactlyElementsOf(expected);
  }

  @Test
  void shouldSkipAndCountPattern_whenScoringThrows() {
    List<AnnotationRecord> corpus =
        List.of(
            record(
                "c1",
                new PdfPattern("p1", null, "invoice", null),
                new PdfPattern("boom", null, "invoice", null),
                new PdfPattern("p3", null, "invoice", null)));

    List<MatchCandidate> candidates =
        scanner.scan(
            corpus,
            PdfPattern.class,
            CategoryLookup.empty(),
            (pattern, category) -> {
              if ("boom".equals(pattern.id())) {
                throw new IllegalStateException("bad pattern");
              }
              return hit(pattern, category);
            });

    assertThat(candidates).extracting(MatchCandidate::patternRef).containsExactly("p1", "p3");
    assertThat(
            meterRegistry
                .counter("categorization.patterns.skipped", "reason", "scoring_error")
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldReturnEmpty_whenCorpusHasNoPatternsOfKind() {
    List<AnnotationRecord> corpus = List.of(record("c1", json("j1")));

    assertThat(scanner.scan(corpus, PdfPattern.class, CategoryLookup.empty(), this::hit)).isEmpty();
  }

  private Optional<MatchCandidate> hit(PdfPattern pattern, String category) {
    return Optional.of(
        MatchCandidate.builder()
            .patternRef(pattern.id())
            .category(category)
            .confidence(0.9)
            .evidenceKind(EvidenceKind.PDF_KEYWORD)
            .text(pattern.keywordText())
            .build());
  }

  private static JsonPattern json(String id) {
    return new JsonPattern(id, null, "key", "value");
  }

  private static void sleepQuietly(long millis) {
    try {
      Thread.sleep(Math.max(0, millis) / 10);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
