package com.flamingo.ai.autocategorize.service.categorization;

import static com.flamingo.ai.autocategorize.support.TestCorpus.directory;
import static com.flamingo.ai.autocategorize.support.TestCorpus.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.model.AnalysisRequest;
import com.flamingo.ai.autocategorize.domain.model.AnalysisResult;
import com.flamingo.ai.autocategorize.domain.model.AnnotationRecord;
import com.flamingo.ai.autocategorize.domain.model.CategoryLookup;
import com.flamingo.ai.autocategorize.domain.model.JsonContent;
import com.flamingo.ai.autocategorize.domain.model.PdfContent;
import com.flamingo.ai.autocategorize.domain.model.PdfPattern;
import com.flamingo.ai.autocategorize.service.aggregation.EvidenceAggregator;
import com.flamingo.ai.autocategorize.service.matching.AudioSegmentMatcher;
import com.flamingo.ai.autocategorize.service.matching.CorpusScanner;
import com.flamingo.ai.autocategorize.service.matching.JsonKeyValueMatcher;
import com.flamingo.ai.autocategorize.service.matching.ModalityMatcherRouter;
import com.flamingo.ai.autocategorize.service.matching.PdfKeywordMatcher;
import com.flamingo.ai.autocategorize.support.TestCorpus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CategorizationEngine}. */
class CategorizationEngineTest {

  private static final CategoryLookup CATEGORIES =
      directory("c1", "Finance", "c2", "Human Resources");

  private SimpleMeterRegistry meterRegistry;
  private CategorizationEngine engine;

  @BeforeEach
  void setUp() {
    CategorizationConfig config = new CategorizationConfig();
    meterRegistry = new SimpleMeterRegistry();
    CorpusScanner scanner = TestCorpus.directScanner(config, meterRegistry);
    ModalityMatcherRouter router =
        new ModalityMatcherRouter(
            List.of(
                new PdfKeywordMatcher(scanner, config),
                new JsonKeyValueMatcher(scanner),
                new AudioSegmentMatcher(scanner)));
    engine = new CategorizationEngine(router, new EvidenceAggregator(config), meterRegistry);
  }

  @Test
  @DisplayName("Invoice PDF lands in Finance")
  void shouldCategorizePdf_whenKeywordMatches() {
    List<AnnotationRecord> corpus =
        List.of(record("c1", new PdfPattern("p1", null, "Invoice Number", null)));

    AnalysisResult result =
        engine.analyze(
            new AnalysisRequest(
                FileType.PDF, PdfContent.fromRawText("Invoice Number: 12345"), corpus, CATEGORIES));

    assertThat(result.category()).isEqualTo("Finance");
    assertThat(result.confidence()).isEqualTo(0.9);
    assertThat(result.matches()).hasSize(1);
    assertThat(result.isCategorized()).isTrue();
    assertThat(result.diagnostics())
        .containsEntry("fileType", "pdf")
        .containsEntry("matchCount", 1)
        .containsEntry("destPath", "/category/finance")
        .containsKey("pageCount")
        .containsKey("votes");
    assertThat(
            meterRegistry
                .counter("categorization.requests", "file_type", "pdf", "outcome", "categorized")
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldReturnUncategorized_whenNothingMatches() {
    List<AnnotationRecord> corpus =
        List.of(record("c1", new PdfPattern("p1", null, "zebra", null)));

    AnalysisResult result =
        engine.analyze(
            new AnalysisRequest(
                FileType.PDF, PdfContent.fromRawText("Quarterly report"), corpus, CATEGORIES));

    assertThat(result.category()).isEqualTo(AnalysisResult.UNCATEGORIZED);
    assertThat(result.confidence()).isZero();
    assertThat(result.matches()).isEmpty();
    assertThat(result.diagnostics()).containsEntry("destPath", "/category/uncategorized");
  }

  @Test
  void shouldReturnUncategorized_whenCorpusIsEmpty() {
    AnalysisResult result =
        engine.analyze(
            new AnalysisRequest(
                FileType.JSON, new JsonContent(List.of()), List.of(), CategoryLookup.empty()));

    assertThat(result.isCategorized()).isFalse();
    assertThat(result.diagnostics()).containsEntry("extractedKeyCount", 0);
  }

  @Test
  void shouldThrow_whenContentDoesNotMatchFileType() {
    AnalysisRequest request =
        new AnalysisRequest(
            FileType.JSON, PdfContent.fromRawText("text"), List.of(), CategoryLookup.empty());

    assertThatThrownBy(() -> engine.analyze(request)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldBuildDestinationPath_fromCategoryName() {
    assertThat(CategorizationEngine.destinationPath("Human  Resources"))
        .isEqualTo("/category/human-resources");
    assertThat(CategorizationEngine.destinationPath("unknown")).isEqualTo("/category/unknown");
  }
}
