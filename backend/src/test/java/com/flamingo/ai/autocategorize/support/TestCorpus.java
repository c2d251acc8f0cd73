package com.flamingo.ai.autocategorize.support;

import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.model.AnnotationPattern;
import com.flamingo.ai.autocategorize.domain.model.AnnotationRecord;
import com.flamingo.ai.autocategorize.domain.model.AnnotationRule;
import com.flamingo.ai.autocategorize.domain.model.BoundingBox;
import com.flamingo.ai.autocategorize.domain.model.Category;
import com.flamingo.ai.autocategorize.domain.model.CategoryLookup;
import com.flamingo.ai.autocategorize.domain.model.Point;
import com.flamingo.ai.autocategorize.domain.model.TextDetection;
import com.flamingo.ai.autocategorize.service.matching.CorpusScanner;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;

/** Builders for corpus records and a scanner running on the calling thread. */
public final class TestCorpus {

  private TestCorpus() {}

  public static AnnotationRecord record(String categoryId, AnnotationPattern... patterns) {
    return new AnnotationRecord(
        "data-" + categoryId,
        new AnnotationRule("rule-" + categoryId, "Rule " + categoryId, categoryId),
        List.of(patterns),
        null);
  }

  public static CategoryLookup directory(String... idNamePairs) {
    List<Category> categories = new ArrayList<>();
    for (int i = 0; i + 1 < idNamePairs.length; i += 2) {
      categories.add(new Category(idNamePairs[i], idNamePairs[i + 1]));
    }
    return CategoryLookup.of(categories);
  }

  public static CorpusScanner directScanner(CategorizationConfig config, MeterRegistry registry) {
    return new CorpusScanner(Runnable::run, config, registry);
  }

  public static TextDetection detection(String text, BoundingBox box) {
    return new TextDetection(
        text,
        List.of(
            new Point(box.x1(), box.y1()),
            new Point(box.x2(), box.y1()),
            new Point(box.x2(), box.y2()),
            new Point(box.x1(), box.y2())));
  }
}
