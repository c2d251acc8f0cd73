package com.flamingo.ai.autocategorize.service.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.model.AnnotationPattern;
import com.flamingo.ai.autocategorize.domain.model.AnnotationRecord;
import com.flamingo.ai.autocategorize.domain.model.AnnotationRule;
import com.flamingo.ai.autocategorize.exception.MalformedPatternException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the annotation corpus from a JSON array file. The file is re-read on every call so edits
 * are picked up without a restart.
 */
@Component
@Slf4j
public class FileAnnotationCorpusReader implements AnnotationCorpusReader {

  private final JsonFileLoader loader;
  private final AnnotationPatternParser parser;
  private final CategorizationConfig config;
  private final MeterRegistry meterRegistry;

  public FileAnnotationCorpusReader(
      ObjectMapper objectMapper,
      AnnotationPatternParser parser,
      CategorizationConfig config,
      MeterRegistry meterRegistry) {
    this.loader = new JsonFileLoader(objectMapper);
    this.parser = parser;
    this.config = config;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public List<AnnotationRecord> readAll() {
    JsonNode root = loader.loadArray(config.getCorpus().getAnnotationsPath(), "annotation corpus");
    List<AnnotationRecord> records = new ArrayList<>();
    for (JsonNode node : root) {
      records.add(toRecord(node));
    }
    log.debug("Loaded {} annotation records", records.size());
    return records;
  }

  private AnnotationRecord toRecord(JsonNode node) {
    JsonNode ruleNode = node.path("rule");
    AnnotationRule rule =
        ruleNode.isObject()
            ? new AnnotationRule(
                textOrNull(ruleNode, "id"),
                textOrNull(ruleNode, "ruleName"),
                textOrNull(ruleNode, "categoryId"))
            : null;

    List<AnnotationPattern> patterns = new ArrayList<>();
    for (JsonNode annotation : node.path("annotations")) {
      try {
        patterns.add(parser.parse(annotation));
      } catch (MalformedPatternException e) {
        log.warn(
            "Skipping malformed pattern {} in record {}: {}",
            e.getPatternId(),
            textOrNull(node, "dataId"),
            e.getMessage());
        meterRegistry.counter("categorization.patterns.skipped", "reason", "malformed").increment();
      }
    }
    return new AnnotationRecord(
        textOrNull(node, "dataId"), rule, patterns, textOrNull(node, "type"));
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isValueNode() && !value.isNull() ? value.asText() : null;
  }
}
