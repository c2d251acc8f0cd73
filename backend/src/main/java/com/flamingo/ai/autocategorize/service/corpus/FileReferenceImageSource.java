package com.flamingo.ai.autocategorize.service.corpus;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import com.flamingo.ai.autocategorize.domain.model.ReferenceImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reference images listed in a JSON index of {@code {id, name, path, visualMatches}} entries.
 * Image paths are resolved against the configured base directory; entries without visual matches
 * or whose image is missing are skipped.
 */
@Component
@Slf4j
public class FileReferenceImageSource implements ReferenceImageSource {

  private final JsonFileLoader loader;
  private final ObjectReader matchReader;
  private final CategorizationConfig config;

  public FileReferenceImageSource(ObjectMapper objectMapper, CategorizationConfig config) {
    this.loader = new JsonFileLoader(objectMapper);
    this.matchReader =
        objectMapper
            .readerFor(MatchCandidate.class)
            .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    this.config = config;
  }

  @Override
  public List<ReferenceImage> findReferenceImages() {
    CategorizationConfig.Corpus corpus = config.getCorpus();
    JsonNode root = loader.loadArray(corpus.getReferenceImagesPath(), "reference image index");
    Path baseDir = Path.of(corpus.getReferenceImagesBaseDir());

    List<ReferenceImage> references = new ArrayList<>();
    for (JsonNode entry : root) {
      String name = entry.path("name").asText("");
      List<MatchCandidate> matches = readMatches(entry.path("visualMatches"), name);
      if (matches.isEmpty()) {
        continue;
      }
      Path imagePath = baseDir.resolve(entry.path("path").asText(""));
      if (!Files.isRegularFile(imagePath)) {
        log.info("Skipping reference image {}: {} not accessible", name, imagePath);
        continue;
      }
      try {
        references.add(
            new ReferenceImage(
                entry.path("id").asText(name), name, Files.readAllBytes(imagePath), matches));
      } catch (IOException e) {
        log.warn("Skipping reference image {}: {}", name, e.getMessage());
      }
    }
    log.debug("Loaded {} reference images", references.size());
    return references;
  }

  private List<MatchCandidate> readMatches(JsonNode node, String name) {
    List<MatchCandidate> matches = new ArrayList<>();
    for (JsonNode match : node) {
      try {
        matches.add(matchReader.readValue(match));
      } catch (IOException e) {
        log.warn("Ignoring unreadable visual match of {}: {}", name, e.getMessage());
      }
    }
    return matches;
  }
}
