package com.flamingo.ai.autocategorize.service.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.model.Category;
import com.flamingo.ai.autocategorize.domain.model.CategoryLookup;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Category directory backed by a JSON array of {@code {id, name}} objects. */
@Component
@Slf4j
public class FileCategoryDirectory implements CategoryDirectory {

  private final JsonFileLoader loader;
  private final CategorizationConfig config;

  public FileCategoryDirectory(ObjectMapper objectMapper, CategorizationConfig config) {
    this.loader = new JsonFileLoader(objectMapper);
    this.config = config;
  }

  @Override
  public CategoryLookup snapshot() {
    JsonNode root = loader.loadArray(config.getCorpus().getCategoriesPath(), "category directory");
    List<Category> categories = new ArrayList<>();
    for (JsonNode node : root) {
      String name = node.path("name").asText(null);
      // Older exports only carry _id
      String id = node.hasNonNull("id") ? node.path("id").asText() : node.path("_id").asText(null);
      if (id == null || name == null) {
        log.warn("Skipping category without id or name: {}", node);
        continue;
      }
      categories.add(new Category(id, name));
    }
    return CategoryLookup.of(categories);
  }
}
