package com.flamingo.ai.autocategorize.domain.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request-scoped snapshot of the category directory. Built once per analysis and passed explicitly
 * to whoever needs a category name.
 */
public final class CategoryLookup {

  public static final String UNKNOWN = "unknown";

  private final Map<String, String> namesById;

  private CategoryLookup(Map<String, String> namesById) {
    this.namesById = Map.copyOf(namesById);
  }

  public static CategoryLookup of(Collection<Category> categories) {
    Map<String, String> names = new LinkedHashMap<>();
    for (Category category : categories) {
      if (category.id() != null && category.name() != null) {
        names.putIfAbsent(category.id(), category.name());
      }
    }
    return new CategoryLookup(names);
  }

  public static CategoryLookup empty() {
    return new CategoryLookup(Map.of());
  }

  /**
   * Resolves a category id to its display name.
   *
   * @param categoryId id from an annotation rule, may be null
   * @return the directory name, or {@link #UNKNOWN} when the id is missing or not in the directory
   */
  public String resolve(String categoryId) {
    if (categoryId == null || categoryId.isBlank()) {
      return UNKNOWN;
    }
    return namesById.getOrDefault(categoryId, UNKNOWN);
  }

  public int size() {
    return namesById.size();
  }
}
