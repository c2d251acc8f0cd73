package com.flamingo.ai.autocategorize.service.corpus;

import com.flamingo.ai.autocategorize.domain.model.CategoryLookup;

/** Source of category names. */
public interface CategoryDirectory {

  /** Immutable id to name snapshot for one request. */
  CategoryLookup snapshot();
}
