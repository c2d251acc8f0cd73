package com.flamingo.ai.autocategorize.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A leaf of a flattened JSON document.
 *
 * @param path dot/bracket path such as {@code customer.addresses[0].city}
 * @param value the scalar (or empty container) found at that path
 */
public record FlattenedEntry(String path, JsonNode value) {

  /** String form used for comparisons: raw text for strings, JSON text for everything else. */
  public String valueText() {
    if (value == null) {
      return "null";
    }
    return value.isTextual() ? value.asText() : value.toString();
  }
}
