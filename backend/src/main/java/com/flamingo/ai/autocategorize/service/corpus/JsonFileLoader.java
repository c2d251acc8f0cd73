package com.flamingo.ai.autocategorize.service.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** Loads JSON array files backing the file-based collaborators. */
@Slf4j
class JsonFileLoader {

  private final ObjectMapper objectMapper;

  JsonFileLoader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Reads a JSON array.
   *
   * @return the array, or an empty array when the file does not exist
   * @throws UncheckedIOException if the file exists but cannot be read
   * @throws IllegalStateException if the file does not hold a JSON array
   */
  JsonNode loadArray(String location, String description) {
    Path path = Path.of(location);
    if (!Files.exists(path)) {
      log.warn("No {} at {}, continuing with none", description, path.toAbsolutePath());
      return objectMapper.createArrayNode();
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(path.toFile());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + description + " from " + path, e);
    }
    if (root == null || root.isMissingNode()) {
      return objectMapper.createArrayNode();
    }
    if (!root.isArray()) {
      throw new IllegalStateException(description + " at " + path + " is not a JSON array");
    }
    return root;
  }
}
