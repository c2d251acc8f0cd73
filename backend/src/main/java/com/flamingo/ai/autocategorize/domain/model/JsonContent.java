package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import java.util.List;

/** Flattened key/value pairs of a JSON document, in document order. */
public record JsonContent(List<FlattenedEntry> entries) implements CandidateContent {

  public JsonContent {
    entries = entries == null ? List.of() : List.copyOf(entries);
  }

  @Override
  public FileType fileType() {
    return FileType.JSON;
  }

  @Override
  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
