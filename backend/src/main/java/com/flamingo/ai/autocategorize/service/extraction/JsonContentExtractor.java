package com.flamingo.ai.autocategorize.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.model.JsonContent;
import com.flamingo.ai.autocategorize.exception.ContentUnavailableException;
import com.flamingo.ai.autocategorize.service.matching.JsonFlattener;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Parses JSON documents and flattens them to path/value entries. */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonContentExtractor implements ContentExtractor {

  private final ObjectMapper objectMapper;
  private final JsonFlattener flattener;

  @Override
  public boolean supports(FileType fileType) {
    return fileType == FileType.JSON;
  }

  @Override
  public ExtractedContent extract(SourceFile file) {
    JsonNode root;
    try {
      root = objectMapper.readTree(file.bytes());
    } catch (JsonProcessingException e) {
      throw new ContentUnavailableException(
          file.name(), "Invalid JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new ContentUnavailableException(file.name(), "Unreadable JSON", e);
    }
    if (root == null || root.isMissingNode()) {
      throw new ContentUnavailableException(file.name(), "JSON document is empty");
    }
    JsonContent content = new JsonContent(flattener.flatten(root));
    log.debug("Flattened {} into {} entries", file.name(), content.entries().size());
    return ExtractedContent.of(content);
  }
}
