package com.flamingo.ai.autocategorize.service.extraction;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.exception.ContentUnavailableException;
import com.flamingo.ai.autocategorize.exception.UnsupportedFileTypeException;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Routes extraction to the {@link ContentExtractor} registered for the file type. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DefaultContentExtractionService implements ContentExtractionService {

  private final List<ContentExtractor> extractors;

  @Override
  @Timed(value = "extraction.extract", description = "Time to extract candidate content")
  public ExtractedContent extract(SourceFile file, FileType fileType) {
    if (file.isEmpty()) {
      throw new ContentUnavailableException(file.name(), "File is empty");
    }
    ContentExtractor extractor =
        extractors.stream()
            .filter(e -> e.supports(fileType))
            .findFirst()
            .orElseThrow(() -> new UnsupportedFileTypeException(String.valueOf(fileType)));

    ExtractedContent extracted = extractor.extract(file);
    if (extracted.isDegraded()) {
      log.warn(
          "Extraction of {} degraded, providers failed: {}",
          file.name(),
          extracted.degradedProviders());
    }
    return extracted;
  }
}
