package com.flamingo.ai.autocategorize.service.extraction;

import com.flamingo.ai.autocategorize.domain.model.CandidateContent;
import java.util.List;

/**
 * Content of a candidate file plus the providers that failed while producing it.
 *
 * @param content extracted content; possibly empty when a provider failed
 * @param degradedProviders names of providers whose failure was absorbed, e.g. {@code vision}
 */
public record ExtractedContent(CandidateContent content, List<String> degradedProviders) {

  public ExtractedContent {
    degradedProviders = degradedProviders == null ? List.of() : List.copyOf(degradedProviders);
  }

  public static ExtractedContent of(CandidateContent content) {
    return new ExtractedContent(content, List.of());
  }

  public boolean isDegraded() {
    return !degradedProviders.isEmpty();
  }
}
