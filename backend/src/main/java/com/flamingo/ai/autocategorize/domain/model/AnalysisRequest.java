package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import java.util.List;

/**
 * In-process engine contract input.
 *
 * @param fileType detected modality; selects the single matcher that runs
 * @param content extracted candidate content
 * @param corpus all annotation records; matchers filter by pattern kind
 * @param directory request-scoped category lookup
 * @param referenceImages previously categorised images, only consulted for images
 */
public record AnalysisRequest(
    FileType fileType,
    CandidateContent content,
    List<AnnotationRecord> corpus,
    CategoryLookup directory,
    List<ReferenceImage> referenceImages) {

  public AnalysisRequest {
    corpus = corpus == null ? List.of() : List.copyOf(corpus);
    directory = directory == null ? CategoryLookup.empty() : directory;
    referenceImages = referenceImages == null ? List.of() : List.copyOf(referenceImages);
  }

  public AnalysisRequest(
      FileType fileType,
      CandidateContent content,
      List<AnnotationRecord> corpus,
      CategoryLookup directory) {
    this(fileType, content, corpus, directory, List.of());
  }
}
