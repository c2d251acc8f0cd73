package com.flamingo.ai.autocategorize.service.corpus;

import com.flamingo.ai.autocategorize.domain.model.AnnotationRecord;
import java.util.List;

/** Source of the annotation corpus. */
public interface AnnotationCorpusReader {

  /** All annotation records, in stored order. Malformed patterns are already dropped. */
  List<AnnotationRecord> readAll();
}
