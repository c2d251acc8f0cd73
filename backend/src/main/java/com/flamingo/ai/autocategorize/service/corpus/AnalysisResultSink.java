package com.flamingo.ai.autocategorize.service.corpus;

import com.flamingo.ai.autocategorize.domain.model.AnalysisResult;

/** Receives every finished analysis, e.g. to store it with the file. */
public interface AnalysisResultSink {

  void accept(String fileName, AnalysisResult result);
}
