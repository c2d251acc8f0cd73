package com.flamingo.ai.autocategorize.service.corpus;

import com.flamingo.ai.autocategorize.domain.model.AnalysisResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Default sink: records the outcome in the application log. */
@Component
@Slf4j
public class LoggingAnalysisResultSink implements AnalysisResultSink {

  @Override
  public void accept(String fileName, AnalysisResult result) {
    log.info(
        "Analysis of {}: category={}, confidence={}, matches={}, destPath={}",
        fileName,
        result.category(),
        result.confidence(),
        result.matches().size(),
        result.diagnostics().get("destPath"));
    if (log.isDebugEnabled()) {
      result.matches().forEach(match -> log.debug("  {}", match));
    }
  }
}
