package com.flamingo.ai.autocategorize.api.dto.response;

import com.flamingo.ai.autocategorize.domain.model.AnalysisResult;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a categorization request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {

  private String fileName;
  private String fileType;
  private String category;
  private double confidence;
  private boolean categorized;
  private String destPath;
  private List<MatchCandidate> matches;
  private Map<String, Object> diagnostics;

  /** Creates an AnalysisResponse from an engine result. */
  public static AnalysisResponse fromResult(AnalysisResult result) {
    Map<String, Object> diagnostics = result.diagnostics();
    return AnalysisResponse.builder()
        .fileName(stringOrNull(diagnostics.get("fileName")))
        .fileType(stringOrNull(diagnostics.get("fileType")))
        .category(result.category())
        .confidence(result.confidence())
        .categorized(result.isCategorized())
        .destPath(stringOrNull(diagnostics.get("destPath")))
        .matches(result.matches())
        .diagnostics(diagnostics)
        .build();
  }

  private static String stringOrNull(Object value) {
    return value == null ? null : value.toString();
  }
}
