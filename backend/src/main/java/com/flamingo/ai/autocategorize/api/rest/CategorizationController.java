package com.flamingo.ai.autocategorize.api.rest;

import com.flamingo.ai.autocategorize.api.dto.response.AnalysisResponse;
import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.model.AnalysisResult;
import com.flamingo.ai.autocategorize.exception.ContentUnavailableException;
import com.flamingo.ai.autocategorize.service.categorization.CategorizationService;
import com.flamingo.ai.autocategorize.service.extraction.SourceFile;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for file categorization. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CategorizationController {

  private final CategorizationService categorizationService;

  /**
   * Categorizes an uploaded file.
   *
   * @param file the candidate file
   * @param fileType optional {@code image}, {@code pdf}, {@code json} or {@code audio}; detected
   *     from the content when absent
   */
  @PostMapping(value = "/categorize", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<AnalysisResponse> categorize(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "fileType", required = false) String fileType) {
    SourceFile source;
    try {
      source = new SourceFile(file.getOriginalFilename(), file.getBytes());
    } catch (IOException e) {
      throw new ContentUnavailableException(
          file.getOriginalFilename(), "Upload could not be read", e);
    }
    AnalysisResult result =
        categorizationService.categorize(source, FileType.fromParameter(fileType));
    return ResponseEntity.ok(AnalysisResponse.fromResult(result));
  }
}
