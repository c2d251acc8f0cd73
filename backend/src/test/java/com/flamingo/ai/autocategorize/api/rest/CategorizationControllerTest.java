package com.flamingo.ai.autocategorize.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.autocategorize.domain.enums.EvidenceKind;
import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.enums.MatchType;
import com.flamingo.ai.autocategorize.domain.model.AnalysisResult;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import com.flamingo.ai.autocategorize.exception.ContentUnavailableException;
import com.flamingo.ai.autocategorize.exception.ExternalServiceException;
import com.flamingo.ai.autocategorize.exception.GlobalExceptionHandler;
import com.flamingo.ai.autocategorize.exception.UnsupportedFileTypeException;
import com.flamingo.ai.autocategorize.service.categorization.CategorizationService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CategorizationController Tests")
class CategorizationControllerTest {

  private MockMvc mockMvc;
  private SimpleMeterRegistry meterRegistry;

  @Mock private CategorizationService categorizationService;

  private final MockMultipartFile pdf =
      new MockMultipartFile("file", "invoice.pdf", "application/pdf", new byte[] {1, 2, 3});

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new CategorizationController(categorizationService))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("Should return the categorization result")
  void shouldReturnResult_whenFileIsCategorized() throws Exception {
    MatchCandidate match =
        MatchCandidate.builder()
            .patternRef("p1")
            .category("Finance")
            .confidence(0.9)
            .evidenceKind(EvidenceKind.PDF_KEYWORD)
            .matchType(MatchType.EXACT)
            .text("Invoice Number")
            .pageNumber(1)
            .build();
    Map<String, Object> diagnostics = new LinkedHashMap<>();
    diagnostics.put("fileType", "pdf");
    diagnostics.put("destPath", "/category/finance");
    diagnostics.put("fileName", "invoice.pdf");
    when(categorizationService.categorize(any(), isNull()))
        .thenReturn(new AnalysisResult("Finance", 0.9, List.of(match), diagnostics));

    mockMvc
        .perform(multipart("/api/categorize").file(pdf))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.fileName").value("invoice.pdf"))
        .andExpect(jsonPath("$.category").value("Finance"))
        .andExpect(jsonPath("$.confidence").value(0.9))
        .andExpect(jsonPath("$.categorized").value(true))
        .andExpect(jsonPath("$.destPath").value("/category/finance"))
        .andExpect(jsonPath("$.matches[0].patternRef").value("p1"))
        .andExpect(jsonPath("$.matches[0].pageNumber").value(1))
        .andExpect(jsonPath("$.matches[0].snippet").doesNotExist());
  }

  @Test
  void shouldPassDeclaredFileType() throws Exception {
    when(categorizationService.categorize(any(), eq(FileType.JSON)))
        .thenReturn(AnalysisResult.uncategorized(Map.of("fileType", "json")));

    mockMvc
        .perform(multipart("/api/categorize").file(pdf).param("fileType", "json"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.category").value("uncategorized"))
        .andExpect(jsonPath("$.categorized").value(false));

    verify(categorizationService).categorize(any(), eq(FileType.JSON));
  }

  @Test
  void shouldReturn400_whenFileTypeIsUnknown() throws Exception {
    mockMvc
        .perform(multipart("/api/categorize").file(pdf).param("fileType", "video"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(categorizationService, never()).categorize(any(), any());
  }

  @Test
  void shouldReturn400_whenFilePartIsMissing() throws Exception {
    mockMvc
        .perform(multipart("/api/categorize").param("fileType", "pdf"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void shouldReturn422_whenContentIsUnavailable() throws Exception {
    when(categorizationService.categorize(any(), any()))
        .thenThrow(new ContentUnavailableException("invoice.pdf", "Failed to parse PDF"));

    mockMvc
        .perform(multipart("/api/categorize").file(pdf))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("CONTENT_001"))
        .andExpect(jsonPath("$.path").value("/api/categorize"))
        .andExpect(jsonPath("$.errorId").isNotEmpty());
  }

  @Test
  void shouldReturn415_whenFileTypeIsUnsupported() throws Exception {
    when(categorizationService.categorize(any(), any()))
        .thenThrow(new UnsupportedFileTypeException("text/plain"));

    mockMvc
        .perform(multipart("/api/categorize").file(pdf))
        .andExpect(status().isUnsupportedMediaType())
        .andExpect(jsonPath("$.code").value("CONTENT_002"));
  }

  @Test
  void shouldReturn503_andCountError_whenProviderFails() throws Exception {
    when(categorizationService.categorize(any(), any()))
        .thenThrow(new ExternalServiceException("vision", "down", true));

    mockMvc
        .perform(multipart("/api/categorize").file(pdf))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("PROVIDER_001"));

    double rateLimited =
        meterRegistry.counter("api_errors_total", "error_type", "provider_rate_limited").count();
    assertThat(rateLimited).isEqualTo(1.0);
  }

  @Test
  void shouldReturn500_whenSomethingUnexpectedHappens() throws Exception {
    when(categorizationService.categorize(any(), any()))
        .thenThrow(new IllegalStateException("boom"));

    mockMvc
        .perform(multipart("/api/categorize").file(pdf))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_001"));
  }
}
