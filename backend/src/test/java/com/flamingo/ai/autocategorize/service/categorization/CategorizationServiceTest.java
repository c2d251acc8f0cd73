package com.flamingo.ai.autocategorize.service.categorization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.model.AnalysisRequest;
import com.flamingo.ai.autocategorize.domain.model.AnalysisResult;
import com.flamingo.ai.autocategorize.domain.model.AnnotationRecord;
import com.flamingo.ai.autocategorize.domain.model.AudioContent;
import com.flamingo.ai.autocategorize.domain.model.CategoryLookup;
import com.flamingo.ai.autocategorize.domain.model.ImageContent;
import com.flamingo.ai.autocategorize.domain.model.PdfContent;
import com.flamingo.ai.autocategorize.domain.model.ReferenceImage;
import com.flamingo.ai.autocategorize.exception.ContentUnavailableException;
import com.flamingo.ai.autocategorize.service.corpus.AnalysisResultSink;
import com.flamingo.ai.autocategorize.service.corpus.AnnotationCorpusReader;
import com.flamingo.ai.autocategorize.service.corpus.CategoryDirectory;
import com.flamingo.ai.autocategorize.service.corpus.ReferenceImageSource;
import com.flamingo.ai.autocategorize.service.extraction.ContentExtractionService;
import com.flamingo.ai.autocategorize.service.extraction.ExtractedContent;
import com.flamingo.ai.autocategorize.service.extraction.FileTypeDetector;
import com.flamingo.ai.autocategorize.service.extraction.SourceFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CategorizationServiceTest {

  @Mock private FileTypeDetector fileTypeDetector;
  @Mock private ContentExtractionService extractionService;
  @Mock private AnnotationCorpusReader corpusReader;
  @Mock private CategoryDirectory categoryDirectory;
  @Mock private ReferenceImageSource referenceImageSource;
  @Mock private CategorizationEngine engine;
  @Mock private AnalysisResultSink resultSink;

  private CategorizationService service;
  private List<AnnotationRecord> corpus;
  private CategoryLookup directory;

  @BeforeEach
  void setUp() {
    service =
        new CategorizationService(
            fileTypeDetector,
            extractionService,
            corpusReader,
            categoryDirectory,
            referenceImageSource,
            engine,
            resultSink);
    corpus = List.of(new AnnotationRecord("d1", null, List.of(), "pdf"));
    directory = CategoryLookup.empty();
    when(corpusReader.readAll()).thenReturn(corpus);
    when(categoryDirectory.snapshot()).thenReturn(directory);
    when(engine.analyze(any()))
        .thenReturn(new AnalysisResult("Finance", 0.9, List.of(), Map.of("fileType", "pdf")));
  }

  @Test
  @DisplayName("Declared type skips detection and images-only references")
  void shouldUseDeclaredType_andPassCorpusToEngine() {
    SourceFile file = new SourceFile("invoice.pdf", new byte[] {1, 2, 3});
    when(extractionService.extract(file, FileType.PDF))
        .thenReturn(ExtractedContent.of(PdfContent.fromRawText("Invoice")));

    AnalysisResult result = service.categorize(file, FileType.PDF);

    verify(fileTypeDetector, never()).detect(any());
    verify(referenceImageSource, never()).findReferenceImages();
    ArgumentCaptor<AnalysisRequest> captor = ArgumentCaptor.forClass(AnalysisRequest.class);
    verify(engine).analyze(captor.capture());
    assertThat(captor.getValue().fileType()).isEqualTo(FileType.PDF);
    assertThat(captor.getValue().corpus()).isEqualTo(corpus);
    assertThat(captor.getValue().directory()).isSameAs(directory);
    assertThat(captor.getValue().referenceImages()).isEmpty();

    assertThat(result.category()).isEqualTo("Finance");
    assertThat(result.diagnostics())
        .containsEntry("fileName", "invoice.pdf")
        .doesNotContainKey("degradedProviders");
    verify(resultSink).accept("invoice.pdf", result);
  }

  @Test
  void shouldDetectType_andLoadReferences_forImages() {
    SourceFile file = new SourceFile("photo.png", new byte[] {9});
    List<ReferenceImage> references =
        List.of(new ReferenceImage("r1", "ref.png", new byte[] {1}, List.of()));
    when(fileTypeDetector.detect(file)).thenReturn(FileType.IMAGE);
    when(referenceImageSource.findReferenceImages()).thenReturn(references);
    when(extractionService.extract(file, FileType.IMAGE))
        .thenReturn(ExtractedContent.of(ImageContent.pixelsOnly(new byte[] {9}, 1, 1)));

    service.categorize(file, null);

    ArgumentCaptor<AnalysisRequest> captor = ArgumentCaptor.forClass(AnalysisRequest.class);
    verify(engine).analyze(captor.capture());
    assertThat(captor.getValue().fileType()).isEqualTo(FileType.IMAGE);
    assertThat(captor.getValue().referenceImages()).isEqualTo(references);
  }

  @Test
  @DisplayName("Failed speech provider is reported, the result stays uncategorized")
  void shouldReportDegradedProviders() {
    SourceFile file = new SourceFile("memo.wav", new byte[] {1});
    when(extractionService.extract(file, FileType.AUDIO))
        .thenReturn(new ExtractedContent(new AudioContent(List.of()), List.of("speech")));
    when(engine.analyze(any()))
        .thenReturn(AnalysisResult.uncategorized(Map.of("fileType", "audio")));

    AnalysisResult result = service.categorize(file, FileType.AUDIO);

    assertThat(result.isCategorized()).isFalse();
    assertThat(result.confidence()).isZero();
    assertThat(result.diagnostics())
        .containsEntry("degradedProviders", List.of("speech"))
        .containsEntry("fileType", "audio");
  }

  @Test
  void shouldThrowContentUnavailable_whenPathIsMissing(@TempDir Path dir) {
    Path missing = dir.resolve("nope.pdf");

    assertThatThrownBy(() -> service.categorize(missing))
        .isInstanceOf(ContentUnavailableException.class);
    verify(extractionService, never()).extract(any(), any());
    verify(resultSink, never()).accept(anyString(), any());
  }

  @Test
  void shouldReadFileFromDisk_andDetectType(@TempDir Path dir) throws Exception {
    Path pdf = dir.resolve("contract.pdf");
    Files.write(pdf, new byte[] {4, 5, 6});
    when(fileTypeDetector.detect(any())).thenReturn(FileType.PDF);
    when(extractionService.extract(any(), eq(FileType.PDF)))
        .thenReturn(ExtractedContent.of(PdfContent.fromRawText("Contract")));

    AnalysisResult result = service.categorize(pdf);

    assertThat(result.diagnostics()).containsEntry("fileName", "contract.pdf");
  }
}
