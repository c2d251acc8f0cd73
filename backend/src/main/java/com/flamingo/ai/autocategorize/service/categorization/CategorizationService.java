package com.flamingo.ai.autocategorize.service.categorization;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.model.AnalysisRequest;
import com.flamingo.ai.autocategorize.domain.model.AnalysisResult;
import com.flamingo.ai.autocategorize.domain.model.AnnotationRecord;
import com.flamingo.ai.autocategorize.domain.model.CategoryLookup;
import com.flamingo.ai.autocategorize.domain.model.ReferenceImage;
import com.flamingo.ai.autocategorize.service.corpus.AnalysisResultSink;
import com.flamingo.ai.autocategorize.service.corpus.AnnotationCorpusReader;
import com.flamingo.ai.autocategorize.service.corpus.CategoryDirectory;
import com.flamingo.ai.autocategorize.service.corpus.ReferenceImageSource;
import com.flamingo.ai.autocategorize.service.extraction.ContentExtractionService;
import com.flamingo.ai.autocategorize.service.extraction.ExtractedContent;
import com.flamingo.ai.autocategorize.service.extraction.FileTypeDetector;
import com.flamingo.ai.autocategorize.service.extraction.SourceFile;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Categorizes a candidate file end to end: type detection, content extraction, corpus loading,
 * engine analysis and hand-off to the result sink.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategorizationService {

  private final FileTypeDetector fileTypeDetector;
  private final ContentExtractionService extractionService;
  private final AnnotationCorpusReader corpusReader;
  private final CategoryDirectory categoryDirectory;
  private final ReferenceImageSource referenceImageSource;
  private final CategorizationEngine engine;
  private final AnalysisResultSink resultSink;

  /**
   * Categorizes a file on disk.
   *
   * @throws com.flamingo.ai.autocategorize.exception.ContentUnavailableException if the path is
   *     missing or unreadable
   */
  public AnalysisResult categorize(Path path) {
    return categorize(SourceFile.read(path), null);
  }

  /**
   * Categorizes an in-memory file.
   *
   * @param file candidate file
   * @param declaredType file type supplied by the caller; detected from the content when null
   * @return the result that was also handed to the sink
   */
  public AnalysisResult categorize(SourceFile file, FileType declaredType) {
    FileType fileType = declaredType != null ? declaredType : fileTypeDetector.detect(file);
    log.info("Categorizing {} ({} bytes) as {}", file.name(), file.bytes().length, fileType);

    ExtractedContent extracted = extractionService.extract(file, fileType);
    List<AnnotationRecord> corpus = corpusReader.readAll();
    CategoryLookup directory = categoryDirectory.snapshot();
    List<ReferenceImage> references =
        fileType == FileType.IMAGE ? referenceImageSource.findReferenceImages() : List.of();

    AnalysisResult result =
        engine.analyze(
            new AnalysisRequest(fileType, extracted.content(), corpus, directory, references));

    Map<String, Object> extra = new LinkedHashMap<>();
    extra.put("fileName", file.name());
    if (extracted.isDegraded()) {
      extra.put("degradedProviders", extracted.degradedProviders());
    }
    result = result.withDiagnostics(extra);

    resultSink.accept(file.name(), result);
    return result;
  }
}
