package com.flamingo.ai.autocategorize.service.matching;

import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.enums.EvidenceKind;
import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.enums.MatchType;
import com.flamingo.ai.autocategorize.domain.model.AnalysisRequest;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import com.flamingo.ai.autocategorize.domain.model.PdfContent;
import com.flamingo.ai.autocategorize.domain.model.PdfPattern;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Matches stored PDF keywords against the extracted document text. */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfKeywordMatcher implements ModalityMatcher {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final CorpusScanner scanner;
  private final CategorizationConfig config;

  @Override
  public boolean supports(FileType fileType) {
    return fileType == FileType.PDF;
  }

  @Override
  public MatchOutcome match(AnalysisRequest request) {
    PdfContent content = (PdfContent) request.content();
    Map<String, Object> diagnostics = new LinkedHashMap<>();
    diagnostics.put("extractedTextLength", content.extractedText().length());
    diagnostics.put("pageCount", content.pages().size());

    if (content.isEmpty()) {
      log.info("PDF has no extractable text, skipping keyword matching");
      return MatchOutcome.empty(diagnostics);
    }

    String text = content.extractedText();
    List<String> lowerPages =
        content.pages().stream().map(PdfKeywordMatcher::searchablePage).toList();
    double threshold = config.getPdf().getAcceptanceThreshold();

    List<MatchCandidate> candidates =
        scanner.scan(
            request.corpus(),
            PdfPattern.class,
            request.directory(),
            (pattern, category) -> score(pattern, category, text, lowerPages, threshold));
    return new MatchOutcome(candidates, diagnostics);
  }

  private Optional<MatchCandidate> score(
      PdfPattern pattern,
      String category,
      String text,
      List<String> lowerPages,
      double threshold) {
    String keyword = pattern.keywordText();
    double confidence = TextSimilarity.keywordConfidence(text, keyword);
    if (confidence <= threshold) {
      log.debug("No match for keyword '{}' ({})", keyword, confidence);
      return Optional.empty();
    }
    MatchType matchType = TextSimilarity.classify(text, keyword, confidence);
    log.debug("Keyword '{}' matched as {} ({})", keyword, matchType, confidence);

    return Optional.of(
        MatchCandidate.builder()
            .patternRef(pattern.id())
            .category(category)
            .confidence(confidence)
            .evidenceKind(EvidenceKind.PDF_KEYWORD)
            .matchType(matchType)
            .text(keyword)
            .pageNumber(findPage(lowerPages, keyword))
            .build());
  }

  // Line breaks inside a page must not split a keyword that the whole-document text matches
  static String searchablePage(String page) {
    return WHITESPACE.matcher(page).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
  }

  /** 1-based number of the first page containing the keyword, or null. */
  static Integer findPage(List<String> lowerPages, String keyword) {
    String needle = keyword.toLowerCase(Locale.ROOT);
    for (int i = 0; i < lowerPages.size(); i++) {
      if (lowerPages.get(i).contains(needle)) {
        return i + 1;
      }
    }
    return null;
  }
}
