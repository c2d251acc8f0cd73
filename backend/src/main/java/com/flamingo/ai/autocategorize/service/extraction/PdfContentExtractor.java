package com.flamingo.ai.autocategorize.service.extraction;

import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.model.PdfContent;
import com.flamingo.ai.autocategorize.exception.ContentUnavailableException;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** Extracts page-separated text from PDFs with Apache PDFBox. */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfContentExtractor implements ContentExtractor {

  static final String PAGE_END = "\f";

  private final CategorizationConfig config;

  @Override
  public boolean supports(FileType fileType) {
    return fileType == FileType.PDF;
  }

  @Override
  public ExtractedContent extract(SourceFile file) {
    try (PDDocument document = Loader.loadPDF(file.bytes())) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setPageEnd(PAGE_END);
      String raw = stripper.getText(document);

      PdfContent content = PdfContent.fromRawText(raw);
      log.debug(
          "Extracted {} chars over {} pages from {}",
          content.extractedText().length(),
          document.getNumberOfPages(),
          file.name());
      if (content.extractedText().length() < config.getPdf().getLowTextWarningChars()) {
        log.warn(
            "PDF {} yielded only {} characters, it may be image-only",
            file.name(),
            content.extractedText().length());
      }
      return ExtractedContent.of(content);
    } catch (IOException e) {
      log.error("PDFBox parsing failed for {}: {}", file.name(), e.getMessage());
      throw new ContentUnavailableException(file.name(), "Failed to parse PDF", e);
    }
  }
}
