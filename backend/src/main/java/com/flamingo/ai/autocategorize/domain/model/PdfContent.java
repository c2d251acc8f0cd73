package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Extracted content of a PDF.
 *
 * @param extractedText whitespace-normalised text of the whole document
 * @param pages raw text of each page, in order
 */
public record PdfContent(String extractedText, List<String> pages) implements CandidateContent {

  private static final Pattern PAGE_BREAK = Pattern.compile("\f|\n\\s*\n\\s*\n");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public PdfContent {
    extractedText = extractedText == null ? "" : extractedText;
    pages = pages == null ? List.of() : List.copyOf(pages);
  }

  /**
   * Builds PDF content from the raw text of a parser. Pages are split on form feeds or runs of
   * three line breaks; when that yields nothing the whole document is a single page.
   */
  public static PdfContent fromRawText(String rawText) {
    String raw = rawText == null ? "" : rawText;
    List<String> pages =
        Arrays.stream(PAGE_BREAK.split(raw)).filter(page -> !page.isBlank()).toList();
    if (pages.isEmpty()) {
      pages = List.of(raw);
    }
    String normalised = WHITESPACE.matcher(raw).replaceAll(" ").trim();
    return new PdfContent(normalised, pages);
  }

  public static PdfContent empty() {
    return new PdfContent("", List.of());
  }

  @Override
  public FileType fileType() {
    return FileType.PDF;
  }

  @Override
  public boolean isEmpty() {
    return extractedText.isBlank();
  }
}
