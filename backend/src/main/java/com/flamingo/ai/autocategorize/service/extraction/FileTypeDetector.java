package com.flamingo.ai.autocategorize.service.extraction;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.exception.UnsupportedFileTypeException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;

/** Detects the modality of a candidate file from its magic bytes and name. */
@Component
@Slf4j
public class FileTypeDetector {

  private static final Tika TIKA = new Tika();

  /**
   * Detects the file type.
   *
   * @throws UnsupportedFileTypeException if the file is not an image, PDF, JSON or audio file
   */
  public FileType detect(SourceFile file) {
    String mimeType = TIKA.detect(file.bytes(), file.name());
    log.debug("Detected {} as {}", file.name(), mimeType);

    if (mimeType.startsWith("image/")) {
      return FileType.IMAGE;
    }
    if ("application/pdf".equals(mimeType)) {
      return FileType.PDF;
    }
    if ("application/json".equals(mimeType) || "json".equals(file.extension())) {
      return FileType.JSON;
    }
    if (mimeType.startsWith("audio/") || "application/ogg".equals(mimeType)) {
      return FileType.AUDIO;
    }
    throw new UnsupportedFileTypeException(mimeType);
  }
}
