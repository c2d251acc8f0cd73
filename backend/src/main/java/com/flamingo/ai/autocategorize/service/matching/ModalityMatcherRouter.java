package com.flamingo.ai.autocategorize.service.matching;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.exception.UnsupportedFileTypeException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Routes a file type to the matcher registered for it. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModalityMatcherRouter {

  private final List<ModalityMatcher> matchers;

  /**
   * Selects the matcher for the given file type.
   *
   * @throws UnsupportedFileTypeException if no matcher supports the type
   */
  public ModalityMatcher route(FileType fileType) {
    if (fileType == null) {
      throw new UnsupportedFileTypeException("unknown");
    }
    for (ModalityMatcher matcher : matchers) {
      if (matcher.supports(fileType)) {
        log.debug("Routing {} to {}", fileType, matcher.getClass().getSimpleName());
        return matcher;
      }
    }
    throw new UnsupportedFileTypeException(fileType.name());
  }
}
