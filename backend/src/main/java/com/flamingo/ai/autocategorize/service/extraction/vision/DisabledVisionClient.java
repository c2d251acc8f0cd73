package com.flamingo.ai.autocategorize.service.extraction.vision;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when no vision provider is configured; images are matched on pixels only. */
@Component
@ConditionalOnProperty(
    name = "categorization.vision.enabled",
    havingValue = "false",
    matchIfMissing = true)
@Slf4j
public class DisabledVisionClient implements VisionClient {

  public DisabledVisionClient() {
    log.info("Vision provider disabled, image text and object matching will be unavailable");
  }

  @Override
  public VisionAnnotations annotate(byte[] imageBytes, int width, int height) {
    return VisionAnnotations.disabled();
  }
}
