package com.flamingo.ai.autocategorize.service.extraction;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.model.ImageContent;
import com.flamingo.ai.autocategorize.exception.ContentUnavailableException;
import com.flamingo.ai.autocategorize.service.extraction.vision.VisionAnnotations;
import com.flamingo.ai.autocategorize.service.extraction.vision.VisionClient;
import com.flamingo.ai.autocategorize.service.image.ImageFeatureExtractor;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Decodes images and collects OCR and object/logo detections from the vision provider. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImageContentExtractor implements ContentExtractor {

  private final ImageFeatureExtractor featureExtractor;
  private final VisionClient visionClient;

  @Override
  public boolean supports(FileType fileType) {
    return fileType == FileType.IMAGE;
  }

  @Override
  public ExtractedContent extract(SourceFile file) {
    BufferedImage image;
    try {
      image = featureExtractor.decode(file.bytes());
    } catch (IOException e) {
      throw new ContentUnavailableException(file.name(), "Image could not be decoded", e);
    }

    VisionAnnotations annotations =
        visionClient.annotate(file.bytes(), image.getWidth(), image.getHeight());
    log.debug(
        "Image {} ({}x{}): {} text detections, {} objects, vision {}",
        file.name(),
        image.getWidth(),
        image.getHeight(),
        annotations.textDetections().size(),
        annotations.detectedObjects().size(),
        annotations.status());

    ImageContent content =
        new ImageContent(
            annotations.fullText(),
            annotations.textDetections(),
            annotations.detectedObjects(),
            file.bytes(),
            image.getWidth(),
            image.getHeight(),
            annotations.status() == ProviderStatus.OK);
    List<String> degraded =
        annotations.status() == ProviderStatus.FAILED ? List.of("vision") : List.of();
    return new ExtractedContent(content, degraded);
  }
}
