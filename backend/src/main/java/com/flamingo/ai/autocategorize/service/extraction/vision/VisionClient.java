package com.flamingo.ai.autocategorize.service.extraction.vision;

/** OCR and object/logo localisation provider. */
public interface VisionClient {

  /**
   * Annotates an image. Implementations never throw for provider failures; they return {@link
   * VisionAnnotations#failed()} instead.
   *
   * @param imageBytes encoded image
   * @param width decoded width, used to scale normalised coordinates
   * @param height decoded height, used to scale normalised coordinates
   */
  VisionAnnotations annotate(byte[] imageBytes, int width, int height);
}
