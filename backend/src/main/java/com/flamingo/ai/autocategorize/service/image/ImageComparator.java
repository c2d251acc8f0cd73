package com.flamingo.ai.autocategorize.service.image;

import org.springframework.stereotype.Component;

/**
 * Weighted similarity between two {@link ImageFeatures}.
 *
 * <p>The comparison is symmetric and every component is clamped to [0, 1]; comparing features with
 * themselves yields a similarity of 1. Two empty histograms share nothing and score 0.
 */
@Component
public class ImageComparator {

  static final double HASH_RANGE = 65535.0;
  static final double MAX_COLOR_DISTANCE = 441.67;

  private static final double HASH_WEIGHT = 0.30;
  private static final double COLOR_WEIGHT = 0.20;
  private static final double EDGE_WEIGHT = 0.20;
  private static final double TEXTURE_WEIGHT = 0.15;
  private static final double HISTOGRAM_WEIGHT = 0.15;

  public ImageComparison compare(ImageFeatures a, ImageFeatures b) {
    double hashDistance = Math.abs(a.hash() - b.hash());
    double hashSimilarity = clamp(1 - hashDistance / HASH_RANGE);

    double colorDistance = a.averageColor().distanceTo(b.averageColor());
    double colorSimilarity = clamp(1 - colorDistance / MAX_COLOR_DISTANCE);

    double edgeSimilarity = relativeSimilarity(a.edgeDensity(), b.edgeDensity());
    double textureSimilarity = relativeSimilarity(a.textureComplexity(), b.textureComplexity());
    double histogramSimilarity = histogramIntersection(a, b);

    double similarity =
        clamp(
            HASH_WEIGHT * hashSimilarity
                + COLOR_WEIGHT * colorSimilarity
                + EDGE_WEIGHT * edgeSimilarity
                + TEXTURE_WEIGHT * textureSimilarity
                + HISTOGRAM_WEIGHT * histogramSimilarity);

    return new ImageComparison(
        similarity,
        hashDistance,
        colorDistance,
        edgeSimilarity,
        textureSimilarity,
        histogramSimilarity);
  }

  private static double relativeSimilarity(double a, double b) {
    return clamp(1 - Math.abs(a - b) / Math.max(Math.max(a, b), 1.0));
  }

  private static double histogramIntersection(ImageFeatures a, ImageFeatures b) {
    double intersection = 0;
    double union = 0;
    for (int i = 0; i < ImageFeatures.HISTOGRAM_BINS; i++) {
      double x = a.histogramBin(i);
      double y = b.histogramBin(i);
      intersection += Math.min(x, y);
      union += Math.max(x, y);
    }
    if (union == 0) {
      return 0.0;
    }
    return clamp(intersection / union);
  }

  static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
