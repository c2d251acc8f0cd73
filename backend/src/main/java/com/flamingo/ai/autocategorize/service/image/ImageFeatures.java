package com.flamingo.ai.autocategorize.service.image;

import java.util.Arrays;

/**
 * Pixel statistics of an image normalised to the canonical comparison size.
 *
 * @param hash mean brightness of all pixels
 * @param averageColor per-channel mean
 * @param edgeDensity summed red-channel gradient magnitude over interior pixels, per pixel
 * @param textureComplexity summed mean absolute brightness difference to the 8 neighbours, per
 *     pixel
 * @param histogram 256 brightness bins normalised by pixel count
 */
public record ImageFeatures(
    double hash,
    RgbColor averageColor,
    double edgeDensity,
    double textureComplexity,
    double[] histogram) {

  public static final int HISTOGRAM_BINS = 256;

  public ImageFeatures {
    if (histogram == null || histogram.length != HISTOGRAM_BINS) {
      throw new IllegalArgumentException("Histogram must have " + HISTOGRAM_BINS + " bins");
    }
    histogram = histogram.clone();
  }

  @Override
  public double[] histogram() {
    return histogram.clone();
  }

  double histogramBin(int index) {
    return histogram[index];
  }

  /** Largest normalised bin, i.e. the share of the dominant brightness level. */
  public double maxHistogramBin() {
    return Arrays.stream(histogram).max().orElse(0.0);
  }
}
