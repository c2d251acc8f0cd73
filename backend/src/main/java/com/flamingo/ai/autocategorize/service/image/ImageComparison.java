package com.flamingo.ai.autocategorize.service.image;

/** Per-feature and combined similarity of two images; every similarity is within [0, 1]. */
public record ImageComparison(
    double similarity,
    double featureDistance,
    double colorDistance,
    double edgeSimilarity,
    double textureSimilarity,
    double histogramSimilarity) {}
