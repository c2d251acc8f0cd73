package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.DetectionKind;

/**
 * An object or logo localised by the external detector.
 *
 * @param name object name or logo description
 * @param score detector score in [0, 1]
 * @param kind object or logo
 * @param boundingBox location in image pixels; null if the detector did not report one
 */
public record DetectedObject(
    String name, double score, DetectionKind kind, BoundingBox boundingBox) {}
