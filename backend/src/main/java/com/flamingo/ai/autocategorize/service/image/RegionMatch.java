package com.flamingo.ai.autocategorize.service.image;

import com.flamingo.ai.autocategorize.domain.model.BoundingBox;

/**
 * OCR detection chosen for a stored image pattern.
 *
 * @param detectedText text of the chosen detection
 * @param detectedBox enclosing box of the detection polygon
 * @param score shorter/longer length ratio of the two texts
 */
public record RegionMatch(String detectedText, BoundingBox detectedBox, double score) {}
