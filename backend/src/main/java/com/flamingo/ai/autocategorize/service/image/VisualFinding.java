package com.flamingo.ai.autocategorize.service.image;

import com.flamingo.ai.autocategorize.domain.enums.MatchType;

/**
 * What was recognised inside a stored visual region of the candidate image.
 *
 * @param description human readable description, e.g. {@code Object: Car}
 * @param confidence evidence confidence
 * @param matchType which rule recognised the region
 */
public record VisualFinding(String description, double confidence, MatchType matchType) {}
