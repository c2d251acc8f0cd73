package com.flamingo.ai.autocategorize.service.aggregation;

import java.util.Map;

/**
 * Outcome of evidence voting.
 *
 * @param category winning category, or {@code uncategorized}
 * @param confidence reported confidence in [0, 1]
 * @param votes candidate count per category, in first-encounter order
 */
public record Verdict(String category, double confidence, Map<String, Integer> votes) {}
