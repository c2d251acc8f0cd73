package com.flamingo.ai.autocategorize.domain.model;

/** A vertex of a detection polygon in image pixel coordinates. */
public record Point(double x, double y) {}
