package com.flamingo.ai.autocategorize.domain.model;

/** A category from the external directory. */
public record Category(String id, String name) {}
