package com.flamingo.ai.wikishred.service.shred.model;

/**
 * Table of contents line.
 *
 * @param level heading level (2 or 3)
 * @param text heading text
 */
public record TocEntry(int level, String text) {}
