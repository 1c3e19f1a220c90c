package com.flamingo.ai.wikishred.archive;

/**
 * An article as stored in the archive. Read-only input to the pipeline.
 *
 * @param id archive article ID
 * @param title article title
 * @param rawMarkup article HTML
 */
public record Article(String id, String title, String rawMarkup) {}
