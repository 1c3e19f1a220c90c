package com.flamingo.ai.wikishred.service.shred.model;

/**
 * An image referenced by an article. Bytes stay inside the archive.
 *
 * @param locator archive locator, e.g. {@code zim://I/Apollo_11_Launch.jpg}
 * @param filename file name inside the archive image namespace
 * @param alt alternative text
 * @param originalSrc {@code src} attribute as found in the markup
 */
public record ImageReference(String locator, String filename, String alt, String originalSrc) {}
