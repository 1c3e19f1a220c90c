package com.flamingo.ai.wikishred.service.chunking.model;

/** How a chunk was formed from the section tree. */
public enum ChunkType {
  /** One section, or one collapsed subtree, that fit the size policy as is. */
  SECTION,
  /** Several small consecutive pieces joined together. */
  MERGED,
  /** One window of a section that exceeded the maximum size. */
  SPLIT,
  /** A single placeholder token larger than the maximum size, emitted alone. */
  ATOMIC
}
