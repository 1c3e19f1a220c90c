package com.flamingo.ai.wikishred.service.chunking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the section tree built from Markdown headers.
 *
 * <p>The root is synthetic (level 0, no heading) and holds the text before the first header. Every
 * other node owns its heading source and the blocks up to the next header, and its children are the
 * deeper headers that follow it.
 */
public final class SectionNode {

  private final int level;
  private final String title;
  private final String key;
  private final String headingSource;
  private final List<String> blocks = new ArrayList<>();
  private final List<SectionNode> children = new ArrayList<>();

  private SectionNode(int level, String title, String key, String headingSource) {
    this.level = level;
    this.title = title;
    this.key = key;
    this.headingSource = headingSource;
  }

  static SectionNode root() {
    return new SectionNode(0, "", "", null);
  }

  /**
   * Appends a child section. A title already used by a sibling gets an occurrence suffix in its
   * key ({@code Notes#2}); the title itself is kept. The title part of the key is escaped, so a
   * heading that literally reads {@code Notes#2} keys as {@code Notes\#2} and never collides with
   * a suffixed key.
   */
  SectionNode addChild(int childLevel, String childTitle, String source) {
    long seen = children.stream().filter(child -> child.title.equals(childTitle)).count();
    String escaped = escapeKey(childTitle);
    String childKey = seen == 0 ? escaped : escaped + "#" + (seen + 1);
    SectionNode child = new SectionNode(childLevel, childTitle, childKey, source);
    children.add(child);
    return child;
  }

  /** Escapes the backslash, {@code #} and the ID path separator {@code U+001F}. */
  static String escapeKey(String title) {
    return title.replace("\\", "\\\\").replace("#", "\\#").replace("\u001f", "\\u001f");
  }

  void addBlock(String block) {
    blocks.add(block);
  }

  public int level() {
    return level;
  }

  public boolean isRoot() {
    return level == 0;
  }

  public String title() {
    return title;
  }

  /** Path key, unique among siblings. */
  public String key() {
    return key;
  }

  /** Raw Markdown of the heading, {@code null} for the root. */
  public String headingSource() {
    return headingSource;
  }

  public List<String> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  public List<SectionNode> children() {
    return Collections.unmodifiableList(children);
  }

  /** Heading followed by the node's own blocks. */
  List<String> ownBlocks() {
    List<String> own = new ArrayList<>(blocks.size() + 1);
    if (headingSource != null) {
      own.add(headingSource);
    }
    own.addAll(blocks);
    return own;
  }

  /** Heading, blocks and all descendants, in document order. */
  List<String> subtreeBlocks() {
    List<String> all = ownBlocks();
    for (SectionNode child : children) {
      all.addAll(child.subtreeBlocks());
    }
    return all;
  }
}
