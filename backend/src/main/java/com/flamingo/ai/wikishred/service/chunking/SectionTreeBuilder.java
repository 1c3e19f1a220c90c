package com.flamingo.ai.wikishred.service.chunking;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.commonmark.node.Code;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.Text;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

/**
 * Builds the {@link SectionNode} tree of a Markdown document.
 *
 * <p>Only the block structure is taken from the parser. Every top-level block is kept as its raw
 * source lines, so placeholder tokens and other inline Markdown pass through untouched.
 */
final class SectionTreeBuilder {

  private static final Parser PARSER =
      Parser.builder().includeSourceSpans(IncludeSourceSpans.BLOCKS).build();

  private SectionTreeBuilder() {}

  static SectionNode build(String markdown) {
    String normalized = markdown.replace("\r\n", "\n").replace('\r', '\n');
    String[] lines = normalized.split("\n", -1);
    Node document = PARSER.parse(normalized);

    SectionNode root = SectionNode.root();
    Deque<SectionNode> open = new ArrayDeque<>();
    open.push(root);
    for (Node block = document.getFirstChild(); block != null; block = block.getNext()) {
      String source = sourceOf(block, lines);
      if (source.isBlank()) {
        continue;
      }
      if (block instanceof Heading heading) {
        while (open.peek().level() >= heading.getLevel()) {
          open.pop();
        }
        open.push(open.peek().addChild(heading.getLevel(), headingText(heading), source));
      } else {
        open.peek().addBlock(source);
      }
    }
    return root;
  }

  /** Whole source lines spanned by a block, trailing whitespace removed. */
  private static String sourceOf(Node block, String[] lines) {
    List<SourceSpan> spans = block.getSourceSpans();
    if (spans.isEmpty()) {
      return "";
    }
    int first = spans.get(0).getLineIndex();
    int last = spans.get(spans.size() - 1).getLineIndex();
    StringBuilder sb = new StringBuilder();
    for (int i = first; i <= last && i < lines.length; i++) {
      if (i > first) {
        sb.append('\n');
      }
      sb.append(lines[i]);
    }
    return sb.toString().stripTrailing();
  }

  static String headingText(Heading heading) {
    StringBuilder sb = new StringBuilder();
    collectText(heading, sb);
    return sb.toString().replaceAll("\\s+", " ").strip();
  }

  private static void collectText(Node node, StringBuilder sb) {
    if (node instanceof Text text) {
      sb.append(text.getLiteral());
    } else if (node instanceof Code code) {
      sb.append(code.getLiteral());
    } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
      sb.append(' ');
    } else {
      for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
        collectText(child, sb);
      }
    }
  }
}
