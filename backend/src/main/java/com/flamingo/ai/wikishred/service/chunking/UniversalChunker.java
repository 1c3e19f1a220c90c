package com.flamingo.ai.wikishred.service.chunking;

import com.flamingo.ai.wikishred.service.chunking.model.Chunk;
import com.flamingo.ai.wikishred.service.chunking.model.ChunkType;
import com.flamingo.ai.wikishred.service.token.TokenScanner;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that follows the header structure of the Markdown.
 *
 * <p>The document is parsed into a {@link SectionNode} tree. Walking it depth-first, a section
 * whose whole subtree fits the target size becomes one piece; larger sections contribute their own
 * text as a piece and are descended into. Pieces below the minimum size are merged with the pieces
 * that follow them, and pieces above the maximum are cut by the {@link SlidingWindowSplitter}. A
 * first window below the minimum is folded into the whole chunk before it when both fit.
 *
 * <p>Chunk IDs come from {@link ChunkIdGenerator}, so unchanged input under an unchanged policy
 * always yields the same IDs.
 */
@Service
@Slf4j
public class UniversalChunker implements DocumentChunker {

  private static final String BLOCK_SEPARATOR = "\n\n";

  private final ChunkingPolicy policy;
  private final SlidingWindowSplitter splitter;

  public UniversalChunker(ChunkingPolicy policy) {
    this.policy = policy;
    this.splitter = new SlidingWindowSplitter(policy);
  }

  /**
   * Consecutive blocks that end up in one chunk, or in one split.
   *
   * @param titles section path of the first member
   * @param keys disambiguated section path keys of the first member
   * @param blocks raw Markdown blocks
   * @param members number of pieces merged into this one
   */
  private record Piece(List<String> titles, List<String> keys, List<String> blocks, int members) {

    int size() {
      return String.join(BLOCK_SEPARATOR, blocks).length();
    }

    Piece mergeWith(Piece next) {
      List<String> merged = new ArrayList<>(blocks);
      merged.addAll(next.blocks);
      return new Piece(titles, keys, merged, members + next.members);
    }
  }

  @Override
  public List<Chunk> chunk(String articleId, String markdown) {
    if (markdown == null || markdown.isBlank()) {
      return List.of();
    }
    SectionNode root = SectionTreeBuilder.build(markdown);

    List<Piece> pieces = new ArrayList<>();
    plan(root, List.of(), List.of(), pieces);
    pieces = mergeSmall(pieces);

    List<Chunk> chunks = new ArrayList<>();
    Piece previousWhole = null;
    for (Piece piece : pieces) {
      String text = String.join(BLOCK_SEPARATOR, piece.blocks());
      if (text.length() <= policy.maxChunkSize()) {
        ChunkType type = piece.members() > 1 ? ChunkType.MERGED : ChunkType.SECTION;
        chunks.add(newChunk(articleId, piece, 0, chunks.size(), text, 0, type));
        previousWhole = piece;
        continue;
      }
      List<SlidingWindowSplitter.Window> windows = splitter.split(piece.blocks());
      if (previousWhole != null && foldsIntoPrevious(previousWhole, windows)) {
        Piece folded =
            previousWhole.mergeWith(
                new Piece(piece.titles(), piece.keys(), List.of(windows.get(0).content()), 1));
        int ordinal = chunks.size() - 1;
        String foldedText = String.join(BLOCK_SEPARATOR, folded.blocks());
        chunks.set(
            ordinal, newChunk(articleId, folded, 0, ordinal, foldedText, 0, ChunkType.MERGED));
        windows = windows.subList(1, windows.size());
      }
      int sequence = 0;
      for (SlidingWindowSplitter.Window window : windows) {
        ChunkType type = window.atomic() ? ChunkType.ATOMIC : ChunkType.SPLIT;
        chunks.add(
            newChunk(
                articleId,
                piece,
                sequence++,
                chunks.size(),
                window.content(),
                window.overlapLength(),
                type));
      }
      previousWhole = null;
    }

    verifyUniqueIds(articleId, chunks);
    log.debug(
        "Chunked article {} into {} chunks from {} pieces",
        articleId,
        chunks.size(),
        pieces.size());
    return chunks;
  }

  private void plan(SectionNode node, List<String> titles, List<String> keys, List<Piece> out) {
    List<String> own = node.ownBlocks();
    if (!own.isEmpty()) {
      out.add(new Piece(titles, keys, own, 1));
    }
    for (SectionNode child : node.children()) {
      List<String> childTitles = append(titles, child.title());
      List<String> childKeys = append(keys, child.key());
      List<String> subtree = child.subtreeBlocks();
      if (String.join(BLOCK_SEPARATOR, subtree).length() <= policy.targetChunkSize()) {
        out.add(new Piece(childTitles, childKeys, subtree, 1));
      } else {
        plan(child, childTitles, childKeys, out);
      }
    }
  }

  /**
   * Joins each piece below the minimum size with the pieces after it. A small last piece goes
   * back into its predecessor when the two fit the maximum, or when the predecessor is split
   * anyway.
   */
  private List<Piece> mergeSmall(List<Piece> pieces) {
    List<Piece> merged = new ArrayList<>();
    Piece pending = null;
    for (Piece piece : pieces) {
      pending = pending == null ? piece : pending.mergeWith(piece);
      if (pending.size() >= policy.minChunkSize()) {
        merged.add(pending);
        pending = null;
      }
    }
    if (pending != null) {
      if (merged.isEmpty()) {
        merged.add(pending);
      } else {
        Piece previous = merged.get(merged.size() - 1);
        int combined = previous.size() + BLOCK_SEPARATOR.length() + pending.size();
        if (combined <= policy.maxChunkSize() || previous.size() > policy.maxChunkSize()) {
          merged.set(merged.size() - 1, previous.mergeWith(pending));
        } else {
          merged.add(pending);
        }
      }
    }
    return merged;
  }

  /**
   * Whether the first window of a split is below the minimum and fits, with the chunk emitted
   * whole just before it, under the maximum.
   */
  private boolean foldsIntoPrevious(Piece previous, List<SlidingWindowSplitter.Window> windows) {
    if (windows.size() < 2) {
      return false;
    }
    SlidingWindowSplitter.Window first = windows.get(0);
    int firstLength = first.content().length();
    return !first.atomic()
        && first.overlapLength() == 0
        && firstLength < policy.minChunkSize()
        && previous.size() + BLOCK_SEPARATOR.length() + firstLength <= policy.maxChunkSize();
  }

  private static Chunk newChunk(
      String articleId,
      Piece piece,
      int sequenceIndex,
      int ordinal,
      String content,
      int overlapLength,
      ChunkType type) {
    String body = content.substring(overlapLength);
    return new Chunk(
        ChunkIdGenerator.generate(articleId, piece.keys(), sequenceIndex),
        articleId,
        piece.titles(),
        sequenceIndex,
        ordinal,
        content,
        overlapLength,
        new ArrayList<>(TokenScanner.tokenIds(body)),
        type);
  }

  private static void verifyUniqueIds(String articleId, List<Chunk> chunks) {
    Set<String> seen = new HashSet<>();
    for (Chunk chunk : chunks) {
      if (!seen.add(chunk.id())) {
        throw new IllegalStateException(
            "Duplicate chunk ID " + chunk.id() + " in article " + articleId);
      }
    }
  }

  private static List<String> append(List<String> path, String element) {
    List<String> extended = new ArrayList<>(path);
    extended.add(element);
    return extended;
  }
}
