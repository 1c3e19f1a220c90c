package com.flamingo.ai.wikishred.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.wikishred.service.chunking.model.Chunk;
import com.flamingo.ai.wikishred.service.chunking.model.ChunkType;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("UniversalChunker Tests")
class UniversalChunkerTest {

  private static final String TOKEN = "**[<<TABLE: TBL_1 | GDP Data>>]**";

  private final UniversalChunker smallChunker =
      new UniversalChunker(new ChunkingPolicy(10, 30, 60, 5));

  @Nested
  @DisplayName("Section structure")
  class SectionStructure {

    @Test
    @DisplayName("should return no chunks for blank input")
    void shouldReturnEmpty_whenInputBlank() {
      assertThat(smallChunker.chunk("a", "")).isEmpty();
      assertThat(smallChunker.chunk("a", "  \n\n ")).isEmpty();
      assertThat(smallChunker.chunk("a", null)).isEmpty();
    }

    @Test
    @DisplayName("should keep a small section whole and split a large one around its token")
    void shouldChunkSectionsAndSplitLargeOnes() {
      String markdown =
          "# Intro\n\nShort para.\n\n## GDP\n\n" + TOKEN + "\n\nMore economics text...";

      List<Chunk> chunks = smallChunker.chunk("a", markdown);

      assertThat(chunks).hasSize(3);
      assertThat(chunks.get(0).sectionPath()).containsExactly("Intro");
      assertThat(chunks.get(0).type()).isEqualTo(ChunkType.SECTION);
      assertThat(chunks.get(0).content()).isEqualTo("# Intro\n\nShort para.");

      assertThat(chunks.get(1).sectionPath()).containsExactly("Intro", "GDP");
      assertThat(chunks.get(1).type()).isEqualTo(ChunkType.SPLIT);
      assertThat(chunks.get(1).sequenceIndex()).isZero();
      assertThat(chunks.get(1).content()).isEqualTo("## GDP\n\n" + TOKEN);
      assertThat(chunks.get(1).tokenRefs()).containsExactly("TBL_1");
      assertThat(chunks.get(1).overlapLength()).isZero();

      assertThat(chunks.get(2).sequenceIndex()).isEqualTo(1);
      assertThat(chunks.get(2).content()).isEqualTo("More economics text...");
      assertThat(chunks.get(2).tokenRefs()).isEmpty();

      assertThat(chunks).extracting(Chunk::ordinal).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("should emit text before the first header with an empty section path")
    void shouldChunkLeadWithEmptyPath() {
      List<Chunk> chunks = smallChunker.chunk("a", "Just a lead paragraph.");

      assertThat(chunks).hasSize(1);
      assertThat(chunks.get(0).sectionPath()).isEmpty();
      assertThat(chunks.get(0).id()).isEqualTo(ChunkIdGenerator.generate("a", List.of(), 0));
    }

    @Test
    @DisplayName("should merge small sections with the sections after them")
    void shouldMergeSmallSections() {
      String markdown = "# A\n\nx\n\n# B\n\ny\n\n# C\n\nThis is a longer closing section.";

      List<Chunk> chunks = smallChunker.chunk("a", markdown);

      assertThat(chunks).hasSize(2);
      assertThat(chunks.get(0).type()).isEqualTo(ChunkType.MERGED);
      assertThat(chunks.get(0).sectionPath()).containsExactly("A");
      assertThat(chunks.get(0).content()).isEqualTo("# A\n\nx\n\n# B\n\ny");
      assertThat(chunks.get(1).type()).isEqualTo(ChunkType.SECTION);
      assertThat(chunks.get(1).sectionPath()).containsExactly("C");
    }

    @Test
    @DisplayName("should merge a small last section back into its predecessor")
    void shouldMergeTrailingSmallSection() {
      String markdown = "# A\n\nThis section is long enough.\n\n# B\n\nz";

      List<Chunk> chunks = smallChunker.chunk("a", markdown);

      assertThat(chunks).hasSize(1);
      assertThat(chunks.get(0).type()).isEqualTo(ChunkType.MERGED);
      assertThat(chunks.get(0).sectionPath()).containsExactly("A");
      assertThat(chunks.get(0).content()).isEqualTo(markdown);
    }

    @Test
    @DisplayName("should give repeated sibling titles distinct IDs")
    void shouldDisambiguateDuplicateTitles() {
      String markdown = "# Notes\n\nfirst notes text here\n\n# Notes\n\nsecond notes text here";

      List<Chunk> chunks = smallChunker.chunk("a", markdown);

      assertThat(chunks).hasSize(2);
      assertThat(chunks).extracting(Chunk::sectionPath).containsOnly(List.of("Notes"));
      assertThat(chunks.get(0).id()).isEqualTo(ChunkIdGenerator.generate("a", List.of("Notes"), 0));
      assertThat(chunks.get(1).id())
          .isEqualTo(ChunkIdGenerator.generate("a", List.of("Notes#2"), 0));
    }

    @Test
    @DisplayName("should not confuse a literal '#2' title with a repeated sibling title")
    void shouldKeepIdsDistinct_whenTitleLooksLikeRepeatKey() {
      String markdown =
          "# Notes\n\nfirst notes text here\n\n"
              + "# Notes#2\n\nsecond notes text here\n\n"
              + "# Notes\n\nthird notes text here";

      List<Chunk> chunks = smallChunker.chunk("a", markdown);

      assertThat(chunks).hasSize(3);
      assertThat(chunks).extracting(Chunk::type).containsOnly(ChunkType.SECTION);
      assertThat(chunks).extracting(Chunk::id).doesNotHaveDuplicates();
      assertThat(chunks.get(1).sectionPath()).containsExactly("Notes#2");
      assertThat(chunks.get(1).id())
          .isEqualTo(ChunkIdGenerator.generate("a", List.of("Notes\\#2"), 0));
      assertThat(chunks.get(2).id())
          .isEqualTo(ChunkIdGenerator.generate("a", List.of("Notes#2"), 0));
    }
  }

  @Nested
  @DisplayName("Splitting")
  class Splitting {

    @Test
    @DisplayName("should split long paragraphs at sentence boundaries with overlap")
    void shouldSplitAtSentences() {
      String markdown =
          "First sentence here. Second sentence here. Third sentence here. Fourth one.";

      List<Chunk> chunks = smallChunker.chunk("a", markdown);

      assertThat(chunks).hasSize(2);
      assertThat(chunks).extracting(Chunk::type).containsOnly(ChunkType.SPLIT);
      assertThat(chunks.get(0).body()).isEqualTo("First sentence here. Second sentence here.");
      assertThat(chunks.get(1).content()).isEqualTo("here.\n\nThird sentence here. Fourth one.");
      assertThat(chunks.get(1).overlapLength()).isEqualTo(7);
      assertThat(chunks.get(1).body()).isEqualTo("Third sentence here. Fourth one.");
    }

    @Test
    @DisplayName("should emit an oversized token as an atomic chunk")
    void shouldEmitAtomicChunk_whenTokenExceedsMax() {
      String token = "**[<<TABLE: TBL_1 | A very long table caption for testing>>]**";
      String markdown = "# Data\n\n" + token + "\n\nSome closing words here.";

      List<Chunk> chunks = smallChunker.chunk("a", markdown);

      assertThat(chunks).extracting(Chunk::type)
          .containsExactly(ChunkType.SPLIT, ChunkType.ATOMIC, ChunkType.SPLIT);
      assertThat(chunks.get(0).content()).isEqualTo("# Data");
      assertThat(chunks.get(1).content()).isEqualTo(token);
      assertThat(chunks.get(1).overlapLength()).isZero();
      assertThat(chunks.get(1).tokenRefs()).containsExactly("TBL_1");
      assertThat(chunks.get(2).content()).isEqualTo("Some closing words here.");
      assertThat(chunks).extracting(Chunk::sequenceIndex).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("should fold a short first window into the whole chunk before it")
    void shouldFoldShortFirstWindow_whenPreviousChunkHasRoom() {
      String paragraph = "The quick brown fox jumps over the lazy dog near a river";
      String markdown =
          "# A\n\nalpha beta gamma\n\n# B\n\n" + paragraph + "\n\nClosing words here.";

      List<Chunk> chunks = smallChunker.chunk("a", markdown);

      assertThat(chunks).hasSize(3);
      assertThat(chunks.get(0).type()).isEqualTo(ChunkType.MERGED);
      assertThat(chunks.get(0).sectionPath()).containsExactly("A");
      assertThat(chunks.get(0).content()).isEqualTo("# A\n\nalpha beta gamma\n\n# B");
      assertThat(chunks.get(0).id()).isEqualTo(ChunkIdGenerator.generate("a", List.of("A"), 0));

      assertThat(chunks.get(1).type()).isEqualTo(ChunkType.SPLIT);
      assertThat(chunks.get(1).sectionPath()).containsExactly("B");
      assertThat(chunks.get(1).sequenceIndex()).isZero();
      assertThat(chunks.get(1).body()).isEqualTo(paragraph);
      assertThat(chunks.get(2).sequenceIndex()).isEqualTo(1);
      assertThat(chunks.get(2).body()).isEqualTo("Closing words here.");

      assertThat(chunks).extracting(Chunk::ordinal).containsExactly(0, 1, 2);
      assertThat(chunks.subList(0, 2))
          .allSatisfy(chunk -> assertThat(chunk.length()).isGreaterThanOrEqualTo(10));
    }

    @Test
    @DisplayName("should never start the overlap inside a token")
    void shouldExcludeTokensFromOverlap() {
      SlidingWindowSplitter splitter = new SlidingWindowSplitter(new ChunkingPolicy(10, 30, 60, 5));

      assertThat(splitter.overlapOf("## GDP\n\n" + TOKEN)).isEmpty();
      assertThat(splitter.overlapOf(TOKEN + " and after")).isEqualTo("after");
    }
  }

  @Nested
  @DisplayName("Default policy over generated text")
  class GeneratedText {

    private final ChunkingPolicy policy = new ChunkingPolicy(200, 500, 800, 50);
    private final UniversalChunker chunker = new UniversalChunker(policy);

    @Test
    @DisplayName("should keep chunks within bounds and cover the text exactly once")
    void shouldRespectBoundsAndCoverage() {
      List<String> paragraphs = paragraphs(new Random(42), 40);
      String markdown = String.join("\n\n", paragraphs);

      List<Chunk> chunks = chunker.chunk("gen", markdown);

      assertThat(chunks).hasSizeGreaterThan(1);
      assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(800));
      assertThat(chunks.subList(0, chunks.size() - 1))
          .allSatisfy(chunk -> assertThat(chunk.length()).isGreaterThanOrEqualTo(200));

      List<String> bodies = new ArrayList<>();
      for (Chunk chunk : chunks) {
        bodies.add(chunk.body());
      }
      assertThat(String.join("\n\n", bodies)).isEqualTo(markdown);
    }

    @Test
    @DisplayName("should repeat the tail of the previous chunk as overlap")
    void shouldRepeatPreviousTailAsOverlap() {
      List<Chunk> chunks = chunker.chunk("gen", String.join("\n\n", paragraphs(new Random(7), 30)));

      for (int i = 1; i < chunks.size(); i++) {
        Chunk chunk = chunks.get(i);
        if (chunk.overlapLength() == 0) {
          continue;
        }
        String overlap = chunk.content().substring(0, chunk.overlapLength() - 2);
        assertThat(overlap.length()).isLessThanOrEqualTo(policy.overlapSize());
        assertThat(chunk.content().substring(chunk.overlapLength() - 2, chunk.overlapLength()))
            .isEqualTo("\n\n");
        assertThat(chunks.get(i - 1).body()).endsWith(overlap);
      }
    }

    @Test
    @DisplayName("should produce identical chunks and IDs for identical input")
    void shouldBeDeterministic() {
      String markdown = "# Economy\n\n" + String.join("\n\n", paragraphs(new Random(3), 20));

      List<Chunk> first = chunker.chunk("gen", markdown);
      List<Chunk> second = new UniversalChunker(policy).chunk("gen", markdown);

      assertThat(second).isEqualTo(first);
      assertThat(first).extracting(Chunk::id).doesNotHaveDuplicates();
    }

    private List<String> paragraphs(Random random, int count) {
      List<String> paragraphs = new ArrayList<>();
      for (int i = 0; i < count; i++) {
        int length = 40 + random.nextInt(261);
        StringBuilder sb = new StringBuilder();
        while (sb.length() < length) {
          if (sb.length() > 0) {
            sb.append(' ');
          }
          sb.append(word(random));
        }
        paragraphs.add(sb.substring(0, length).strip() + ".");
      }
      return paragraphs;
    }

    private String word(Random random) {
      int length = 2 + random.nextInt(8);
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < length; i++) {
        sb.append((char) ('a' + random.nextInt(26)));
      }
      return sb.toString();
    }
  }
}
