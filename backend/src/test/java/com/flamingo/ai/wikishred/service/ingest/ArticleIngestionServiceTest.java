package com.flamingo.ai.wikishred.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.wikishred.archive.ArchiveReader;
import com.flamingo.ai.wikishred.archive.Article;
import com.flamingo.ai.wikishred.config.WikiConfig;
import com.flamingo.ai.wikishred.exception.ArticleNotFoundException;
import com.flamingo.ai.wikishred.exception.ArticleStorageException;
import com.flamingo.ai.wikishred.exception.DeterminismViolationException;
import com.flamingo.ai.wikishred.exception.TokenIntegrityException;
import com.flamingo.ai.wikishred.service.chunking.ChunkingPolicy;
import com.flamingo.ai.wikishred.service.chunking.UniversalChunker;
import com.flamingo.ai.wikishred.service.chunking.model.Chunk;
import com.flamingo.ai.wikishred.service.shred.MarkupShredder;
import com.flamingo.ai.wikishred.service.shred.WikiShredder;
import com.flamingo.ai.wikishred.service.shred.model.ShreddedDocument;
import com.flamingo.ai.wikishred.storage.ArticleStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ArticleIngestionService Tests")
class ArticleIngestionServiceTest {

  private static final Article SIMPLE =
      new Article(
          "Simple",
          "Simple",
          "<h2>Overview</h2><p>Some text about the topic.</p>"
              + "<table><caption>Numbers</caption><tr><th>A</th></tr><tr><td>1</td></tr></table>");

  @Mock private ArchiveReader archiveReader;
  @Mock private ArticleStore articleStore;

  private WikiConfig wikiConfig;
  private MeterRegistry meterRegistry;
  private ArticleIngestionService service;

  @BeforeEach
  void setUp() {
    wikiConfig = new WikiConfig();
    meterRegistry = new SimpleMeterRegistry();
    service = serviceWith(new WikiShredder(wikiConfig));
  }

  private ArticleIngestionService serviceWith(MarkupShredder shredder) {
    return new ArticleIngestionService(
        archiveReader,
        shredder,
        new UniversalChunker(ChunkingPolicy.from(wikiConfig.getChunking())),
        articleStore,
        Runnable::run,
        meterRegistry,
        wikiConfig);
  }

  @Test
  @DisplayName("should shred, chunk and store an article")
  void shouldIngestArticle() {
    when(archiveReader.findArticle("Simple")).thenReturn(Optional.of(SIMPLE));

    IngestionResult result = service.ingest("Simple");

    assertThat(result.succeeded()).isTrue();
    assertThat(result.chunkCount()).isEqualTo(1);
    assertThat(result.sidecarCount()).isEqualTo(1);
    verify(articleStore)
        .save(
            argThat(document -> document.tokenIds().equals(Set.of("TBL_1"))),
            argThat(chunks -> chunks.size() == 1));
    assertThat(meterRegistry.counter("wiki.articles.ingested", "status", "ingested").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("wiki.chunks.emitted").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should preview shredding and chunking without storing")
  void shouldPreviewWithoutStoring() {
    when(archiveReader.findArticle("Simple")).thenReturn(Optional.of(SIMPLE));

    ShreddedDocument document = service.shred("Simple");
    List<Chunk> chunks = service.chunk("Simple");

    assertThat(document.markdown()).contains("## Overview", "**[<<TABLE: TBL_1 | Numbers>>]**");
    assertThat(chunks).hasSize(1);
    assertThat(chunks.get(0).sectionPath()).containsExactly("Overview");
    assertThat(chunks.get(0).tokenRefs()).containsExactly("TBL_1");
    verify(articleStore, never()).save(any(), anyList());
  }

  @Test
  @DisplayName("should throw when the article is not in the archive")
  void shouldThrow_whenArticleMissing() {
    when(archiveReader.findArticle("Nope")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.ingest("Nope"))
        .isInstanceOf(ArticleNotFoundException.class);
  }

  @Test
  @DisplayName("should report failed articles without stopping the batch")
  void shouldIsolateFailures_whenBatchIngesting() {
    when(archiveReader.findArticle("Simple")).thenReturn(Optional.of(SIMPLE));
    when(archiveReader.findArticle("Nope")).thenReturn(Optional.empty());

    BatchReport report = service.ingestBatch(List.of("Simple", "Nope", "Simple"));

    assertThat(report.total()).isEqualTo(2);
    assertThat(report.ingested()).isEqualTo(1);
    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.chunkCount()).isEqualTo(1);
    assertThat(report.results())
        .extracting(IngestionResult::articleId, IngestionResult::status)
        .containsExactly(
            tuple("Simple", IngestionStatus.INGESTED),
            tuple("Nope", IngestionStatus.FAILED));
    assertThat(report.results().get(1).error()).contains("Nope");
    assertThat(meterRegistry.counter("wiki.articles.ingested", "status", "failed").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should report a storage failure as a failed article")
  void shouldReportFailure_whenStoreFails() {
    when(archiveReader.findArticle("Simple")).thenReturn(Optional.of(SIMPLE));
    doThrow(new ArticleStorageException("Simple", "disk full", new IOException("disk full")))
        .when(articleStore)
        .save(any(), anyList());

    BatchReport report = service.ingestBatch(List.of("Simple"));

    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.results().get(0).status()).isEqualTo(IngestionStatus.FAILED);
  }

  @Test
  @DisplayName("should ingest every archive article when no IDs are given")
  void shouldIngestWholeArchive_whenNoIdsGiven() {
    when(archiveReader.listArticleIds()).thenReturn(List.of("Simple"));
    when(archiveReader.findArticle("Simple")).thenReturn(Optional.of(SIMPLE));

    BatchReport report = service.ingestAll();

    assertThat(report.total()).isEqualTo(1);
    assertThat(report.ingested()).isEqualTo(1);
    verify(articleStore, times(1)).save(any(), anyList());
  }

  @Test
  @DisplayName("should abort the batch when token integrity is violated")
  void shouldAbortBatch_whenTokenIntegrityViolated() {
    MarkupShredder broken =
        article -> {
          throw new TokenIntegrityException("Token mismatch", Set.of("TBL_1"), Set.of());
        };
    service = serviceWith(broken);
    when(archiveReader.findArticle("Simple")).thenReturn(Optional.of(SIMPLE));

    assertThatThrownBy(() -> service.ingestBatch(List.of("Simple")))
        .isInstanceOf(TokenIntegrityException.class);
    verify(articleStore, never()).save(any(), anyList());
  }

  @Test
  @DisplayName("should stop storing the rest of a batch once token integrity is violated")
  void shouldSkipRemainingArticles_whenBatchAborted() {
    WikiShredder real = new WikiShredder(wikiConfig);
    MarkupShredder failingOnBad =
        article -> {
          if (article.id().equals("Bad")) {
            throw new TokenIntegrityException("Token mismatch", Set.of("TBL_1"), Set.of());
          }
          return real.shred(article);
        };
    service = serviceWith(failingOnBad);
    when(archiveReader.findArticle("A")).thenReturn(Optional.of(SIMPLE));
    when(archiveReader.findArticle("Bad"))
        .thenReturn(Optional.of(new Article("Bad", "Bad", "<p>Broken</p>")));

    assertThatThrownBy(() -> service.ingestBatch(List.of("A", "Bad", "C")))
        .isInstanceOf(TokenIntegrityException.class);
    verify(articleStore, times(1)).save(any(), anyList());
    verify(archiveReader, never()).findArticle("C");
    assertThat(meterRegistry.counter("wiki.articles.ingested", "status", "ingested").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should pass determinism verification for the real pipeline")
  void shouldVerifyDeterminism_whenEnabled() {
    wikiConfig.getIngestion().setVerifyDeterminism(true);
    when(archiveReader.findArticle("Simple")).thenReturn(Optional.of(SIMPLE));

    assertThat(service.ingest("Simple").succeeded()).isTrue();
  }

  @Test
  @DisplayName("should fail when two runs produce different output")
  void shouldThrow_whenRunsDiffer() {
    wikiConfig.getIngestion().setVerifyDeterminism(true);
    int[] calls = {0};
    MarkupShredder unstable =
        article ->
            new ShreddedDocument(
                article.id(),
                article.title(),
                "Run " + (++calls[0]) + "\n",
                List.of(),
                List.of(),
                "",
                List.of(),
                List.of());
    service = serviceWith(unstable);
    when(archiveReader.findArticle("Simple")).thenReturn(Optional.of(SIMPLE));

    assertThatThrownBy(() -> service.ingestBatch(List.of("Simple")))
        .isInstanceOf(DeterminismViolationException.class)
        .hasMessageContaining("markdown");
    verify(articleStore, never()).save(any(), anyList());
  }
}
