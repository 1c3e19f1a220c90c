package com.flamingo.ai.wikishred.service.ingest;

import com.flamingo.ai.wikishred.archive.ArchiveReader;
import com.flamingo.ai.wikishred.archive.Article;
import com.flamingo.ai.wikishred.config.WikiConfig;
import com.flamingo.ai.wikishred.exception.ArticleNotFoundException;
import com.flamingo.ai.wikishred.exception.ArticleProcessingException;
import com.flamingo.ai.wikishred.exception.DeterminismViolationException;
import com.flamingo.ai.wikishred.exception.TokenIntegrityException;
import com.flamingo.ai.wikishred.service.chunking.DocumentChunker;
import com.flamingo.ai.wikishred.service.chunking.model.Chunk;
import com.flamingo.ai.wikishred.service.shred.MarkupShredder;
import com.flamingo.ai.wikishred.service.shred.model.ShredWarning;
import com.flamingo.ai.wikishred.service.shred.model.ShreddedDocument;
import com.flamingo.ai.wikishred.storage.ArticleStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Orchestrates article ingestion: read, shred, chunk and store.
 *
 * <p>Articles are independent units of work. A batch submits one task per article to the
 * ingestion pool and a failing article is reported without affecting the others. Token bijection
 * and determinism violations are pipeline defects rather than article failures; they abort the
 * batch, and articles of that batch not yet stored are skipped.
 */
@Service
@Slf4j
public class ArticleIngestionService {

  private static final String BATCH_ABORTED = "Batch aborted";

  private final ArchiveReader archiveReader;
  private final MarkupShredder shredder;
  private final DocumentChunker chunker;
  private final ArticleStore articleStore;
  private final Executor ingestionExecutor;
  private final MeterRegistry meterRegistry;
  private final WikiConfig wikiConfig;

  public ArticleIngestionService(
      ArchiveReader archiveReader,
      MarkupShredder shredder,
      DocumentChunker chunker,
      ArticleStore articleStore,
      @Qualifier("ingestionExecutor") Executor ingestionExecutor,
      MeterRegistry meterRegistry,
      WikiConfig wikiConfig) {
    this.archiveReader = archiveReader;
    this.shredder = shredder;
    this.chunker = chunker;
    this.articleStore = articleStore;
    this.ingestionExecutor = ingestionExecutor;
    this.meterRegistry = meterRegistry;
    this.wikiConfig = wikiConfig;
  }

  /** Processed form of one article. */
  private record ProcessedArticle(ShreddedDocument document, List<Chunk> chunks) {}

  /**
   * Shreds an article without storing anything.
   *
   * @throws ArticleNotFoundException if the archive has no such article
   */
  public ShreddedDocument shred(String articleId) {
    return process(loadArticle(articleId)).document();
  }

  /**
   * Shreds and chunks an article without storing anything.
   *
   * @throws ArticleNotFoundException if the archive has no such article
   */
  public List<Chunk> chunk(String articleId) {
    return process(loadArticle(articleId)).chunks();
  }

  /**
   * Shreds, chunks and stores one article.
   *
   * @param articleId archive article ID
   * @return result with chunk and sidecar counts
   * @throws ArticleNotFoundException if the archive has no such article
   * @throws DeterminismViolationException if determinism verification is on and two runs differ
   */
  public IngestionResult ingest(String articleId) {
    return ingest(articleId, () -> false);
  }

  /**
   * Ingests a batch of articles on the ingestion pool.
   *
   * @param articleIds articles to ingest; {@code null} or empty ingests the whole archive
   * @return report with one result per distinct article, in request order
   * @throws DeterminismViolationException if any article fails determinism verification
   * @throws TokenIntegrityException if any article breaks the token bijection
   */
  @Timed(value = "wiki.batch.ingest", description = "Time to ingest a batch of articles")
  public BatchReport ingestBatch(List<String> articleIds) {
    if (articleIds == null || articleIds.isEmpty()) {
      return runBatch(archiveReader.listArticleIds());
    }
    return runBatch(articleIds.stream().distinct().toList());
  }

  /** Ingests every article in the archive. */
  @Timed(value = "wiki.batch.ingest", description = "Time to ingest a batch of articles")
  public BatchReport ingestAll() {
    return runBatch(archiveReader.listArticleIds());
  }

  // ---- private helpers ----

  private IngestionResult ingest(String articleId, BooleanSupplier cancelled) {
    log.info("Ingesting article {}", articleId);
    Article article = loadArticle(articleId);
    ProcessedArticle processed = process(article);
    if (wikiConfig.getIngestion().isVerifyDeterminism()) {
      verifyDeterminism(articleId, processed, process(article));
    }

    if (cancelled.getAsBoolean()) {
      log.info("Skipping store of article {}: batch aborted", articleId);
      return IngestionResult.failed(articleId, BATCH_ABORTED);
    }
    articleStore.save(processed.document(), processed.chunks());

    meterRegistry.counter("wiki.chunks.emitted").increment(processed.chunks().size());
    for (ShredWarning warning : processed.document().warnings()) {
      meterRegistry.counter("wiki.shred.warnings", "kind", warning.kind().name()).increment();
    }
    recordOutcome(IngestionStatus.INGESTED);

    List<String> warnings =
        processed.document().warnings().stream().map(ShredWarning::toString).toList();
    log.info(
        "Ingested article {}: {} chunks, {} sidecar entries, {} warnings",
        articleId,
        processed.chunks().size(),
        processed.document().sidecar().size(),
        warnings.size());
    return IngestionResult.ingested(
        articleId, processed.chunks().size(), processed.document().sidecar().size(), warnings);
  }

  /**
   * Runs one task per article. The first pipeline defect aborts the batch: tasks not yet started
   * are cancelled and running ones skip their store step.
   */
  private BatchReport runBatch(List<String> ids) {
    log.info("Starting batch ingestion of {} articles", ids.size());
    long started = System.nanoTime();

    AtomicBoolean aborted = new AtomicBoolean();
    List<CompletableFuture<IngestionResult>> futures = new ArrayList<>(ids.size());
    for (String id : ids) {
      futures.add(
          CompletableFuture.supplyAsync(() -> ingestIsolated(id, aborted), ingestionExecutor));
    }
    List<IngestionResult> results = new ArrayList<>(futures.size());
    for (CompletableFuture<IngestionResult> future : futures) {
      try {
        results.add(await(future));
      } catch (DeterminismViolationException | TokenIntegrityException e) {
        aborted.set(true);
        futures.forEach(pending -> pending.cancel(false));
        log.error("Batch ingestion aborted after {} of {} articles", results.size(), ids.size(), e);
        throw e;
      }
    }

    BatchReport report = BatchReport.of(results, (System.nanoTime() - started) / 1_000_000);
    log.info(
        "Batch ingestion finished: {} ingested, {} failed, {} chunks in {} ms",
        report.ingested(),
        report.failed(),
        report.chunkCount(),
        report.elapsedMillis());
    return report;
  }

  private Article loadArticle(String articleId) {
    return archiveReader
        .findArticle(articleId)
        .orElseThrow(() -> new ArticleNotFoundException(articleId));
  }

  private ProcessedArticle process(Article article) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      ShreddedDocument document = shredder.shred(article);
      List<Chunk> chunks = chunker.chunk(document);
      return new ProcessedArticle(document, chunks);
    } catch (TokenIntegrityException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Failed to process article {}: {}", article.id(), e.getMessage(), e);
      throw new ArticleProcessingException(
          article.id(), "Failed to shred or chunk article: " + e.getMessage(), e);
    } finally {
      sample.stop(meterRegistry.timer("wiki.article.process"));
    }
  }

  private IngestionResult ingestIsolated(String articleId, AtomicBoolean aborted) {
    if (aborted.get()) {
      return IngestionResult.failed(articleId, BATCH_ABORTED);
    }
    try {
      return ingest(articleId, aborted::get);
    } catch (DeterminismViolationException | TokenIntegrityException e) {
      aborted.set(true);
      recordOutcome(IngestionStatus.FAILED);
      throw e;
    } catch (RuntimeException e) {
      log.warn("Article {} failed: {}", articleId, e.getMessage());
      recordOutcome(IngestionStatus.FAILED);
      return IngestionResult.failed(articleId, e.getMessage());
    }
  }

  private static IngestionResult await(CompletableFuture<IngestionResult> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  private void verifyDeterminism(
      String articleId, ProcessedArticle first, ProcessedArticle second) {
    if (!first.document().markdown().equals(second.document().markdown())) {
      throw new DeterminismViolationException(articleId, "markdown differs between runs");
    }
    if (!first.document().tokenIds().equals(second.document().tokenIds())
        || !first.document().sidecar().equals(second.document().sidecar())) {
      throw new DeterminismViolationException(articleId, "sidecar differs between runs");
    }
    List<String> firstIds = first.chunks().stream().map(Chunk::id).toList();
    List<String> secondIds = second.chunks().stream().map(Chunk::id).toList();
    if (!firstIds.equals(secondIds) || !first.chunks().equals(second.chunks())) {
      throw new DeterminismViolationException(articleId, "chunks differ between runs");
    }
    log.debug("Article {} verified deterministic", articleId);
  }

  private void recordOutcome(IngestionStatus status) {
    meterRegistry
        .counter("wiki.articles.ingested", "status", status.name().toLowerCase(Locale.ROOT))
        .increment();
  }
}
