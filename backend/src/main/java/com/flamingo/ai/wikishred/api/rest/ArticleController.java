package com.flamingo.ai.wikishred.api.rest;

import com.flamingo.ai.wikishred.api.dto.request.BatchIngestRequest;
import com.flamingo.ai.wikishred.service.chunking.model.Chunk;
import com.flamingo.ai.wikishred.service.ingest.ArticleIngestionService;
import com.flamingo.ai.wikishred.service.ingest.BatchReport;
import com.flamingo.ai.wikishred.service.ingest.IngestionResult;
import com.flamingo.ai.wikishred.service.shred.model.ShreddedDocument;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for shredding, chunking and ingesting archive articles. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ArticleController {

  private final ArticleIngestionService ingestionService;

  /** Shreds an article and returns the result without storing it. */
  @GetMapping("/articles/{articleId}/shred")
  public ResponseEntity<ShreddedDocument> shred(@PathVariable String articleId) {
    return ResponseEntity.ok(ingestionService.shred(articleId));
  }

  /** Shreds and chunks an article and returns the chunks without storing them. */
  @GetMapping("/articles/{articleId}/chunks")
  public ResponseEntity<List<Chunk>> chunks(@PathVariable String articleId) {
    return ResponseEntity.ok(ingestionService.chunk(articleId));
  }

  /** Ingests one article. */
  @PostMapping("/articles/{articleId}/ingest")
  public ResponseEntity<IngestionResult> ingest(@PathVariable String articleId) {
    return ResponseEntity.ok(ingestionService.ingest(articleId));
  }

  /** Ingests the listed articles, or the whole archive when the list is empty. */
  @PostMapping("/ingest")
  public ResponseEntity<BatchReport> ingestBatch(
      @Valid @RequestBody(required = false) BatchIngestRequest request) {
    List<String> ids = request == null ? null : request.getArticleIds();
    if (ids == null || ids.isEmpty()) {
      return ResponseEntity.ok(ingestionService.ingestAll());
    }
    return ResponseEntity.ok(ingestionService.ingestBatch(ids));
  }
}
