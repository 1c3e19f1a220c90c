package com.flamingo.ai.wikishred.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.flamingo.ai.wikishred.config.WikiConfig;
import com.flamingo.ai.wikishred.exception.ArticleStorageException;
import com.flamingo.ai.wikishred.service.chunking.model.Chunk;
import com.flamingo.ai.wikishred.service.shred.model.ShreddedDocument;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link ArticleStore} keeping one directory per article under {@code wiki.storage.base-path}.
 *
 * <p>Files per article: {@code content.md}, {@code abstract.md}, {@code toc.json}, {@code
 * sidecar.json}, {@code chunks.json} and {@code article.json} (title, images, warnings). They are
 * written to a staging directory that is then moved over the previous version, so readers never
 * see a half-written article.
 */
@Service
@Slf4j
public class FileSystemArticleStore implements ArticleStore {

  static final String CONTENT_FILE = "content.md";
  static final String ABSTRACT_FILE = "abstract.md";
  static final String TOC_FILE = "toc.json";
  static final String SIDECAR_FILE = "sidecar.json";
  static final String CHUNKS_FILE = "chunks.json";
  static final String METADATA_FILE = "article.json";

  /** Saves of one article are serialized on a lock picked by hashing its ID. */
  static final int LOCK_STRIPES = 64;

  private final Path basePath;
  private final ObjectWriter writer;
  private final Object[] locks = new Object[LOCK_STRIPES];

  public FileSystemArticleStore(WikiConfig wikiConfig, ObjectMapper objectMapper) {
    this.basePath = Paths.get(wikiConfig.getStorage().getBasePath()).toAbsolutePath().normalize();
    this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    for (int i = 0; i < LOCK_STRIPES; i++) {
      locks[i] = new Object();
    }
  }

  @Override
  public void save(ShreddedDocument document, List<Chunk> chunks) {
    String articleId = document.articleId();
    synchronized (lockFor(articleId)) {
      Path target = articleDirectory(articleId);
      Path staging = basePath.resolve("." + target.getFileName() + ".staging-" + UUID.randomUUID());
      try {
        Files.createDirectories(staging);
        writeFiles(staging, document, chunks);
        replace(staging, target);
        log.info(
            "Stored article {} ({} chunks, {} sidecar entries) in {}",
            articleId,
            chunks.size(),
            document.sidecar().size(),
            target);
      } catch (IOException e) {
        deleteQuietly(staging);
        log.error("Failed to store article {}: {}", articleId, e.getMessage());
        throw new ArticleStorageException(articleId, "Failed to store article " + articleId, e);
      }
    }
  }

  Object lockFor(String articleId) {
    return locks[Math.floorMod(articleId.hashCode(), LOCK_STRIPES)];
  }

  /** Directory of an article; the ID is URL-encoded so any ID maps to one safe file name. */
  Path articleDirectory(String articleId) {
    return basePath.resolve(URLEncoder.encode(articleId, StandardCharsets.UTF_8));
  }

  private void writeFiles(Path directory, ShreddedDocument document, List<Chunk> chunks)
      throws IOException {
    Files.writeString(directory.resolve(CONTENT_FILE), document.markdown(), StandardCharsets.UTF_8);
    Files.writeString(
        directory.resolve(ABSTRACT_FILE), document.abstractText(), StandardCharsets.UTF_8);
    writer.writeValue(directory.resolve(TOC_FILE).toFile(), document.toc());
    writer.writeValue(directory.resolve(SIDECAR_FILE).toFile(), document.sidecar());
    writer.writeValue(directory.resolve(CHUNKS_FILE).toFile(), chunks);

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("articleId", document.articleId());
    metadata.put("title", document.title());
    metadata.put("tokenIds", document.tokenIds());
    metadata.put("images", document.images());
    metadata.put("warnings", document.warnings());
    metadata.put("chunkCount", chunks.size());
    writer.writeValue(directory.resolve(METADATA_FILE).toFile(), metadata);
  }

  /** Swaps the staging directory into place, keeping the old version until the swap succeeded. */
  private void replace(Path staging, Path target) throws IOException {
    Path backup = null;
    if (Files.exists(target)) {
      backup = basePath.resolve("." + target.getFileName() + ".old-" + UUID.randomUUID());
      Files.move(target, backup, StandardCopyOption.ATOMIC_MOVE);
    }
    try {
      Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      if (backup != null) {
        Files.move(backup, target, StandardCopyOption.ATOMIC_MOVE);
      }
      throw e;
    }
    if (backup != null) {
      deleteQuietly(backup);
    }
  }

  private void deleteQuietly(Path directory) {
    if (!Files.exists(directory)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(directory)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      log.warn("Could not remove leftover directory {}: {}", directory, e.getMessage());
    }
  }
}
