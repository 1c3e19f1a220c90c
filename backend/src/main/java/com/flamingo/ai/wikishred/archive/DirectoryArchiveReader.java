package com.flamingo.ai.wikishred.archive;

import com.flamingo.ai.wikishred.config.WikiConfig;
import com.flamingo.ai.wikishred.exception.ArticleProcessingException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

/**
 * {@link ArchiveReader} over a directory of already extracted article files.
 *
 * <p>Each article is one {@code <articleId>.html} (or {@code .htm}) file. The title is taken from
 * the document {@code <title>}, falling back to the ID. The directory is only read; a missing
 * directory is treated as an empty archive.
 */
@Service
@Slf4j
public class DirectoryArchiveReader implements ArchiveReader {

  private static final List<String> EXTENSIONS = List.of(".html", ".htm");

  private final Path directory;

  public DirectoryArchiveReader(WikiConfig wikiConfig) {
    this.directory =
        Paths.get(wikiConfig.getArchive().getHtmlDirectory()).toAbsolutePath().normalize();
  }

  @Override
  public Optional<Article> findArticle(String articleId) {
    Optional<Path> file = resolve(articleId);
    if (file.isEmpty()) {
      return Optional.empty();
    }
    try {
      String raw = Files.readString(file.get(), StandardCharsets.UTF_8);
      String title = Jsoup.parse(raw).title().strip();
      if (title.isEmpty()) {
        title = articleId.replace('_', ' ');
      }
      log.debug("Read article {} from {}", articleId, file.get());
      return Optional.of(new Article(articleId, title, raw));
    } catch (IOException e) {
      log.error("Failed to read article {}: {}", articleId, e.getMessage());
      throw new ArticleProcessingException(articleId, "Failed to read article file", e);
    }
  }

  @Override
  public List<String> listArticleIds() {
    if (!Files.isDirectory(directory)) {
      log.warn("Archive directory {} does not exist", directory);
      return List.of();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .map(path -> path.getFileName().toString())
          .filter(name -> EXTENSIONS.stream().anyMatch(name::endsWith))
          .map(name -> name.substring(0, name.lastIndexOf('.')))
          .distinct()
          .sorted()
          .toList();
    } catch (IOException e) {
      log.error("Failed to list archive directory {}: {}", directory, e.getMessage());
      throw new ArticleProcessingException(null, "Failed to list archive directory", e);
    }
  }

  /** Article file for an ID; IDs that would leave the archive directory never resolve. */
  private Optional<Path> resolve(String articleId) {
    if (articleId == null || articleId.isBlank()) {
      return Optional.empty();
    }
    for (String extension : EXTENSIONS) {
      Path candidate = directory.resolve(articleId + extension).normalize();
      if (candidate.getParent() == null || !candidate.getParent().equals(directory)) {
        return Optional.empty();
      }
      if (Files.isRegularFile(candidate)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
