package com.flamingo.ai.wikishred.archive;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.wikishred.config.WikiConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DirectoryArchiveReader Tests")
class DirectoryArchiveReaderTest {

  @TempDir Path tempDir;

  private Path archive;
  private DirectoryArchiveReader reader;

  @BeforeEach
  void setUp() throws IOException {
    archive = Files.createDirectory(tempDir.resolve("archive"));
    reader = new DirectoryArchiveReader(configFor(archive));
  }

  @Test
  @DisplayName("should read article markup and title")
  void shouldReadArticle() throws IOException {
    String html = "<html><head><title>Oslo city</title></head><body><p>x</p></body></html>";
    Files.writeString(archive.resolve("Oslo.html"), html);

    Optional<Article> article = reader.findArticle("Oslo");

    assertThat(article).isPresent();
    assertThat(article.get().id()).isEqualTo("Oslo");
    assertThat(article.get().title()).isEqualTo("Oslo city");
    assertThat(article.get().rawMarkup()).isEqualTo(html);
  }

  @Test
  @DisplayName("should derive the title from the ID when the document has none")
  void shouldFallBackToIdTitle_whenTitleMissing() throws IOException {
    Files.writeString(archive.resolve("New_York.htm"), "<p>Big apple</p>");

    assertThat(reader.findArticle("New_York")).map(Article::title).contains("New York");
  }

  @Test
  @DisplayName("should return empty for unknown and escaping IDs")
  void shouldReturnEmpty_whenIdUnknownOrEscaping() throws IOException {
    Files.writeString(tempDir.resolve("secret.html"), "<p>outside</p>");

    assertThat(reader.findArticle("Missing")).isEmpty();
    assertThat(reader.findArticle("../secret")).isEmpty();
    assertThat(reader.findArticle(" ")).isEmpty();
  }

  @Test
  @DisplayName("should list article IDs in sorted order")
  void shouldListArticleIds() throws IOException {
    Files.writeString(archive.resolve("Zebra.html"), "<p>z</p>");
    Files.writeString(archive.resolve("Apple.htm"), "<p>a</p>");
    Files.writeString(archive.resolve("notes.txt"), "ignored");

    assertThat(reader.listArticleIds()).containsExactly("Apple", "Zebra");
  }

  @Test
  @DisplayName("should treat a missing directory as an empty archive")
  void shouldReturnNoIds_whenDirectoryMissing() {
    DirectoryArchiveReader missing = new DirectoryArchiveReader(configFor(tempDir.resolve("nope")));

    assertThat(missing.listArticleIds()).isEmpty();
    assertThat(missing.findArticle("Oslo")).isEmpty();
  }

  private static WikiConfig configFor(Path directory) {
    WikiConfig config = new WikiConfig();
    config.getArchive().setHtmlDirectory(directory.toString());
    return config;
  }
}
