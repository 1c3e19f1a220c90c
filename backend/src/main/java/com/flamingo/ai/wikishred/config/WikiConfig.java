package com.flamingo.ai.wikishred.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the shredding and chunking pipeline. */
@Configuration
@ConfigurationProperties(prefix = "wiki")
@Getter
@Setter
public class WikiConfig {

  private Chunking chunking = new Chunking();
  private Shredding shredding = new Shredding();
  private Ingestion ingestion = new Ingestion();
  private Archive archive = new Archive();
  private Storage storage = new Storage();

  /**
   * Chunk size policy, in characters.
   *
   * <p>Must satisfy {@code overlapSize < targetChunkSize <= maxChunkSize} and {@code minChunkSize
   * <= targetChunkSize}.
   */
  @Getter
  @Setter
  public static class Chunking {
    /** Sections smaller than this are merged with their next sibling. */
    private int minChunkSize = 200;

    /** Size a split window grows to before it is closed. */
    private int targetChunkSize = 500;

    /** Hard upper bound; only a single oversized token may exceed it. */
    private int maxChunkSize = 800;

    /** Trailing characters of a split chunk repeated at the start of the next one. */
    private int overlapSize = 50;
  }

  @Getter
  @Setter
  public static class Shredding {
    /**
     * Tables with fewer grid rows than this are kept inline as Markdown pipe tables instead of
     * being moved to the sidecar. 0 moves every table.
     */
    private int inlineTableMaxRows = 0;

    /** Maximum length of the abstract taken from the text before the first header. */
    private int abstractMaxChars = 2000;

    /** Maximum length of the label shown inside a placeholder. */
    private int maxLabelLength = 60;

    /** Cap on parser errors recorded as warnings for one article. */
    private int maxTrackedParseErrors = 50;
  }

  @Getter
  @Setter
  public static class Ingestion {
    private int corePoolSize = 4;
    private int maxPoolSize = 8;
    private int queueCapacity = 1000;

    /** Process every article twice and fail if the two runs differ. */
    private boolean verifyDeterminism = false;
  }

  @Getter
  @Setter
  public static class Archive {
    /** Directory of pre-extracted article HTML files read by the directory archive reader. */
    private String htmlDirectory = "data/archive";
  }

  @Getter
  @Setter
  public static class Storage {
    /** Root directory for stored articles. */
    private String basePath = "data/articles";
  }
}
