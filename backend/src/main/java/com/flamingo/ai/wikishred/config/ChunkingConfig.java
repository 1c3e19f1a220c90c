package com.flamingo.ai.wikishred.config;

import com.flamingo.ai.wikishred.service.chunking.ChunkingPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes the validated chunking policy. An inconsistent policy stops the application start. */
@Configuration
public class ChunkingConfig {

  @Bean
  public ChunkingPolicy chunkingPolicy(WikiConfig wikiConfig) {
    return ChunkingPolicy.from(wikiConfig.getChunking());
  }
}
