package com.scholary.streamvault.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.streamvault.extractor.CachingExtractor;
import com.scholary.streamvault.extractor.Extractor;
import com.scholary.streamvault.extractor.ExtractorProperties;
import com.scholary.streamvault.extractor.YtDlpExtractor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the media extractor.
 *
 * <p>Wires the yt-dlp extractor behind a probe cache using properties from application.yml. The
 * container closes it on shutdown, which stops the yt-dlp watchdog.
 */
@Configuration
@EnableConfigurationProperties(ExtractorProperties.class)
public class ExtractorConfig {

  @Bean
  public Extractor extractor(ExtractorProperties properties, ObjectMapper objectMapper) {
    return new CachingExtractor(
        new YtDlpExtractor(properties, objectMapper),
        properties.probeCacheMaxSize(),
        properties.probeCacheTtlMinutes());
  }
}
