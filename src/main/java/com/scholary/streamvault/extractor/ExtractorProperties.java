package com.scholary.streamvault.extractor;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the yt-dlp extractor.
 *
 * <p>These control where the executable lives, where files land and how long the tool may run
 * before it is killed.
 */
@ConfigurationProperties(prefix = "extractor")
@Validated
public record ExtractorProperties(
    @NotBlank String binaryPath,
    @NotBlank String downloadDir,
    @Positive int probeTimeoutSeconds,
    @Positive int fetchTimeoutMinutes,
    @Positive int cancelGraceSeconds,
    @Positive int socketTimeoutSeconds,
    @Positive int playlistProbeLimit,
    @Positive int probeCacheTtlMinutes,
    @Positive int probeCacheMaxSize) {}
