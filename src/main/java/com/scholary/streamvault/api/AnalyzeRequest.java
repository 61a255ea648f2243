package com.scholary.streamvault.api;

import jakarta.validation.constraints.NotBlank;

/** Request to probe a URL without downloading. */
public record AnalyzeRequest(@NotBlank String url) {}
