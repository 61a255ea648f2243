package com.scholary.streamvault.api;

import jakarta.validation.constraints.NotNull;

/** Request and response body for the concurrent download limit. */
public record MaxDownloadsRequest(@NotNull Integer maxDownloads) {}
