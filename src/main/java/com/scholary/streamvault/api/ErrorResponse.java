package com.scholary.streamvault.api;

import com.scholary.streamvault.error.ErrorKind;

/** Error body returned for every failed request. */
public record ErrorResponse(ErrorKind kind, String message) {}
