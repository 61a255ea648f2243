package com.scholary.streamvault.api;

/** Plain acknowledgement. */
public record MessageResponse(String message) {}
