package com.scholary.streamvault.api;

import jakarta.validation.constraints.NotBlank;

/** Request to (re)schedule a job. {@code fireAt} is an ISO-8601 instant. */
public record ScheduleRequest(@NotBlank String fireAt) {}
