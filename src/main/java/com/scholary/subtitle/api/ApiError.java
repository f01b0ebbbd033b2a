package com.scholary.subtitle.api;

import java.time.Instant;

/** Error body returned by the REST API. */
public record ApiError(String errorCode, String message, Instant timestamp) {}
