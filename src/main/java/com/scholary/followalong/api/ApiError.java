package com.scholary.followalong.api;

import java.time.Instant;

/** Error body returned by every endpoint. */
public record ApiError(int status, String error, String message, String path, Instant timestamp) {}
