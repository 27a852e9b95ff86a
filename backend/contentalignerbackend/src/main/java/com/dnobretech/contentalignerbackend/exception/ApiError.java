package com.dnobretech.contentalignerbackend.exception;

import java.time.Instant;

public record ApiError(
        int status,
        String error,
        String category,
        String message,
        String suggestedAction,
        String path,
        Instant timestamp
) {}
