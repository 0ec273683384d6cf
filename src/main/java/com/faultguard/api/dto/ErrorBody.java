package com.faultguard.api.dto;

import java.time.Clock;
import java.time.Instant;

/**
 * Error response body for every non-2xx answer: code, human-readable message, ISO 8601 timestamp.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message, Clock clock) {
        return new ErrorBody(error, message, clock.instant());
    }
}
