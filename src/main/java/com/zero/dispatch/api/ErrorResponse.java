package com.zero.dispatch.api;

import java.time.Instant;

/**
 * JSON body returned for every failed request.
 *
 * @param error short machine-friendly error kind, e.g. "queue_full"
 */
public record ErrorResponse(Instant timestamp, String error, String message) {

    static ErrorResponse of(String error, String message) {
        return new ErrorResponse(Instant.now(), error, message);
    }
}
