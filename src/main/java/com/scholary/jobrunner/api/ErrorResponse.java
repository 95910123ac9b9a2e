package com.scholary.jobrunner.api;

/**
 * Error body returned for rejected requests.
 *
 * @param error short machine-readable error code
 * @param message human-readable detail
 */
public record ErrorResponse(String error, String message) {}
