package com.yerin.retry.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RetryErrorCode implements ErrorCode {
    INVALID_MAX_ATTEMPTS("Max attempts must be at least 1.", "RETRY-001"),
    INVALID_CONFIGURATION("Retry policy configuration is invalid.", "RETRY-002"),
    INVALID_RANDOM_RANGE("Random range min must not exceed max.", "RETRY-003"),
    SLEEP_INTERRUPTED("Interrupted while waiting for the next attempt.", "RETRY-004");

    private final String message;
    private final String code;
}
