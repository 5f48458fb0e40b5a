package com.yerin.retry.domain;

@FunctionalInterface
public interface RetryableOperation<T> {
    /**
     * @param attempt 1-based attempt number
     */
    T call(int attempt) throws Exception;
}
