package com.yerin.retry.application;

import com.yerin.retry.domain.RetryListener;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingRetryListener implements RetryListener {

    private final String name;

    public LoggingRetryListener(String name) {
        this.name = name;
    }

    @Override
    public void onSuccess(int attempt) {
        if (attempt > 1) {
            log.info("[Retry] {} succeeded on attempt={}", name, attempt);
        }
    }

    @Override
    public void onRetry(int attempt, long delayMillis, Throwable failure) {
        log.info("[Retry] {} attempt={} failed, retry after {} ms, err={}", name, attempt, delayMillis, failure.toString());
    }

    @Override
    public void onGiveUp(int attempt, Throwable failure) {
        log.warn("[Retry] {} gave up on attempt={}, err={}", name, attempt, failure.toString());
    }
}
