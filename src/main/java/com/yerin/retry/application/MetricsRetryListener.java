package com.yerin.retry.application;

import com.yerin.retry.domain.RetryListener;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MetricsRetryListener implements RetryListener {

    private final RetryMetrics metrics;

    @Override
    public void onSuccess(int attempt) {
        metrics.incSucceeded();
    }

    @Override
    public void onRetry(int attempt, long delayMillis, Throwable failure) {
        metrics.incRetried();
        metrics.recordDelay(delayMillis);
    }

    @Override
    public void onGiveUp(int attempt, Throwable failure) {
        metrics.incGaveUp();
    }
}
