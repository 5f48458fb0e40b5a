package com.yerin.retry.domain;

import java.util.List;

/**
 * Callbacks from the attempt loop. Exceptions thrown here reach the caller of
 * {@link RetryPolicy#run(int, RetryableOperation)}.
 */
public interface RetryListener {

    RetryListener NOOP = new RetryListener() {};

    default void onSuccess(int attempt) {}

    /** Called before sleeping {@code delayMillis} ahead of attempt {@code attempt + 1}. */
    default void onRetry(int attempt, long delayMillis, Throwable failure) {}

    /** Called right before {@code failure} is rethrown to the caller. */
    default void onGiveUp(int attempt, Throwable failure) {}

    static RetryListener composite(List<? extends RetryListener> listeners) {
        return new Composite(List.copyOf(listeners));
    }

    record Composite(List<RetryListener> listeners) implements RetryListener {
        @Override
        public void onSuccess(int attempt) {
            listeners.forEach(l -> l.onSuccess(attempt));
        }

        @Override
        public void onRetry(int attempt, long delayMillis, Throwable failure) {
            listeners.forEach(l -> l.onRetry(attempt, delayMillis, failure));
        }

        @Override
        public void onGiveUp(int attempt, Throwable failure) {
            listeners.forEach(l -> l.onGiveUp(attempt, failure));
        }
    }
}
