package com.yerin.retry.domain;

import com.yerin.retry.global.exception.RetryException;
import com.yerin.retry.global.exception.code.RetryErrorCode;
import com.yerin.retry.infra.RandomSource;
import com.yerin.retry.infra.Sleeper;
import com.yerin.retry.infra.ThreadLocalRandomSource;
import com.yerin.retry.infra.ThreadSleeper;
import lombok.Builder;
import lombok.Getter;

import java.util.function.Predicate;

/**
 * Exponential backoff around a fallible operation.
 * <p>
 * The operation is invoked until it returns, throws something the classifier rejects,
 * or {@code maxAttempts} is reached. The last failure is rethrown as is.
 * Delay before retry {@code n} (0-based) is {@code (long) (baseDelay * stepMultiplier^n)}
 * passed through the jitter strategy and capped at {@code maxDelay}.
 * <p>
 * Loop state lives in {@link #run}, so one instance can serve any number of callers.
 */
@Getter
public class RetryPolicy {

    public static final long DEFAULT_BASE_DELAY_MILLIS = 5L;
    public static final long DEFAULT_MAX_DELAY_MILLIS = 1_000L;
    public static final double DEFAULT_STEP_MULTIPLIER = 2.0;
    public static final JitterStrategy DEFAULT_JITTER = JitterStrategy.FULL;

    private final RetryClassifier classifier;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final double stepMultiplier;
    private final JitterStrategy jitterStrategy;
    private final RandomSource randomSource;
    private final Sleeper sleeper;
    private final RetryListener listener;

    @Builder
    private RetryPolicy(RetryClassifier classifier,
                        Long baseDelayMillis,
                        Long maxDelayMillis,
                        Double stepMultiplier,
                        JitterStrategy jitterStrategy,
                        RandomSource randomSource,
                        Sleeper sleeper,
                        RetryListener listener) {
        if (classifier == null) {
            throw invalid("classifier is required");
        }
        this.classifier = classifier;
        this.baseDelayMillis = baseDelayMillis != null ? baseDelayMillis : DEFAULT_BASE_DELAY_MILLIS;
        this.maxDelayMillis = maxDelayMillis != null ? maxDelayMillis : DEFAULT_MAX_DELAY_MILLIS;
        this.stepMultiplier = stepMultiplier != null ? stepMultiplier : DEFAULT_STEP_MULTIPLIER;
        this.jitterStrategy = jitterStrategy != null ? jitterStrategy : DEFAULT_JITTER;
        this.randomSource = randomSource != null ? randomSource : new ThreadLocalRandomSource();
        this.sleeper = sleeper != null ? sleeper : new ThreadSleeper();
        this.listener = listener != null ? listener : RetryListener.NOOP;

        if (this.baseDelayMillis < 0) throw invalid("baseDelayMillis must be non-negative: " + this.baseDelayMillis);
        if (this.maxDelayMillis < 0) throw invalid("maxDelayMillis must be non-negative: " + this.maxDelayMillis);
        if (!Double.isFinite(this.stepMultiplier) || this.stepMultiplier < 0) {
            throw invalid("stepMultiplier must be a finite non-negative number: " + this.stepMultiplier);
        }
    }

    @SafeVarargs
    public static RetryPolicyBuilder retryOn(Class<? extends Throwable>... kinds) {
        return builder().classifier(RetryClassifier.ofKinds(kinds));
    }

    public static RetryPolicyBuilder retryIf(Predicate<? super Throwable> predicate) {
        return builder().classifier(RetryClassifier.matching(predicate));
    }

    public <T> T run(int maxAttempts, RetryableOperation<T> operation) throws Exception {
        if (maxAttempts < 1) {
            throw new RetryException(RetryErrorCode.INVALID_MAX_ATTEMPTS);
        }

        long previousDelay = 0;
        int attempt = 1;
        while (true) {
            T result;
            try {
                result = operation.call(attempt);
            } catch (Throwable failure) {
                if (!canRetry(attempt, maxAttempts, failure)) {
                    listener.onGiveUp(attempt, failure);
                    throw failure;
                }
                long delay = calculateDelay(attempt - 1, previousDelay);
                listener.onRetry(attempt, delay, failure);
                backOff(delay, failure);
                attempt++;
                previousDelay = delay;
                continue;
            }
            listener.onSuccess(attempt);
            return result;
        }
    }

    /**
     * @param retryIndex    0 for the delay before the 2nd attempt, 1 before the 3rd, ...
     * @param previousDelay delay chosen for the prior retry, 0 if none; only decorrelated jitter reads it
     */
    public long calculateDelay(int retryIndex, long previousDelay) {
        // truncates toward zero, saturates at Long.MAX_VALUE
        long rawDelay = (long) (baseDelayMillis * Math.pow(stepMultiplier, retryIndex));
        return jitterStrategy.apply(rawDelay, maxDelayMillis, baseDelayMillis, previousDelay, randomSource);
    }

    private boolean canRetry(int attempt, int maxAttempts, Throwable failure) {
        if (attempt >= maxAttempts) {
            return false;
        }
        return classifier.isRetryable(failure);
    }

    private void backOff(long delay, Throwable lastFailure) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            RetryException interrupted = new RetryException(RetryErrorCode.SLEEP_INTERRUPTED, ie);
            interrupted.addSuppressed(lastFailure);
            throw interrupted;
        }
    }

    private static RetryException invalid(String detail) {
        return new RetryException(RetryErrorCode.INVALID_CONFIGURATION.withDetail(detail));
    }
}
