package com.yerin.retry.domain;

import com.yerin.retry.infra.RandomSource;

/**
 * Turns a raw exponential delay into the delay actually slept.
 * Every variant is capped at {@code maxDelay}.
 */
public enum JitterStrategy {

    NONE {
        @Override
        public long apply(long rawDelay, long maxDelay, long baseDelay, long previousDelay, RandomSource random) {
            return clamp(rawDelay, maxDelay);
        }
    },

    /** Uniform over {@code [0, min(raw, max)]}. */
    FULL {
        @Override
        public long apply(long rawDelay, long maxDelay, long baseDelay, long previousDelay, RandomSource random) {
            return random.nextLong(0, clamp(rawDelay, maxDelay));
        }
    },

    /** Half fixed, half random. */
    EQUAL {
        @Override
        public long apply(long rawDelay, long maxDelay, long baseDelay, long previousDelay, RandomSource random) {
            long half = clamp(rawDelay, maxDelay) / 2;
            return half + random.nextLong(0, half);
        }
    },

    /**
     * Ignores the raw delay. Picks between the base delay and three times the previous
     * delay, whichever order they come in.
     */
    DECORRELATED {
        @Override
        public long apply(long rawDelay, long maxDelay, long baseDelay, long previousDelay, RandomSource random) {
            long tripled = previousDelay > Long.MAX_VALUE / 3 ? Long.MAX_VALUE : previousDelay * 3;
            long lo = Math.min(baseDelay, tripled);
            long hi = Math.max(baseDelay, tripled);
            return clamp(random.nextLong(lo, hi), maxDelay);
        }
    };

    public abstract long apply(long rawDelay, long maxDelay, long baseDelay, long previousDelay, RandomSource random);

    static long clamp(long delay, long maxDelay) {
        return Math.min(delay, maxDelay);
    }
}
