package com.yerin.retry.infra;

import com.yerin.retry.global.exception.RetryException;
import com.yerin.retry.global.exception.code.RetryErrorCode;

import java.util.random.RandomGenerator;

final class InclusiveRange {
    private InclusiveRange() {}

    static long pick(RandomGenerator generator, long min, long max) {
        if (min > max) {
            throw new RetryException(RetryErrorCode.INVALID_RANDOM_RANGE
                    .withDetail("Random range min must not exceed max: min=" + min + ", max=" + max));
        }
        if (min == max) return min;
        // bound is exclusive on RandomGenerator, shift when max+1 would overflow
        if (max < Long.MAX_VALUE) return generator.nextLong(min, max + 1);
        if (min > Long.MIN_VALUE) return generator.nextLong(min - 1, max) + 1;
        return generator.nextLong();
    }
}
