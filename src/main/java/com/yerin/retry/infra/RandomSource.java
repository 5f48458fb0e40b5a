package com.yerin.retry.infra;

/**
 * Uniform random integers in an inclusive range.
 */
@FunctionalInterface
public interface RandomSource {
    /**
     * @return a value in {@code [min, max]}; {@code min} itself when both bounds are equal
     */
    long nextLong(long min, long max);
}
