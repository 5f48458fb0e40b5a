package com.yerin.retry.infra;

import java.util.concurrent.ThreadLocalRandom;

public final class ThreadLocalRandomSource implements RandomSource {
    @Override
    public long nextLong(long min, long max) {
        return InclusiveRange.pick(ThreadLocalRandom.current(), min, max);
    }
}
