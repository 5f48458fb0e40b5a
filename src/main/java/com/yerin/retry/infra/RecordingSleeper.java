package com.yerin.retry.infra;

import java.util.ArrayList;
import java.util.List;

/**
 * Never blocks. Every requested duration, zero included, is appended to the history.
 */
public class RecordingSleeper implements Sleeper {
    private final List<Long> history = new ArrayList<>();

    @Override
    public synchronized void sleep(long millis) {
        history.add(millis);
    }

    public synchronized List<Long> getHistory() {
        return List.copyOf(history);
    }

    public synchronized long totalMillis() {
        return history.stream().mapToLong(Long::longValue).sum();
    }

    public synchronized void clearHistory() {
        history.clear();
    }
}
