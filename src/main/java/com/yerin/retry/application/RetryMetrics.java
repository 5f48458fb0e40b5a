package com.yerin.retry.application;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

public class RetryMetrics {

    private final Counter succeeded;
    private final Counter retried;
    private final Counter gaveUp;
    private final DistributionSummary delay;

    public RetryMetrics(MeterRegistry registry, String name) {
        this.succeeded = Counter.builder("retry_attempts_succeeded_total")
                .description("operations that returned a result")
                .tag("policy", name).register(registry);
        this.retried   = Counter.builder("retry_attempts_retried_total")
                .description("failed attempts scheduled for another try")
                .tag("policy", name).register(registry);
        this.gaveUp    = Counter.builder("retry_attempts_gave_up_total")
                .description("failures rethrown to the caller")
                .tag("policy", name).register(registry);
        this.delay     = DistributionSummary.builder("retry_delay_millis")
                .description("backoff delay before the next attempt")
                .baseUnit("milliseconds")
                .tag("policy", name)
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);
    }

    public void incSucceeded() { succeeded.increment(); }
    public void incRetried()   { retried.increment(); }
    public void incGaveUp()    { gaveUp.increment(); }

    public void recordDelay(long millis) { delay.record(millis); }
}
