package com.yerin.retry.config;

import com.yerin.retry.application.LoggingRetryListener;
import com.yerin.retry.application.MetricsRetryListener;
import com.yerin.retry.application.RetryMetrics;
import com.yerin.retry.domain.JitterStrategy;
import com.yerin.retry.domain.RetryClassifier;
import com.yerin.retry.domain.RetryListener;
import com.yerin.retry.domain.RetryPolicy;
import com.yerin.retry.global.exception.RetryException;
import com.yerin.retry.global.exception.code.RetryErrorCode;
import com.yerin.retry.infra.RandomSource;
import com.yerin.retry.infra.SeededRandomSource;
import com.yerin.retry.infra.Sleeper;
import com.yerin.retry.infra.ThreadLocalRandomSource;
import com.yerin.retry.infra.ThreadSleeper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
public class RetryAutoConfiguration {

    @Value("${retry.name:default}")
    private String name;

    @Value("${retry.baseDelayMillis:5}")
    private long baseDelayMillis;

    @Value("${retry.maxDelayMillis:1000}")
    private long maxDelayMillis;

    @Value("${retry.stepMultiplier:2.0}")
    private double stepMultiplier;

    @Value("${retry.jitter:FULL}")
    private String jitter;

    @Value("${retry.retryOn:java.lang.RuntimeException}")
    private String retryOn;

    @Value("${retry.seed:}")
    private String seed;

    @Bean
    @ConditionalOnMissingBean
    public Sleeper retrySleeper() {
        return new ThreadSleeper();
    }

    @Bean
    @ConditionalOnMissingBean
    public RandomSource retryRandomSource() {
        if (seed == null || seed.isBlank()) {
            return new ThreadLocalRandomSource();
        }
        try {
            return new SeededRandomSource(Long.parseLong(seed.trim()));
        } catch (NumberFormatException e) {
            throw new RetryException(RetryErrorCode.INVALID_CONFIGURATION.withDetail("retry.seed is not a number: " + seed), e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    public RetryMetrics retryMetrics(MeterRegistry registry) {
        return new RetryMetrics(registry, name);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryListener retryListener(ObjectProvider<RetryMetrics> metrics) {
        List<RetryListener> listeners = new ArrayList<>();
        listeners.add(new LoggingRetryListener(name));
        metrics.ifAvailable(m -> listeners.add(new MetricsRetryListener(m)));
        return RetryListener.composite(listeners);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(Sleeper sleeper, RandomSource randomSource, RetryListener listener) {
        RetryPolicy policy = RetryPolicy.builder()
                .classifier(parseRetryOn(retryOn))
                .baseDelayMillis(baseDelayMillis)
                .maxDelayMillis(maxDelayMillis)
                .stepMultiplier(stepMultiplier)
                .jitterStrategy(parseJitter(jitter))
                .randomSource(randomSource)
                .sleeper(sleeper)
                .listener(listener)
                .build();
        log.info("[Retry] policy={} base={}ms max={}ms multiplier={} jitter={} retryOn={}",
                name, baseDelayMillis, maxDelayMillis, stepMultiplier, policy.getJitterStrategy(), retryOn);
        return policy;
    }

    static JitterStrategy parseJitter(String value) {
        try {
            return JitterStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RetryException(RetryErrorCode.INVALID_CONFIGURATION.withDetail("unknown retry.jitter: " + value), e);
        }
    }

    static RetryClassifier parseRetryOn(String value) {
        List<Class<? extends Throwable>> kinds = new ArrayList<>();
        for (String raw : value.split(",")) {
            String className = raw.trim();
            if (className.isEmpty()) continue;

            Class<?> type;
            try {
                type = Class.forName(className, false, RetryAutoConfiguration.class.getClassLoader());
            } catch (ClassNotFoundException e) {
                throw new RetryException(RetryErrorCode.INVALID_CONFIGURATION.withDetail("retry.retryOn class not found: " + className), e);
            }
            if (!Throwable.class.isAssignableFrom(type)) {
                throw new RetryException(RetryErrorCode.INVALID_CONFIGURATION.withDetail("retry.retryOn is not a Throwable: " + className));
            }
            kinds.add(type.asSubclass(Throwable.class));
        }
        return RetryClassifier.ofKinds(kinds);
    }
}
