package com.yerin.retry.config;

import com.yerin.retry.application.RetryMetrics;
import com.yerin.retry.domain.JitterStrategy;
import com.yerin.retry.domain.RetryListener;
import com.yerin.retry.domain.RetryPolicy;
import com.yerin.retry.global.exception.RetryException;
import com.yerin.retry.infra.RandomSource;
import com.yerin.retry.infra.RecordingSleeper;
import com.yerin.retry.infra.SeededRandomSource;
import com.yerin.retry.infra.Sleeper;
import com.yerin.retry.infra.ThreadLocalRandomSource;
import com.yerin.retry.infra.ThreadSleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.io.FileNotFoundException;
import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RetryAutoConfiguration 빈 구성 테스트")
public class RetryAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RetryAutoConfiguration.class));

    @Test
    @DisplayName("프로퍼티가 없으면 기본값으로 정책 생성")
    void defaults() {
        runner.run(ctx -> {
            RetryPolicy policy = ctx.getBean(RetryPolicy.class);
            assertThat(policy.getBaseDelayMillis()).isEqualTo(5L);
            assertThat(policy.getMaxDelayMillis()).isEqualTo(1_000L);
            assertThat(policy.getStepMultiplier()).isEqualTo(2.0);
            assertThat(policy.getJitterStrategy()).isEqualTo(JitterStrategy.FULL);
            assertThat(policy.getClassifier().isRetryable(new IllegalStateException())).isTrue();
            assertThat(policy.getClassifier().isRetryable(new IOException())).isFalse();
            assertThat(ctx.getBean(Sleeper.class)).isInstanceOf(ThreadSleeper.class);
            assertThat(ctx.getBean(RandomSource.class)).isInstanceOf(ThreadLocalRandomSource.class);
            assertThat(ctx).doesNotHaveBean(RetryMetrics.class);
        });
    }

    @Test
    @DisplayName("retry.* 프로퍼티 반영")
    void properties_bind() {
        runner.withPropertyValues(
                        "retry.baseDelayMillis=4",
                        "retry.maxDelayMillis=10",
                        "retry.stepMultiplier=3",
                        "retry.jitter=none",
                        "retry.retryOn=java.io.IOException, java.lang.IllegalStateException",
                        "retry.seed=42")
                .run(ctx -> {
                    RetryPolicy policy = ctx.getBean(RetryPolicy.class);
                    assertThat(policy.getBaseDelayMillis()).isEqualTo(4L);
                    assertThat(policy.getMaxDelayMillis()).isEqualTo(10L);
                    assertThat(policy.getStepMultiplier()).isEqualTo(3.0);
                    assertThat(policy.getJitterStrategy()).isEqualTo(JitterStrategy.NONE);
                    assertThat(policy.getClassifier().isRetryable(new FileNotFoundException())).isTrue();
                    assertThat(policy.getClassifier().isRetryable(new IllegalArgumentException())).isFalse();
                    assertThat(ctx.getBean(RandomSource.class)).isInstanceOf(SeededRandomSource.class);
                    assertThat(((SeededRandomSource) ctx.getBean(RandomSource.class)).getSeed()).isEqualTo(42L);
                });
    }

    @Test
    @DisplayName("사용자 빈이 있으면 그것을 사용")
    void user_beans_win() {
        runner.withPropertyValues("retry.jitter=NONE")
                .withBean(Sleeper.class, RecordingSleeper::new)
                .run(ctx -> {
                    RetryPolicy policy = ctx.getBean(RetryPolicy.class);
                    assertThat(policy.getSleeper()).isInstanceOf(RecordingSleeper.class);

                    policy.run(3, attempt -> {
                        if (attempt < 3) throw new IllegalStateException("x");
                        return attempt;
                    });
                    assertThat(((RecordingSleeper) ctx.getBean(Sleeper.class)).getHistory()).containsExactly(5L, 10L);
                });
    }

    @Test
    @DisplayName("MeterRegistry가 있으면 메트릭 리스너 연결")
    void metrics_wired_when_registry_present() {
        runner.withPropertyValues("retry.name=orders")
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withBean(Sleeper.class, RecordingSleeper::new)
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(RetryMetrics.class);
                    assertThat(ctx.getBean(RetryListener.class)).isInstanceOf(RetryListener.Composite.class);

                    ctx.getBean(RetryPolicy.class).run(2, attempt -> {
                        if (attempt == 1) throw new IllegalStateException("x");
                        return "ok";
                    });

                    MeterRegistry registry = ctx.getBean(MeterRegistry.class);
                    assertThat(registry.find("retry_attempts_retried_total").tag("policy", "orders").counter().count())
                            .isEqualTo(1.0);
                    assertThat(registry.find("retry_attempts_succeeded_total").tag("policy", "orders").counter().count())
                            .isEqualTo(1.0);
                });
    }

    @Test
    @DisplayName("잘못된 retryOn/jitter/seed는 컨텍스트 시작 실패")
    void invalid_properties_fail_startup() {
        runner.withPropertyValues("retry.retryOn=com.example.NoSuchException")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure().rootCause().isInstanceOf(ClassNotFoundException.class));
        runner.withPropertyValues("retry.retryOn=java.lang.String")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure().rootCause().isInstanceOf(RetryException.class)
                        .hasMessageContaining("not a Throwable"));
        runner.withPropertyValues("retry.jitter=sometimes")
                .run(ctx -> assertThat(ctx).hasFailed());
        runner.withPropertyValues("retry.seed=abc")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Test
    @DisplayName("음수 지연은 INVALID_CONFIGURATION")
    void negative_delay_fails_startup() {
        runner.withPropertyValues("retry.baseDelayMillis=-1")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure().rootCause().isInstanceOf(RetryException.class)
                        .hasMessageContaining("baseDelayMillis"));
    }
}
