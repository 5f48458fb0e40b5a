package com.yerin.retry.domain;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides whether a failed attempt may be retried.
 * Either a set of exception kinds (subtypes match too) or an arbitrary predicate.
 */
@FunctionalInterface
public interface RetryClassifier {

    boolean isRetryable(Throwable failure);

    @SafeVarargs
    static RetryClassifier ofKinds(Class<? extends Throwable>... kinds) {
        return new ByKinds(List.of(kinds));
    }

    static RetryClassifier ofKinds(Collection<Class<? extends Throwable>> kinds) {
        return new ByKinds(List.copyOf(kinds));
    }

    static RetryClassifier matching(Predicate<? super Throwable> predicate) {
        return new ByPredicate(predicate);
    }

    record ByKinds(List<Class<? extends Throwable>> kinds) implements RetryClassifier {
        public ByKinds {
            kinds = List.copyOf(kinds);
        }

        @Override
        public boolean isRetryable(Throwable failure) {
            for (Class<? extends Throwable> kind : kinds) {
                if (kind.isInstance(failure)) return true;
            }
            return false;
        }
    }

    // predicate 예외는 그대로 전파된다
    record ByPredicate(Predicate<? super Throwable> predicate) implements RetryClassifier {
        public ByPredicate {
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public boolean isRetryable(Throwable failure) {
            return predicate.test(failure);
        }
    }
}
