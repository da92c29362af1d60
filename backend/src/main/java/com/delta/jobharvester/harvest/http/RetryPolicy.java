package com.delta.jobharvester.harvest.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retry with exponential backoff. A wait hint from the failure (e.g. Retry-After) replaces the
 * computed delay for that attempt and is honored up to {@code maxHintDelay}; otherwise the delay
 * doubles from {@code baseDelay} up to {@code maxDelay}.
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private static final Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration maxHintDelay;
    private final Predicate<Throwable> retriable;
    private final Function<Throwable, Optional<Duration>> waitHint;
    private final Sleeper sleeper;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = Math.max(1, builder.maxAttempts);
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay.compareTo(builder.baseDelay) < 0 ? builder.baseDelay : builder.maxDelay;
        this.maxHintDelay = builder.maxHintDelay.compareTo(this.maxDelay) < 0 ? this.maxDelay : builder.maxHintDelay;
        this.retriable = builder.retriable;
        this.waitHint = builder.waitHint;
        this.sleeper = builder.sleeper;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryPolicy forExternalCalls(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        return builder()
            .maxAttempts(maxAttempts)
            .baseDelay(baseDelay)
            .maxDelay(maxDelay)
            .retryOn(error -> error instanceof ExternalServiceException external && external.isRetriable())
            .waitHint(error -> error instanceof ExternalServiceException external ? external.retryAfter() : Optional.empty())
            .build();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public RetryPolicy withSleeper(Sleeper replacement) {
        return toBuilder().sleeper(replacement).build();
    }

    public <T> T execute(String operation, Supplier<T> call) {
        Duration backoff = baseDelay;
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                last = e;
                if (!retriable.test(e) || attempt >= maxAttempts) {
                    throw e;
                }
                Optional<Duration> hint = waitHint.apply(e);
                Duration wait = hint.orElse(backoff);
                if (hint.isEmpty()) {
                    backoff = doubled(backoff);
                }
                log.debug("{} attempt {}/{} failed ({}); retrying in {} ms",
                    operation, attempt, maxAttempts, e.getMessage(), wait.toMillis());
                if (!pause(wait, hint.isPresent() ? maxHintDelay : maxDelay)) {
                    throw e;
                }
            }
        }
        throw last;
    }

    Duration delayAfter(int failedAttempts) {
        Duration delay = baseDelay;
        for (int i = 1; i < failedAttempts; i++) {
            delay = doubled(delay);
        }
        return delay;
    }

    private Duration doubled(Duration current) {
        Duration next = current.multipliedBy(2);
        return next.compareTo(maxDelay) > 0 ? maxDelay : next;
    }

    private boolean pause(Duration wait, Duration ceiling) {
        if (wait.isZero() || wait.isNegative()) {
            return true;
        }
        Duration capped = wait.compareTo(ceiling) > 0 && ceiling.compareTo(Duration.ZERO) > 0 ? ceiling : wait;
        try {
            sleeper.sleep(capped);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Builder toBuilder() {
        return new Builder()
            .maxAttempts(maxAttempts)
            .baseDelay(baseDelay)
            .maxDelay(maxDelay)
            .maxHintDelay(maxHintDelay)
            .retryOn(retriable)
            .waitHint(waitHint)
            .sleeper(sleeper);
    }

    public static final class Builder {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private Duration maxHintDelay = Duration.ofMinutes(5);
        private Predicate<Throwable> retriable = error -> false;
        private Function<Throwable, Optional<Duration>> waitHint = error -> Optional.empty();
        private Sleeper sleeper = THREAD_SLEEPER;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
            return this;
        }

        public Builder maxHintDelay(Duration maxHintDelay) {
            this.maxHintDelay = maxHintDelay == null || maxHintDelay.isNegative() ? Duration.ZERO : maxHintDelay;
            return this;
        }

        public Builder retryOn(Predicate<Throwable> retriable) {
            this.retriable = retriable;
            return this;
        }

        public Builder waitHint(Function<Throwable, Optional<Duration>> waitHint) {
            this.waitHint = waitHint;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
