package com.faultguard.retry;

import com.faultguard.common.ErrorClassifier;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Runs a fallible operation with exponential backoff until it succeeds, fails with a non-retryable
 * error, or the attempt/time budget is spent ({@link RetryExhaustedException}).
 * <p>
 * Stateless between runs: a single instance may be shared by concurrent callers, each run keeps its
 * own {@link RetryStatistics}. Blocking operations go through {@link #run}, reactive ones through
 * {@link #runAsync}; both make the same decisions and differ only in how they wait.
 */
public class RetryExecutor {

    private final String name;
    private final BackoffStrategy strategy;
    private final RetryListener listener;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Scheduler scheduler;

    public RetryExecutor(BackoffStrategy strategy) {
        this("operation", strategy, null, Clock.systemUTC(), Sleeper.THREAD, Schedulers.parallel());
    }

    public RetryExecutor(String name,
                         BackoffStrategy strategy,
                         RetryListener listener,
                         Clock clock,
                         Sleeper sleeper,
                         Scheduler scheduler) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        this.name = name != null && !name.isBlank() ? name : "operation";
        this.strategy = strategy;
        this.listener = listener;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
        this.scheduler = scheduler != null ? scheduler : Schedulers.parallel();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Invokes the operation, blocking the calling thread between attempts.
     *
     * @return the operation's result
     * @throws RetryExhaustedException if the attempt or time budget is spent
     * @throws Exception               the original error, unwrapped, when it is not retryable
     */
    public <T> T run(Callable<T> operation) throws Exception {
        return runWithOutcome(operation).value();
    }

    /**
     * Same as {@link #run} but also returns the statistics of the successful run.
     */
    public <T> RetryOutcome<T> runWithOutcome(Callable<T> operation) throws Exception {
        RetryExecution execution = new RetryExecution(name, strategy, listener, clock);
        for (int attempt = 0; ; attempt++) {
            T result;
            try {
                result = operation.call();
            } catch (Exception e) {
                RetryExecution.Decision decision = execution.onFailure(e, attempt);
                switch (decision.action()) {
                    case PROPAGATE -> {
                        if (e instanceof InterruptedException) {
                            Thread.currentThread().interrupt();
                        }
                        throw e;
                    }
                    case EXHAUSTED -> throw decision.exhausted();
                    case RETRY -> sleep(decision.delay());
                }
                continue;
            }
            return execution.succeeded(result);
        }
    }

    /**
     * Subscribes to the supplied Mono once per attempt, waiting between attempts with
     * {@link Mono#delay} on this executor's scheduler. Nothing happens until subscription; every
     * subscription is an independent run.
     */
    public <T> Mono<T> runAsync(Supplier<? extends Mono<T>> operation) {
        return runAsyncWithOutcome(operation).flatMap(outcome -> Mono.justOrEmpty(outcome.value()));
    }

    public <T> Mono<RetryOutcome<T>> runAsyncWithOutcome(Supplier<? extends Mono<T>> operation) {
        return Mono.defer(() -> attemptAsync(operation, new RetryExecution(name, strategy, listener, clock), 0));
    }

    private <T> Mono<RetryOutcome<T>> attemptAsync(Supplier<? extends Mono<T>> operation,
                                                   RetryExecution execution,
                                                   int attempt) {
        return Mono.defer(operation::get)
                .map(execution::succeeded)
                .switchIfEmpty(Mono.fromSupplier(() -> execution.<T>succeeded(null)))
                .onErrorResume(error -> {
                    RetryExecution.Decision decision = execution.onFailure(error, attempt);
                    if (decision.action() == RetryExecution.Action.RETRY) {
                        return Mono.delay(decision.delay(), scheduler)
                                .then(Mono.defer(() -> attemptAsync(operation, execution, attempt + 1)));
                    }
                    return Mono.error(decision.action() == RetryExecution.Action.EXHAUSTED ? decision.exhausted() : error);
                });
    }

    /** Callable that runs the given operation through this executor on every call. */
    public <T> Callable<T> wrap(Callable<T> operation) {
        return () -> run(operation);
    }

    public <T> Supplier<Mono<T>> wrapAsync(Supplier<? extends Mono<T>> operation) {
        return () -> runAsync(operation);
    }

    private void sleep(Duration delay) throws InterruptedException {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    public String getName() {
        return name;
    }

    public BackoffStrategy getStrategy() {
        return strategy;
    }

    /**
     * Collects the construction parameters; unset values keep the {@link BackoffStrategy} defaults.
     */
    public static final class Builder {

        private String name = "operation";
        private int maxAttempts = BackoffStrategy.DEFAULT_MAX_ATTEMPTS;
        private Duration initialDelay = BackoffStrategy.DEFAULT_INITIAL_DELAY;
        private Duration maxDelay = BackoffStrategy.DEFAULT_MAX_DELAY;
        private double exponentialBase = BackoffStrategy.DEFAULT_EXPONENTIAL_BASE;
        private boolean jitter = true;
        private double jitterLow = BackoffStrategy.DEFAULT_JITTER_LOW;
        private double jitterHigh = BackoffStrategy.DEFAULT_JITTER_HIGH;
        private final List<Class<? extends Throwable>> retryableErrors = new ArrayList<>();
        private ErrorClassifier classifier;
        private Duration stopAfterDelay;
        private RetryListener listener;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.THREAD;
        private Scheduler scheduler;

        private Builder() {
        }

        /** Label used in log lines. */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder exponentialBase(double exponentialBase) {
            this.exponentialBase = exponentialBase;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder jitterRange(double low, double high) {
            this.jitterLow = low;
            this.jitterHigh = high;
            return this;
        }

        /** Retry only errors of these types. Ignored when a {@link #classifier} is set. */
        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            retryableErrors.addAll(List.of(types));
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder stopAfterDelay(Duration stopAfterDelay) {
            this.stopAfterDelay = stopAfterDelay;
            return this;
        }

        public Builder onRetry(RetryListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public RetryExecutor build() {
            BackoffStrategy strategy = new BackoffStrategy(maxAttempts, initialDelay, maxDelay, exponentialBase,
                    jitter, jitterLow, jitterHigh, retryableErrors, classifier, stopAfterDelay);
            return new RetryExecutor(name, strategy, listener, clock, sleeper, scheduler);
        }
    }
}
