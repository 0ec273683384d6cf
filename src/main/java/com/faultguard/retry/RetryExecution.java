package com.faultguard.retry;

import com.faultguard.common.ErrorKinds;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * Retry decisions of a single run. Shared by the blocking and the reactive path of
 * {@link RetryExecutor}; only the way the returned delay is waited out differs between them.
 */
@Slf4j
final class RetryExecution {

    enum Action { PROPAGATE, EXHAUSTED, RETRY }

    /**
     * PROPAGATE: rethrow the original error. EXHAUSTED: throw {@code exhausted}. RETRY: wait {@code delay}.
     */
    record Decision(Action action, Duration delay, RetryExhaustedException exhausted) {

        static Decision propagate() {
            return new Decision(Action.PROPAGATE, Duration.ZERO, null);
        }

        static Decision exhausted(RetryExhaustedException error) {
            return new Decision(Action.EXHAUSTED, Duration.ZERO, error);
        }

        static Decision retryAfter(Duration delay) {
            return new Decision(Action.RETRY, delay, null);
        }
    }

    private final String name;
    private final BackoffStrategy strategy;
    private final RetryListener listener;
    private final RetryStatistics statistics;

    RetryExecution(String name, BackoffStrategy strategy, RetryListener listener, Clock clock) {
        this.name = name;
        this.strategy = strategy;
        this.listener = listener;
        this.statistics = new RetryStatistics(clock);
    }

    <T> RetryOutcome<T> succeeded(T value) {
        statistics.finish();
        if (statistics.getAttemptsMade() > 0) {
            log.info("{} succeeded after {} failed attempt(s), elapsed {} ms",
                    name, statistics.getAttemptsMade(), statistics.getElapsed().toMillis());
        }
        return new RetryOutcome<>(value, statistics);
    }

    /**
     * @param attempt zero-based number of the attempt that just failed
     */
    Decision onFailure(Throwable error, int attempt) {
        if (error instanceof InterruptedException) {
            statistics.finish();
            return Decision.propagate();
        }
        if (!isRetryable(error)) {
            log.debug("Non-retryable error in {} on attempt {}: {}", name, attempt + 1, error.toString());
            statistics.finish();
            return Decision.propagate();
        }
        int maxAttempts = strategy.getMaxAttempts();
        boolean lastAttempt = attempt >= maxAttempts - 1;
        Duration delay = lastAttempt ? Duration.ZERO : strategy.delay(attempt);
        if (timeBudgetSpent(delay)) {
            log.error("Retry time budget of {} spent for {} after {} attempt(s): {}",
                    strategy.getStopAfterDelay().orElse(Duration.ZERO), name, attempt + 1, error.toString());
            return Decision.exhausted(exhaust(error, attempt));
        }
        if (lastAttempt) {
            log.error("All {} retry attempts exhausted for {}: {}", maxAttempts, name, error.toString());
            return Decision.exhausted(exhaust(error, attempt));
        }
        statistics.recordFailure(ErrorKinds.kindOf(error), delay);
        log.warn("Retrying {} after {} ms (attempt {}/{}): {}",
                name, delay.toMillis(), attempt + 1, maxAttempts, error.toString());
        notifyListener(error, attempt + 1);
        return Decision.retryAfter(delay);
    }

    /** A classifier that throws makes the error non-retryable; the original error is what propagates. */
    private boolean isRetryable(Throwable error) {
        try {
            return strategy.shouldRetry(error);
        } catch (RuntimeException e) {
            log.warn("Retry classifier for {} failed on {}; not retrying", name, ErrorKinds.kindOf(error), e);
            return false;
        }
    }

    /**
     * Spent when elapsed time already exceeds the budget, or the next sleep would end past it.
     */
    private boolean timeBudgetSpent(Duration nextDelay) {
        return strategy.getStopAfterDelay()
                .map(budget -> {
                    Duration elapsed = statistics.getElapsed();
                    return elapsed.compareTo(budget) > 0 || elapsed.plus(nextDelay).compareTo(budget) > 0;
                })
                .orElse(false);
    }

    private RetryExhaustedException exhaust(Throwable error, int attempt) {
        statistics.recordFailure(ErrorKinds.kindOf(error), Duration.ZERO);
        statistics.finish();
        return new RetryExhaustedException(error, attempt + 1, statistics);
    }

    private void notifyListener(Throwable error, int attempt) {
        if (listener == null) {
            return;
        }
        try {
            listener.onRetry(error, attempt);
        } catch (RuntimeException e) {
            log.warn("Retry listener for {} failed on attempt {}; continuing: {}", name, attempt, e.toString());
        }
    }
}
