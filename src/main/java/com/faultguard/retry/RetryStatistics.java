package com.faultguard.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-execution accumulator: one instance per {@link RetryExecutor} run, never shared between runs.
 * Mutated after every failed attempt and frozen once the run ends.
 */
public final class RetryStatistics {

    private final Clock clock;
    private final Instant startTime;
    private final List<String> failureKinds = new ArrayList<>();
    private int attemptsMade;
    private Duration totalDelay = Duration.ZERO;
    private Instant endTime;

    RetryStatistics(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    void recordFailure(String kind, Duration delay) {
        if (endTime != null) {
            throw new IllegalStateException("Statistics already finished");
        }
        attemptsMade++;
        totalDelay = totalDelay.plus(delay);
        failureKinds.add(kind);
    }

    void finish() {
        if (endTime == null) {
            endTime = clock.instant();
        }
    }

    public int getAttemptsMade() {
        return attemptsMade;
    }

    public Duration getTotalDelay() {
        return totalDelay;
    }

    public Instant getStartTime() {
        return startTime;
    }

    /** Null while the run is still in progress. */
    public Instant getEndTime() {
        return endTime;
    }

    public boolean isFinished() {
        return endTime != null;
    }

    /**
     * end - start once finished; time since start while running.
     */
    public Duration getElapsed() {
        Instant end = endTime != null ? endTime : clock.instant();
        return Duration.between(startTime, end);
    }

    /** Kind of each failed attempt, in order. */
    public List<String> getFailureKinds() {
        return Collections.unmodifiableList(failureKinds);
    }

    @Override
    public String toString() {
        return "RetryStatistics{attemptsMade=" + attemptsMade
                + ", totalDelay=" + totalDelay
                + ", elapsed=" + getElapsed()
                + ", failureKinds=" + failureKinds + '}';
    }
}
