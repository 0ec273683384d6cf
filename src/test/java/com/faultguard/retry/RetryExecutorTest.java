package com.faultguard.retry;

import com.faultguard.common.ErrorClassifier;
import com.faultguard.common.KindedError;
import com.faultguard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetryExecutorTest {

    @Mock private Callable<String> operation;
    @Mock private RetryListener listener;

    private MutableClock clock;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        sleeps = new ArrayList<>();
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    private RetryExecutor.Builder executor() {
        return RetryExecutor.builder()
                .name("test-op")
                .jitter(false)
                .clock(clock)
                .sleeper(delay -> {
                    sleeps.add(delay);
                    clock.advance(delay);
                });
    }

    @Test
    @DisplayName("success on first call invokes the operation once, regardless of maxAttempts")
    void succeedsOnFirstAttempt() throws Exception {
        when(operation.call()).thenReturn("ok");

        String result = executor().maxAttempts(10).build().run(operation);

        assertThat(result).isEqualTo("ok");
        verify(operation, times(1)).call();
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("two ConnectExceptions then ok: 3 invocations and 2 delays (1s, 2s)")
    void retriesTransientFailuresThenSucceeds() throws Exception {
        when(operation.call())
                .thenThrow(new ConnectException("refused"))
                .thenThrow(new ConnectException("refused"))
                .thenReturn("ok");

        RetryOutcome<String> outcome = executor()
                .maxAttempts(3)
                .initialDelay(Duration.ofSeconds(1))
                .build()
                .runWithOutcome(operation);

        assertThat(outcome.value()).isEqualTo("ok");
        assertThat(outcome.invocations()).isEqualTo(3);
        verify(operation, times(3)).call();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));

        RetryStatistics stats = outcome.statistics();
        assertThat(stats.getAttemptsMade()).isEqualTo(2);
        assertThat(stats.getTotalDelay()).isEqualTo(Duration.ofSeconds(3));
        assertThat(stats.getFailureKinds()).containsExactly("ConnectException", "ConnectException");
        assertThat(stats.isFinished()).isTrue();
        assertThat(stats.getElapsed()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("always failing retryable error: maxAttempts invocations, RetryExhaustedException with attempts == maxAttempts")
    void exhaustsAttempts() throws Exception {
        IOException failure = new IOException("down");
        when(operation.call()).thenThrow(failure);

        RetryExhaustedException ex = catchThrowableOfType(
                () -> executor().maxAttempts(4).initialDelay(Duration.ofMillis(100)).build().run(operation),
                RetryExhaustedException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getAttempts()).isEqualTo(4);
        assertThat(ex.getLastError()).isSameAs(failure);
        assertThat(ex.getCause()).isSameAs(failure);
        assertThat(ex.getStatistics().getAttemptsMade()).isEqualTo(ex.getAttempts());
        assertThat(ex.getStatistics().getFailureKinds()).hasSize(4).containsOnly("IOException");
        assertThat(ex.getStatistics().getTotalDelay()).isEqualTo(Duration.ofMillis(700));
        assertThat(ex.getStatistics().getEndTime()).isNotNull();
        assertThat(ex.getMessage()).startsWith("Failed after 4 attempts");
        verify(operation, times(4)).call();
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
    }

    @Test
    @DisplayName("non-retryable error is propagated unwrapped after a single invocation")
    void propagatesNonRetryableErrorUnwrapped() throws Exception {
        IllegalStateException failure = new IllegalStateException("bad request");
        when(operation.call()).thenThrow(failure);

        RetryExecutor executor = executor().maxAttempts(5).retryOn(IOException.class).build();

        assertThatThrownBy(() -> executor.run(operation)).isSameAs(failure);
        verify(operation, times(1)).call();
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("classifier decides alone when both classifier and types are configured")
    void classifierWinsOverTypes() throws Exception {
        when(operation.call())
                .thenThrow(new RateLimitedException())
                .thenThrow(new IOException("not retried"));

        RetryExecutor executor = executor()
                .maxAttempts(5)
                .retryOn(IOException.class)
                .classifier(ErrorClassifier.kinds("RATE_LIMITED"))
                .build();

        assertThatThrownBy(() -> executor.run(operation)).isInstanceOf(IOException.class).hasMessage("not retried");
        verify(operation, times(2)).call();
    }

    @Test
    @DisplayName("maxAttempts=1 fails fast on the first retryable error without sleeping or notifying")
    void singleAttemptFailsFast() throws Exception {
        when(operation.call()).thenThrow(new TimeoutException());

        RetryExhaustedException ex = catchThrowableOfType(
                () -> executor().maxAttempts(1).onRetry(listener).build().run(operation),
                RetryExhaustedException.class);

        assertThat(ex.getAttempts()).isEqualTo(1);
        assertThat(ex.getStatistics().getFailureKinds()).containsExactly("TimeoutException");
        assertThat(sleeps).isEmpty();
        verify(listener, never()).onRetry(any(), anyInt());
    }

    @Test
    @DisplayName("time budget shorter than the first delay stops after the first failure")
    void timeBudgetShorterThanFirstDelay() throws Exception {
        when(operation.call()).thenThrow(new ConnectException());

        RetryExhaustedException ex = catchThrowableOfType(
                () -> executor()
                        .maxAttempts(5)
                        .initialDelay(Duration.ofSeconds(1))
                        .stopAfterDelay(Duration.ofMillis(500))
                        .build()
                        .run(operation),
                RetryExhaustedException.class);

        assertThat(ex.getAttempts()).isEqualTo(1);
        verify(operation, times(1)).call();
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("slow attempts overrun the time budget; no further retry is started")
    void timeBudgetSpentBySlowAttempts() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Callable<String> slow = () -> {
            calls.incrementAndGet();
            clock.advance(Duration.ofSeconds(2));
            throw new ConnectException();
        };

        RetryExhaustedException ex = catchThrowableOfType(
                () -> executor()
                        .maxAttempts(10)
                        .initialDelay(Duration.ofMillis(100))
                        .stopAfterDelay(Duration.ofSeconds(3))
                        .build()
                        .run(slow),
                RetryExhaustedException.class);

        assertThat(calls.get()).isEqualTo(2);
        assertThat(ex.getAttempts()).isEqualTo(2);
        assertThat(ex.getStatistics().getElapsed()).isEqualTo(Duration.ofMillis(4100));
        assertThat(sleeps).containsExactly(Duration.ofMillis(100));
    }

    @Test
    @DisplayName("observer is called with the failed error and the one-based attempt number, in order")
    void notifiesListenerBeforeEachSleep() throws Exception {
        ConnectException first = new ConnectException("1");
        ConnectException second = new ConnectException("2");
        when(operation.call()).thenThrow(first).thenThrow(second).thenReturn("ok");

        executor().maxAttempts(3).onRetry(listener).build().run(operation);

        InOrder order = inOrder(listener);
        order.verify(listener).onRetry(first, 1);
        order.verify(listener).onRetry(second, 2);
        order.verifyNoMoreInteractions();
    }

    @Test
    @DisplayName("a failing observer does not abort the retry loop")
    void failingListenerIsIgnored() throws Exception {
        when(operation.call()).thenThrow(new ConnectException()).thenReturn("ok");
        doThrow(new IllegalStateException("metrics down")).when(listener).onRetry(any(), anyInt());

        String result = executor().maxAttempts(3).onRetry(listener).build().run(operation);

        assertThat(result).isEqualTo("ok");
        verify(operation, times(2)).call();
    }

    @Test
    @DisplayName("interrupt during backoff stops retrying and keeps the interrupt flag")
    void interruptedWhileSleeping() throws Exception {
        when(operation.call()).thenThrow(new ConnectException());
        RetryExecutor executor = RetryExecutor.builder()
                .jitter(false)
                .clock(clock)
                .sleeper(delay -> {
                    throw new InterruptedException("shutdown");
                })
                .build();

        assertThatThrownBy(() -> executor.run(operation)).isInstanceOf(InterruptedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        verify(operation, times(1)).call();
    }

    @Test
    @DisplayName("InterruptedException thrown by the operation is never retried")
    void interruptedOperationIsNotRetried() throws Exception {
        when(operation.call()).thenThrow(new InterruptedException());

        assertThatThrownBy(() -> executor().maxAttempts(5).build().run(operation))
                .isInstanceOf(InterruptedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        verify(operation, times(1)).call();
    }

    @Test
    @DisplayName("wrapped callable starts an independent run per call")
    void wrapRunsIndependently() throws Exception {
        when(operation.call())
                .thenThrow(new ConnectException())
                .thenReturn("first")
                .thenThrow(new ConnectException())
                .thenReturn("second");

        Callable<String> retrying = executor().maxAttempts(2).build().wrap(operation);

        assertThat(retrying.call()).isEqualTo("first");
        assertThat(retrying.call()).isEqualTo("second");
        verify(operation, times(4)).call();
    }

    @Test
    @DisplayName("a throwing classifier stops retrying and the operation's own error propagates")
    void throwingClassifierPropagatesOriginalError() throws Exception {
        IOException failure = new IOException("down");
        when(operation.call()).thenThrow(failure);
        ErrorClassifier broken = error -> {
            throw new IllegalStateException("classifier bug");
        };

        assertThatThrownBy(() -> executor().maxAttempts(5).classifier(broken).build().run(operation))
                .isSameAs(failure);
        verify(operation, times(1)).call();
    }

    @Test
    @DisplayName("a maxDelay too large for nanoseconds behaves as no ceiling")
    void unboundedMaxDelay() throws Exception {
        when(operation.call()).thenThrow(new ConnectException()).thenReturn("ok");

        String result = executor()
                .maxAttempts(2)
                .initialDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(Long.MAX_VALUE))
                .build()
                .run(operation);

        assertThat(result).isEqualTo("ok");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void builderDefaults() {
        RetryExecutor executor = RetryExecutor.builder().build();
        assertThat(executor.getName()).isEqualTo("operation");
        assertThat(executor.getStrategy().getMaxAttempts()).isEqualTo(3);
        assertThat(executor.getStrategy().getInitialDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(executor.getStrategy().isJitterEnabled()).isTrue();
        assertThat(executor.getStrategy().shouldRetry(new RuntimeException())).isTrue();
    }

    static class RateLimitedException extends RuntimeException implements KindedError {
        @Override
        public String kind() {
            return "RATE_LIMITED";
        }
    }
}
