package radar.core.service.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import radar.core.exception.OperationTimeoutException;
import radar.core.model.resilience.TimedOperation;
import radar.core.model.resilience.TimeoutOptions;
import radar.core.port.out.ResilienceMetrics;

@DisplayName("TimeoutGuard")
@ExtendWith(MockitoExtension.class)
class TimeoutGuardTest {

    private static final Duration DEADLINE = Duration.ofMillis(200);
    private static final Duration AWAIT = Duration.ofSeconds(5);

    @Mock
    private ResilienceMetrics metrics;

    private TimeoutGuard guard;

    @BeforeEach
    void setUp() {
        guard = new TimeoutGuard(Clock.systemUTC(), metrics);
    }

    private static <T> Uni<T> after(Duration delay, T value) {
        return Uni.createFrom().item(value).onItem().delayIt().by(delay);
    }

    @Nested
    @DisplayName("withTimeout")
    class WithTimeout {

        @Test
        @DisplayName("should return the result when the operation beats the deadline")
        void shouldReturnResult() {
            var result = guard.withTimeout(
                            () -> after(Duration.ofMillis(100), "done"), TimeoutOptions.of(DEADLINE, "fast"))
                    .await()
                    .atMost(AWAIT);

            assertEquals("done", result);
            verify(metrics).recordOperationCompleted(eq("fast"), anyLong(), eq(true));
            verify(metrics, never()).recordTimeout(eq("fast"), anyLong());
        }

        @Test
        @DisplayName("should fail with the operation name and deadline when the deadline wins")
        void shouldTimeOut() {
            var error = assertThrows(
                    OperationTimeoutException.class,
                    () -> guard.withTimeout(
                                    () -> after(Duration.ofMillis(400), "late"), TimeoutOptions.of(DEADLINE, "slow"))
                            .await()
                            .atMost(AWAIT));

            assertEquals("slow", error.getOperation());
            assertEquals(200, error.getTimeoutMs());
            verify(metrics).recordTimeout("slow", 200);
            verify(metrics, never()).recordOperationCompleted(eq("slow"), anyLong(), eq(false));
        }

        @Test
        @DisplayName("should fire the listener exactly once on timeout")
        void shouldFireListenerOnce() {
            var fired = new AtomicInteger();

            assertThrows(
                    OperationTimeoutException.class,
                    () -> guard.withTimeout(
                                    () -> Uni.createFrom().<String>nothing(),
                                    TimeoutOptions.of(DEADLINE, "hang", fired::incrementAndGet))
                            .await()
                            .atMost(AWAIT));

            assertEquals(1, fired.get());
        }

        @Test
        @DisplayName("should not fire the listener when the operation completes in time")
        void shouldNotFireListenerOnSuccess() {
            var fired = new AtomicBoolean();

            guard.withTimeout(
                            () -> Uni.createFrom().item("ok"),
                            TimeoutOptions.of(DEADLINE, "ok", () -> fired.set(true)))
                    .await()
                    .atMost(AWAIT);

            assertFalse(fired.get());
        }

        @Test
        @DisplayName("should still raise the timeout when the listener throws")
        void shouldSurviveListenerFailure() {
            assertThrows(
                    OperationTimeoutException.class,
                    () -> guard.withTimeout(
                                    () -> Uni.createFrom().<String>nothing(),
                                    TimeoutOptions.of(DEADLINE, "hang", () -> {
                                        throw new IllegalStateException("listener failed");
                                    }))
                            .await()
                            .atMost(AWAIT));
        }

        @Test
        @DisplayName("should pass through the operation's own failure")
        void shouldPassThroughFailure() {
            var error = assertThrows(
                    IllegalStateException.class,
                    () -> guard.withTimeout(
                                    () -> Uni.createFrom().<String>failure(new IllegalStateException("boom")),
                                    TimeoutOptions.of(DEADLINE, "failing"))
                            .await()
                            .atMost(AWAIT));

            assertEquals("boom", error.getMessage());
            verify(metrics).recordOperationCompleted(eq("failing"), anyLong(), eq(false));
        }

        @Test
        @DisplayName("should name helper deadlines after their kind")
        void shouldPrefixHelperNames() {
            var http = assertThrows(
                    OperationTimeoutException.class,
                    () -> guard.withHttpTimeout(() -> Uni.createFrom().<String>nothing(), DEADLINE, "birdeye")
                            .await()
                            .atMost(AWAIT));
            var storage = assertThrows(
                    OperationTimeoutException.class,
                    () -> guard.withStorageTimeout(() -> Uni.createFrom().<String>nothing(), DEADLINE, "save")
                            .await()
                            .atMost(AWAIT));
            var cache = assertThrows(
                    OperationTimeoutException.class,
                    () -> guard.withCacheTimeout(() -> Uni.createFrom().<String>nothing(), DEADLINE, "get")
                            .await()
                            .atMost(AWAIT));

            assertEquals("http_birdeye", http.getOperation());
            assertEquals("db_save", storage.getOperation());
            assertEquals("cache_get", cache.getOperation());
        }

        @Test
        @DisplayName("should reject non-positive deadlines")
        void shouldRejectInvalidDeadline() {
            assertThrows(IllegalArgumentException.class, () -> TimeoutOptions.of(Duration.ZERO, "zero"));
        }
    }

    @Nested
    @DisplayName("allWithTimeout")
    class AllWithTimeout {

        @Test
        @DisplayName("should return an empty list for an empty batch")
        void shouldHandleEmptyBatch() {
            var outcomes = guard.<String>allWithTimeout(List.of(), true).await().atMost(AWAIT);

            assertTrue(outcomes.isEmpty());
        }

        @Test
        @DisplayName("should collect values in input order")
        void shouldCollectInOrder() {
            var outcomes = guard.allWithTimeout(
                            List.of(
                                    TimedOperation.of(() -> after(Duration.ofMillis(80), "slow"), DEADLINE),
                                    TimedOperation.of(() -> after(Duration.ofMillis(10), "quick"), DEADLINE)),
                            true)
                    .await()
                    .atMost(AWAIT);

            assertEquals("slow", outcomes.get(0).value());
            assertEquals("operation_0", outcomes.get(0).name());
            assertEquals("quick", outcomes.get(1).value());
        }

        @Test
        @DisplayName("should fail the whole batch in fail-fast mode")
        void shouldFailFast() {
            var error = assertThrows(
                    OperationTimeoutException.class,
                    () -> guard.allWithTimeout(
                                    List.of(
                                            TimedOperation.of(() -> Uni.createFrom().item("ok"), DEADLINE),
                                            new TimedOperation<>(
                                                    () -> Uni.createFrom().<String>nothing(), DEADLINE, "stuck")),
                                    true)
                            .await()
                            .atMost(AWAIT));

            assertEquals("stuck", error.getOperation());
        }

        @Test
        @DisplayName("should report each member's outcome in collect mode")
        void shouldCollectOutcomes() {
            var outcomes = guard.allWithTimeout(
                            List.of(
                                    TimedOperation.of(() -> Uni.createFrom().item("ok"), DEADLINE),
                                    TimedOperation.of(() -> Uni.createFrom().<String>nothing(), DEADLINE),
                                    TimedOperation.of(
                                            () -> Uni.createFrom().<String>failure(new IllegalStateException("boom")),
                                            DEADLINE)),
                            false)
                    .await()
                    .atMost(AWAIT);

            assertEquals(3, outcomes.size());
            assertTrue(outcomes.get(0).isSuccess());
            assertEquals("ok", outcomes.get(0).value());
            assertTrue(outcomes.get(1).isTimeout());
            assertFalse(outcomes.get(2).isSuccess());
            assertInstanceOf(IllegalStateException.class, outcomes.get(2).failure());
        }
    }

    @Nested
    @DisplayName("raceWithTimeout")
    class RaceWithTimeout {

        @Test
        @DisplayName("should settle with the first operation to complete")
        void shouldReturnFirst() {
            var winner = guard.raceWithTimeout(
                            List.of(
                                    TimedOperation.of(() -> after(Duration.ofMillis(150), "slow"), DEADLINE),
                                    TimedOperation.of(() -> after(Duration.ofMillis(10), "fast"), DEADLINE)),
                            Optional.empty())
                    .await()
                    .atMost(AWAIT);

            assertEquals("fast", winner);
        }

        @Test
        @DisplayName("should fail when the global deadline passes first")
        void shouldApplyGlobalTimeout() {
            var error = assertThrows(
                    OperationTimeoutException.class,
                    () -> guard.raceWithTimeout(
                                    List.of(TimedOperation.of(
                                            () -> Uni.createFrom().<String>nothing(), Duration.ofSeconds(2))),
                                    Optional.of(Duration.ofMillis(100)))
                            .await()
                            .atMost(AWAIT));

            assertEquals("race", error.getOperation());
        }

        @Test
        @DisplayName("should reject an empty race")
        void shouldRejectEmptyRace() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> guard.<String>raceWithTimeout(List.of(), Optional.empty()).await().atMost(AWAIT));
        }
    }

    @Test
    @DisplayName("delay should complete after roughly the requested time")
    void delayShouldWait() {
        var start = System.nanoTime();

        guard.delay(Duration.ofMillis(50)).await().atMost(AWAIT);

        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 45);
    }
}
