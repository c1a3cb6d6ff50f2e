package com.quotagate.algorithms;

import com.quotagate.core.CheckResult;
import com.quotagate.core.QuotaCeiling;
import com.quotagate.core.QuotaConfig;
import com.quotagate.storage.InMemoryCounterStore;
import com.quotagate.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FixedWindowQuotaGate against the in-memory store
 * Covers the ceiling order, window rollover, usage reads and racing callers
 */
class FixedWindowQuotaGateTest {

    private MutableClock clock;
    private InMemoryCounterStore store;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:15:30Z");
        store = new InMemoryCounterStore(clock);
        meterRegistry = new SimpleMeterRegistry();
    }

    private FixedWindowQuotaGate gate(long rpm, long tpm, long rpd) {
        return new FixedWindowQuotaGate(store, QuotaConfig.of(rpm, tpm, rpd), meterRegistry, clock);
    }

    @Test
    @DisplayName("Should reject the call after the per-minute request ceiling is reached")
    void shouldRejectAtRequestsPerMinuteCeiling() {
        FixedWindowQuotaGate gate = gate(2, 1000, 100);

        CheckResult first = gate.checkAndIncrement(10);
        assertTrue(first.isAllowed());
        assertEquals(1, first.getCurrentRequests());

        CheckResult second = gate.checkAndIncrement(10);
        assertTrue(second.isAllowed());
        assertEquals(2, second.getCurrentRequests());

        CheckResult third = gate.checkAndIncrement(10);
        assertFalse(third.isAllowed());
        assertEquals("requests per minute limit exceeded (2/2)", third.getRejectionReason());
        assertEquals(QuotaCeiling.REQUESTS_PER_MINUTE, third.getExceededCeiling());
        assertEquals(2, third.getCurrentRequests());
        assertEquals(Duration.ofSeconds(30), third.getResetMinute());
        assertEquals(Duration.ZERO, third.getResetDay());
        assertEquals(Duration.ofSeconds(30), third.getRetryAfter());
    }

    @Test
    @DisplayName("Should reject a token cost that would exceed the per-minute token ceiling")
    void shouldRejectWhenTokensWouldExceedCeiling() {
        FixedWindowQuotaGate gate = gate(100, 50, 1000);

        CheckResult first = gate.checkAndIncrement(30);
        assertTrue(first.isAllowed());
        assertEquals(30, first.getCurrentTokens());

        CheckResult second = gate.checkAndIncrement(25);
        assertFalse(second.isAllowed());
        assertEquals(QuotaCeiling.TOKENS_PER_MINUTE, second.getExceededCeiling());
        assertEquals("tokens per minute limit exceeded (30+25 > 50)", second.getRejectionReason());
        assertEquals(30, second.getCurrentTokens());
    }

    @Test
    @DisplayName("Should allow a token cost landing exactly on the ceiling")
    void shouldAllowTokenCostExactlyAtCeiling() {
        FixedWindowQuotaGate gate = gate(100, 50, 1000);

        assertTrue(gate.checkAndIncrement(30).isAllowed());

        CheckResult exact = gate.checkAndIncrement(20);
        assertTrue(exact.isAllowed());
        assertEquals(50, exact.getCurrentTokens());

        assertFalse(gate.checkAndIncrement(1).isAllowed());
        // Would-exceed check: a zero-cost call still fits a full token budget
        assertTrue(gate.checkAndIncrement(0).isAllowed());
    }

    @Test
    @DisplayName("Should reject a token cost too large to add to the current usage")
    void shouldRejectTokenCostNearLongMaxValue() {
        FixedWindowQuotaGate gate = gate(100, 50, 1000);

        assertTrue(gate.checkAndIncrement(1).isAllowed());

        CheckResult huge = gate.checkAndIncrement(Long.MAX_VALUE);
        assertFalse(huge.isAllowed());
        assertEquals(QuotaCeiling.TOKENS_PER_MINUTE, huge.getExceededCeiling());
        assertEquals(1, huge.getCurrentTokens());

        // Shared counter untouched, budget still enforced for later callers
        assertEquals(1, gate.getCurrentUsage().getCurrentTokens());
        assertTrue(gate.checkAndIncrement(49).isAllowed());
        assertFalse(gate.checkAndIncrement(1).isAllowed());
    }

    @Test
    @DisplayName("Should reject on the daily ceiling while minute budgets remain")
    void shouldRejectOnRequestsPerDayIndependently() {
        FixedWindowQuotaGate gate = gate(100, 10000, 2);

        assertTrue(gate.checkAndIncrement(10).isAllowed());
        assertTrue(gate.checkAndIncrement(10).isAllowed());

        CheckResult third = gate.checkAndIncrement(10);
        assertFalse(third.isAllowed());
        assertEquals(QuotaCeiling.REQUESTS_PER_DAY, third.getExceededCeiling());
        assertTrue(third.getRejectionReason().contains("requests per day"));
        assertEquals(Duration.ZERO, third.getResetMinute());
        assertEquals(Duration.ofHours(13).plusMinutes(44).plusSeconds(30), third.getResetDay());

        // Still rejected in a fresh minute: the day window has not rolled over
        clock.advance(Duration.ofMinutes(1));
        assertEquals(QuotaCeiling.REQUESTS_PER_DAY, gate.checkAndIncrement(10).getExceededCeiling());
    }

    @Test
    @DisplayName("Should report the first violated ceiling when several are hit")
    void shouldEvaluateCeilingsInFixedOrder() {
        FixedWindowQuotaGate gate = gate(1, 10, 1);

        assertTrue(gate.checkAndIncrement(10).isAllowed());

        CheckResult rejected = gate.checkAndIncrement(10);
        assertEquals(QuotaCeiling.REQUESTS_PER_MINUTE, rejected.getExceededCeiling());
    }

    @Test
    @DisplayName("Should reject everything when a ceiling is zero")
    void shouldRejectWithZeroCeiling() {
        FixedWindowQuotaGate gate = gate(0, 1000, 100);

        CheckResult result = gate.checkAndIncrement(0);
        assertFalse(result.isAllowed());
        assertEquals("requests per minute limit exceeded (0/0)", result.getRejectionReason());
    }

    @Test
    @DisplayName("Should not record rejected attempts")
    void shouldNotCountRejectedAttempts() {
        FixedWindowQuotaGate gate = gate(100, 50, 1000);

        gate.checkAndIncrement(40);
        gate.checkAndIncrement(40);
        gate.checkAndIncrement(40);

        CheckResult usage = gate.getCurrentUsage();
        assertEquals(1, usage.getCurrentRequests());
        assertEquals(40, usage.getCurrentTokens());
        assertEquals(1, usage.getCurrentDayRequests());
    }

    @Test
    @DisplayName("Should start fresh minute counters when the minute rolls over")
    void shouldResetMinuteCountersOnRollover() {
        FixedWindowQuotaGate gate = gate(2, 1000, 100);

        gate.checkAndIncrement(100);
        gate.checkAndIncrement(100);
        assertFalse(gate.checkAndIncrement(100).isAllowed());

        clock.advance(Duration.ofSeconds(30));

        CheckResult next = gate.checkAndIncrement(100);
        assertTrue(next.isAllowed());
        assertEquals(1, next.getCurrentRequests());
        assertEquals(100, next.getCurrentTokens());
        assertEquals(3, next.getCurrentDayRequests());
        assertEquals(Duration.ofMinutes(1), next.getResetMinute());
    }

    @Test
    @DisplayName("Should populate both reset durations when allowed")
    void shouldPopulateResetsWhenAllowed() {
        CheckResult result = gate(10, 100, 50).checkAndIncrement(5);

        assertTrue(result.isAllowed());
        assertNull(result.getRejectionReason());
        assertNull(result.getExceededCeiling());
        assertEquals(Duration.ofSeconds(30), result.getResetMinute());
        assertEquals(Duration.ofHours(13).plusMinutes(44).plusSeconds(30), result.getResetDay());
        assertEquals(Duration.ZERO, result.getRetryAfter());
    }

    @Test
    @DisplayName("Should report usage without changing it")
    void shouldReadUsageWithoutMutation() {
        FixedWindowQuotaGate gate = gate(3, 100, 50);

        gate.checkAndIncrement(20);
        gate.checkAndIncrement(30);

        CheckResult usage = gate.getCurrentUsage();
        assertFalse(usage.isAllowed());
        assertNull(usage.getExceededCeiling());
        assertEquals(2, usage.getCurrentRequests());
        assertEquals(50, usage.getCurrentTokens());
        assertEquals(2, usage.getCurrentDayRequests());
        assertEquals(Duration.ofSeconds(30), usage.getResetMinute());

        for (int i = 0; i < 5; i++) {
            assertEquals(usage, gate.getCurrentUsage());
        }

        // One more fits under rpm=3 regardless of how many usage reads happened
        assertTrue(gate.checkAndIncrement(10).isAllowed());
        assertFalse(gate.checkAndIncrement(10).isAllowed());
    }

    @Test
    @DisplayName("Should zero the current windows on reset")
    void shouldZeroCurrentWindowsOnReset() {
        FixedWindowQuotaGate gate = gate(10, 100, 50);

        gate.checkAndIncrement(20);
        gate.reset();

        CheckResult usage = gate.getCurrentUsage();
        assertEquals(0, usage.getCurrentRequests());
        assertEquals(0, usage.getCurrentTokens());
        assertEquals(0, usage.getCurrentDayRequests());

        // Idempotent when nothing is stored
        assertDoesNotThrow(gate::reset);
    }

    @Test
    @DisplayName("Should share counters between gates using the same prefix")
    void shouldShareCountersAcrossGates() {
        FixedWindowQuotaGate first = gate(2, 1000, 100);
        FixedWindowQuotaGate second = gate(2, 1000, 100);

        assertTrue(first.checkAndIncrement(1).isAllowed());
        assertTrue(second.checkAndIncrement(1).isAllowed());
        assertFalse(first.checkAndIncrement(1).isAllowed());

        FixedWindowQuotaGate otherTenant = new FixedWindowQuotaGate(store,
                QuotaConfig.builder()
                        .requestsPerMinute(2)
                        .tokensPerMinute(1000)
                        .requestsPerDay(100)
                        .keyPrefix("tenant-b")
                        .build(),
                meterRegistry, clock);
        assertTrue(otherTenant.checkAndIncrement(1).isAllowed());
    }

    @Test
    @DisplayName("Should reject negative token costs")
    void shouldRejectNegativeTokenCost() {
        FixedWindowQuotaGate gate = gate(10, 100, 50);

        assertThrows(IllegalArgumentException.class, () -> gate.checkAndIncrement(-1));
    }

    @Test
    @DisplayName("Should record allowed and rejected metrics per ceiling")
    void shouldRecordMetrics() {
        FixedWindowQuotaGate gate = gate(1, 1000, 100);

        gate.checkAndIncrement(1);
        gate.checkAndIncrement(1);
        gate.checkAndIncrement(1);

        assertEquals(1.0, meterRegistry.get("quotagate.requests.allowed").counter().count());
        assertEquals(2.0, meterRegistry.get("quotagate.requests.rejected")
                .tag("ceiling", "rpm").counter().count());
        assertEquals(0.0, meterRegistry.get("quotagate.requests.rejected")
                .tag("ceiling", "rpd").counter().count());
        assertEquals(3, meterRegistry.get("quotagate.store.latency")
                .tag("phase", "read").timer().count());
        assertEquals(1, meterRegistry.get("quotagate.store.latency")
                .tag("phase", "write").timer().count());
    }

    @Test
    @DisplayName("Should overshoot the ceiling by at most the number of racing callers")
    void shouldBoundOvershootUnderConcurrency() throws Exception {
        long limit = 10;
        int numThreads = 8;
        int requestsPerThread = 5;
        FixedWindowQuotaGate gate = gate(limit, 1_000_000, 1_000_000);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger allowedCount = new AtomicInteger(0);
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < numThreads; i++) {
            futures.add(executor.submit(() -> {
                startLatch.await();
                for (int j = 0; j < requestsPerThread; j++) {
                    if (gate.checkAndIncrement(1).isAllowed()) {
                        allowedCount.incrementAndGet();
                    }
                }
                return null;
            }));
        }

        startLatch.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        long committed = gate.getCurrentUsage().getCurrentRequests();
        assertEquals(allowedCount.get(), committed);
        assertTrue(committed >= limit, "at least the ceiling should be admitted, got " + committed);
        assertTrue(committed <= limit + numThreads - 1, "overshoot too large: " + committed);
    }
}
