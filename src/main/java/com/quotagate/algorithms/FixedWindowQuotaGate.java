package com.quotagate.algorithms;

import com.quotagate.core.CheckResult;
import com.quotagate.core.QuotaCeiling;
import com.quotagate.core.QuotaConfig;
import com.quotagate.core.QuotaGate;
import com.quotagate.storage.CounterIncrement;
import com.quotagate.storage.CounterStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Fixed calendar-window quota gate over a shared counter store.
 *
 * Each check is two round trips:
 * - read the minute-requests, minute-tokens and day-requests counters in one batch
 * - if all three ceilings pass, increment them and refresh their TTLs in one batch
 *
 * Ceilings, first violation wins:
 * 1. minute requests already at or over the limit
 * 2. minute tokens plus this call's cost would go over the limit
 * 3. day requests already at or over the limit
 *
 * The read and the write are separate, so callers racing in the gap can all be
 * admitted at "one below the ceiling". A counter can overshoot by at most the
 * number of racing callers minus one. Rejected attempts are never recorded.
 */
@Slf4j
public class FixedWindowQuotaGate implements QuotaGate {

    private final CounterStore store;
    private final QuotaConfig config;
    private final Clock clock;

    // Metrics
    private final Counter allowedRequests;
    private final Map<QuotaCeiling, Counter> rejectedRequests = new EnumMap<>(QuotaCeiling.class);
    private final Timer readLatency;
    private final Timer writeLatency;
    private final Timer deleteLatency;

    public FixedWindowQuotaGate(CounterStore store, QuotaConfig config, MeterRegistry meterRegistry) {
        this(store, config, meterRegistry, Clock.systemUTC());
    }

    public FixedWindowQuotaGate(
            CounterStore store,
            QuotaConfig config,
            MeterRegistry meterRegistry,
            Clock clock) {

        config.validate();
        this.store = store;
        this.config = config;
        this.clock = clock;

        this.allowedRequests = Counter.builder("quotagate.requests.allowed")
                .description("Calls admitted by the quota gate")
                .register(meterRegistry);

        for (QuotaCeiling ceiling : QuotaCeiling.values()) {
            rejectedRequests.put(ceiling, Counter.builder("quotagate.requests.rejected")
                    .description("Calls rejected by the quota gate")
                    .tag("ceiling", ceiling.tag())
                    .register(meterRegistry));
        }

        this.readLatency = storeTimer("read", meterRegistry);
        this.writeLatency = storeTimer("write", meterRegistry);
        this.deleteLatency = storeTimer("delete", meterRegistry);

        log.info("FixedWindowQuotaGate initialized: prefix={}, rpm={}, tpm={}, rpd={}, buckets={}",
                config.getKeyPrefix(), config.getRequestsPerMinute(), config.getTokensPerMinute(),
                config.getRequestsPerDay(), config.getBucketFormat());
    }

    @Override
    public CheckResult checkAndIncrement(long tokenCost) {
        if (tokenCost < 0) {
            throw new IllegalArgumentException("tokenCost cannot be negative");
        }

        Instant now = clock.instant();
        QuotaWindows windows = QuotaWindows.at(now, config);
        Usage usage = read(windows);

        if (usage.getMinuteRequests() >= config.getRequestsPerMinute()) {
            return reject(usage, windows, QuotaCeiling.REQUESTS_PER_MINUTE, String.format(
                    "requests per minute limit exceeded (%d/%d)",
                    usage.getMinuteRequests(), config.getRequestsPerMinute()));
        }

        // Remaining budget rather than a sum: both sides are non-negative, so no overflow
        if (tokenCost > config.getTokensPerMinute() - usage.getMinuteTokens()) {
            return reject(usage, windows, QuotaCeiling.TOKENS_PER_MINUTE, String.format(
                    "tokens per minute limit exceeded (%d+%d > %d)",
                    usage.getMinuteTokens(), tokenCost, config.getTokensPerMinute()));
        }

        if (usage.getDayRequests() >= config.getRequestsPerDay()) {
            return reject(usage, windows, QuotaCeiling.REQUESTS_PER_DAY, String.format(
                    "requests per day limit exceeded (%d/%d)",
                    usage.getDayRequests(), config.getRequestsPerDay()));
        }

        write(windows, tokenCost);
        allowedRequests.increment();

        // Local arithmetic on what we read; a re-read would see other writers' increments
        return CheckResult.builder()
                .allowed(true)
                .currentRequests(usage.getMinuteRequests() + 1)
                .currentTokens(usage.getMinuteTokens() + tokenCost)
                .currentDayRequests(usage.getDayRequests() + 1)
                .resetMinute(windows.getUntilMinuteReset())
                .resetDay(windows.getUntilDayReset())
                .build();
    }

    @Override
    public CheckResult getCurrentUsage() {
        QuotaWindows windows = QuotaWindows.at(clock.instant(), config);
        Usage usage = read(windows);

        return CheckResult.builder()
                .currentRequests(usage.getMinuteRequests())
                .currentTokens(usage.getMinuteTokens())
                .currentDayRequests(usage.getDayRequests())
                .resetMinute(windows.getUntilMinuteReset())
                .resetDay(windows.getUntilDayReset())
                .build();
    }

    @Override
    public void reset() {
        QuotaWindows windows = QuotaWindows.at(clock.instant(), config);
        ensureNotInterrupted("delete");

        deleteLatency.record(() -> store.delete(windows.keys()));
        ensureNotInterrupted("delete");
        log.debug("Reset quota windows: {}", windows.keys());
    }

    private Usage read(QuotaWindows windows) {
        ensureNotInterrupted("read");

        Map<String, String> values = readLatency.record(() -> store.batchGet(windows.keys()));
        ensureNotInterrupted("read");

        return new Usage(
                parseCounter(windows.getMinuteRequestsKey(), values),
                parseCounter(windows.getMinuteTokensKey(), values),
                parseCounter(windows.getDayRequestsKey(), values));
    }

    private void write(QuotaWindows windows, long tokenCost) {
        ensureNotInterrupted("write");

        List<CounterIncrement> increments = List.of(
                CounterIncrement.of(windows.getMinuteRequestsKey(), 1, config.getMinuteKeyTtl()),
                CounterIncrement.of(windows.getMinuteTokensKey(), tokenCost, config.getMinuteKeyTtl()),
                CounterIncrement.of(windows.getDayRequestsKey(), 1, config.getDayKeyTtl()));

        writeLatency.record(() -> store.batchIncrementAndExpire(increments));
        // The increment may already be applied; the caller still gets no decision
        ensureNotInterrupted("write");
    }

    private CheckResult reject(Usage usage, QuotaWindows windows, QuotaCeiling ceiling, String reason) {
        rejectedRequests.get(ceiling).increment();
        log.debug("Quota rejected for {}: {}", config.getKeyPrefix(), reason);

        Duration minuteReset = ceiling.isMinuteWindow() ? windows.getUntilMinuteReset() : Duration.ZERO;
        Duration dayReset = ceiling.isMinuteWindow() ? Duration.ZERO : windows.getUntilDayReset();

        return CheckResult.builder()
                .allowed(false)
                .currentRequests(usage.getMinuteRequests())
                .currentTokens(usage.getMinuteTokens())
                .currentDayRequests(usage.getDayRequests())
                .resetMinute(minuteReset)
                .resetDay(dayReset)
                .rejectionReason(reason)
                .exceededCeiling(ceiling)
                .build();
    }

    /**
     * Only this component writes these keys, so anything non-numeric or negative
     * is corruption. Counted as zero.
     */
    private long parseCounter(String key, Map<String, String> values) {
        String raw = values.get(key);
        if (raw == null || raw.isEmpty()) {
            return 0;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < 0) {
                log.warn("Negative value {} stored at {}, counting it as zero", value, key);
                return 0;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Non-numeric value '{}' stored at {}, counting it as zero", raw, key);
            return 0;
        }
    }

    /**
     * Checked before and after each round trip. Jedis I/O ignores interrupts, so one
     * arriving mid-call is only seen once the round trip returns or times out.
     */
    private void ensureNotInterrupted(String phase) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Quota " + phase + " cancelled: calling thread interrupted");
        }
    }

    private static Timer storeTimer(String phase, MeterRegistry meterRegistry) {
        return Timer.builder("quotagate.store.latency")
                .description("Counter store round trip latency")
                .tag("phase", phase)
                .register(meterRegistry);
    }

    @Value
    private static class Usage {
        long minuteRequests;
        long minuteTokens;
        long dayRequests;
    }
}
