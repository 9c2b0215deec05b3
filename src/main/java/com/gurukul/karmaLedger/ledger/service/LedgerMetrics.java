package com.gurukul.karmaLedger.ledger.service;

import com.gurukul.karmaLedger.ledger.model.LedgerEventType;
import com.gurukul.karmaLedger.ledger.model.LedgerMetricsSnapshot;
import com.gurukul.karmaLedger.ledger.model.LedgerRecordRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters maintained by the ledger. Thread-safe; counters are atomics and the
 * response-time window is guarded by its own monitor.
 */
class LedgerMetrics {

    static final int RESPONSE_TIME_WINDOW = 1000;

    private final Clock clock;
    private final Instant startedAt;
    private final Map<LedgerEventType, AtomicLong> eventCounts = new EnumMap<>(LedgerEventType.class);
    private final AtomicLong atonementCompletions = new AtomicLong();
    private final AtomicLong droppedEntries = new AtomicLong();
    private final Map<String, AtomicLong> errorBreakdown = new ConcurrentHashMap<>();
    private final Deque<Double> responseTimesMs = new ArrayDeque<>();

    LedgerMetrics(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
        for (LedgerEventType type : LedgerEventType.values()) {
            eventCounts.put(type, new AtomicLong());
        }
    }

    void onEvent(LedgerRecordRequest request) {
        LedgerEventType type = request.getEventType();
        switch (type) {
            case ATONEMENT -> {
                if (!isFailedAtonement(request)) {
                    atonementCompletions.incrementAndGet();
                }
            }
            case VALIDATION_ERROR -> {
                eventCounts.get(type).incrementAndGet();
                String key = text(request.getData(), "error_type") + ":" + text(request.getData(), "field");
                errorBreakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
            }
            case API_RESPONSE -> {
                eventCounts.get(type).incrementAndGet();
                Object responseTime = request.getPerformanceMetrics() == null
                        ? null : request.getPerformanceMetrics().get("response_time_ms");
                if (responseTime instanceof Number number) {
                    recordResponseTime(number.doubleValue());
                }
            }
            default -> eventCounts.get(type).incrementAndGet();
        }
    }

    void onDropped() {
        droppedEntries.incrementAndGet();
    }

    LedgerMetricsSnapshot snapshot(int trailSize, long nextIndex, String chainHead) {
        Map<String, Long> breakdown = new TreeMap<>();
        errorBreakdown.forEach((key, count) -> breakdown.put(key, count.get()));

        return LedgerMetricsSnapshot.builder()
                .apiRequests(count(LedgerEventType.API_REQUEST))
                .apiResponses(count(LedgerEventType.API_RESPONSE))
                .validationErrors(count(LedgerEventType.VALIDATION_ERROR))
                .systemErrors(count(LedgerEventType.SYSTEM_ERROR))
                .securityEvents(count(LedgerEventType.SECURITY_EVENT))
                .karmaActions(count(LedgerEventType.KARMA_ACTION))
                .atonementCompletions(atonementCompletions.get())
                .performanceMetrics(count(LedgerEventType.PERFORMANCE_METRIC))
                .droppedEntries(droppedEntries.get())
                .errorBreakdown(breakdown)
                .averageResponseTimeMs(averageResponseTime())
                .totalAuditEntries(trailSize)
                .uptimeHours(Duration.between(startedAt, clock.instant()).toMillis() / 3_600_000.0)
                .nextLedgerIndex(nextIndex)
                .chainHead(chainHead)
                .build();
    }

    private long count(LedgerEventType type) {
        return eventCounts.get(type).get();
    }

    private void recordResponseTime(double millis) {
        synchronized (responseTimesMs) {
            responseTimesMs.addLast(millis);
            while (responseTimesMs.size() > RESPONSE_TIME_WINDOW) {
                responseTimesMs.removeFirst();
            }
        }
    }

    private double averageResponseTime() {
        synchronized (responseTimesMs) {
            return responseTimesMs.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }
    }

    private static boolean isFailedAtonement(LedgerRecordRequest request) {
        return request.getData() != null && Boolean.FALSE.equals(request.getData().get("success"));
    }

    private static String text(Map<String, Object> data, String key) {
        Object value = data == null ? null : data.get(key);
        return value == null ? "unknown" : value.toString();
    }
}
