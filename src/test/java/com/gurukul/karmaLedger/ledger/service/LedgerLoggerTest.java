package com.gurukul.karmaLedger.ledger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gurukul.karmaLedger.ledger.model.LedgerChannel;
import com.gurukul.karmaLedger.ledger.model.LedgerEntry;
import com.gurukul.karmaLedger.ledger.model.LedgerEventType;
import com.gurukul.karmaLedger.ledger.model.LedgerLevel;
import com.gurukul.karmaLedger.ledger.model.LedgerMetricsSnapshot;
import com.gurukul.karmaLedger.ledger.model.LedgerRecordRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LedgerLoggerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    private InMemoryLedgerSink sink;
    private HashChain hashChain;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        sink = new InMemoryLedgerSink();
        hashChain = new HashChain();
        objectMapper = new ObjectMapper();
    }

    @Test
    void entriesAreIndexedAndChained() {
        LedgerLogger ledger = ledger(100);

        LedgerEntry first = ledger.record(karmaAction("u1", "cheat")).orElseThrow();
        LedgerEntry second = ledger.record(karmaAction("u1", "theft")).orElseThrow();

        assertEquals(0, first.getLedgerIndex());
        assertEquals(HashChain.GENESIS_HASH, first.getPreviousHash());
        assertEquals(1, second.getLedgerIndex());
        assertEquals(first.getEntryHash(), second.getPreviousHash());
        assertEquals(second.getEntryHash(), hashChain.computeHash(second, first.getEntryHash()));
        assertEquals("2026-03-01T10:15:30Z", first.getTimestamp());
        assertEquals(second.getEntryHash(), ledger.getMetrics().getChainHead());
    }

    @Test
    void levelDefaultsFromEventTypeAndCanBeOverridden() {
        LedgerLogger ledger = ledger(100);

        LedgerEntry validation = ledger.record(LedgerRecordRequest.builder()
                .eventType(LedgerEventType.VALIDATION_ERROR).component("validation").message("bad").build())
                .orElseThrow();
        LedgerEntry overridden = ledger.record(LedgerRecordRequest.builder()
                .eventType(LedgerEventType.KARMA_ACTION).level(LedgerLevel.DEBUG).component("karma_engine")
                .message("quiet").build())
                .orElseThrow();

        assertEquals(LedgerLevel.WARNING, validation.getLevel());
        assertEquals(LedgerLevel.DEBUG, overridden.getLevel());
    }

    @Test
    void missingRequestIdIsGenerated() {
        LedgerEntry entry = ledger(100).record(karmaAction("u1", "cheat")).orElseThrow();

        assertTrue(entry.getRequestId() != null && !entry.getRequestId().isBlank());
    }

    @Test
    void entriesAreRoutedToChannelsByComponent() {
        LedgerLogger ledger = ledger(100);

        ledger.record(LedgerRecordRequest.builder().eventType(LedgerEventType.API_REQUEST).component("api").build());
        ledger.record(LedgerRecordRequest.builder().eventType(LedgerEventType.SYSTEM_ERROR).component("system").build());
        ledger.record(LedgerRecordRequest.builder().eventType(LedgerEventType.ATONEMENT).level(LedgerLevel.ERROR)
                .component("atonement").build());
        ledger.record(karmaAction("u1", "cheat"));

        assertEquals(1, sink.lines(LedgerChannel.API).size());
        assertEquals(2, sink.lines(LedgerChannel.ERRORS).size());
        assertEquals(1, sink.lines(LedgerChannel.AUDIT).size());
        assertTrue(sink.lines(LedgerChannel.AUDIT).get(0).contains("\"eventType\":\"karma_action\""));
    }

    @Test
    void failedWriteDoesNotAdvanceChain() {
        LedgerLogger ledger = ledger(100);
        sink.failNext(2);

        Optional<LedgerEntry> dropped = ledger.record(karmaAction("u1", "cheat"));
        LedgerEntry next = ledger.record(karmaAction("u1", "theft")).orElseThrow();

        assertTrue(dropped.isEmpty());
        assertEquals(0, next.getLedgerIndex());
        assertEquals(HashChain.GENESIS_HASH, next.getPreviousHash());
        assertEquals(1, ledger.getAuditTrail().size());
        assertEquals(1, ledger.getMetrics().getDroppedEntries());
        assertEquals(3, sink.attempts());
    }

    @Test
    void droppedEntryIsNotCountedAsAnEvent() {
        LedgerLogger ledger = ledger(100);
        sink.failNext(2);

        ledger.record(karmaAction("u1", "cheat"));
        ledger.record(LedgerRecordRequest.builder().eventType(LedgerEventType.ATONEMENT).component("atonement")
                .data(Map.of("success", true)).build());

        LedgerMetricsSnapshot metrics = ledger.getMetrics();
        assertEquals(0, metrics.getKarmaActions());
        assertEquals(1, metrics.getAtonementCompletions());
        assertEquals(1, metrics.getDroppedEntries());
        assertEquals(1, metrics.getTotalAuditEntries());
    }

    @Test
    void transientFailureIsRetried() {
        LedgerLogger ledger = ledger(100);
        sink.failNextWithRuntimeException(1);

        LedgerEntry entry = ledger.record(karmaAction("u1", "cheat")).orElseThrow();

        assertEquals(0, entry.getLedgerIndex());
        assertEquals(2, sink.attempts());
        assertEquals(0, ledger.getMetrics().getDroppedEntries());
    }

    @Test
    void unserializablePayloadIsDropped() {
        LedgerLogger ledger = ledger(100);

        Optional<LedgerEntry> result = ledger.record(LedgerRecordRequest.builder()
                .eventType(LedgerEventType.KARMA_ACTION)
                .component("karma_engine")
                .data(Map.of("handle", new Object()))
                .build());

        assertTrue(result.isEmpty());
        assertEquals(1, ledger.getMetrics().getDroppedEntries());
        assertEquals(0, ledger.getMetrics().getNextLedgerIndex());
    }

    @Test
    void requestWithoutEventTypeIsDropped() {
        LedgerLogger ledger = ledger(100);

        assertTrue(ledger.record(null).isEmpty());
        assertTrue(ledger.record(LedgerRecordRequest.builder().component("api").build()).isEmpty());
        assertEquals(2, ledger.getMetrics().getDroppedEntries());
    }

    @Test
    void trailEvictsOldestEntriesAndStaysVerifiable() {
        LedgerLogger ledger = ledger(5);

        for (int i = 0; i < 8; i++) {
            ledger.record(karmaAction("u1", "action-" + i));
        }

        List<LedgerEntry> trail = ledger.getAuditTrail();
        assertEquals(5, trail.size());
        assertEquals(3, trail.get(0).getLedgerIndex());
        assertEquals(7, trail.get(4).getLedgerIndex());
        assertTrue(ledger.verifyTrail().isValid());
        assertEquals(5, ledger.getMetrics().getTotalAuditEntries());
        assertEquals(8, ledger.getMetrics().getNextLedgerIndex());
    }

    @Test
    void auditTrailFiltersAndKeepsMostRecent() {
        LedgerLogger ledger = ledger(100);
        ledger.record(karmaAction("alice", "a1"));
        ledger.record(karmaAction("bob", "b1"));
        ledger.record(karmaAction("alice", "a2"));
        ledger.record(LedgerRecordRequest.builder().eventType(LedgerEventType.API_REQUEST).component("api")
                .userId("alice").build());
        ledger.record(karmaAction("alice", "a3"));

        List<LedgerEntry> alice = ledger.getAuditTrail("alice", LedgerEventType.KARMA_ACTION, 2);

        assertEquals(2, alice.size());
        assertEquals("Karma action: a2", alice.get(0).getMessage());
        assertEquals("Karma action: a3", alice.get(1).getMessage());
        assertEquals(4, ledger.getAuditTrail("alice", null, 100).size());
        assertTrue(ledger.getAuditTrail(null, null, 0).isEmpty());
    }

    @Test
    void metricsCountEventsResponseTimesAndErrors() {
        LedgerLogger ledger = ledger(100);
        ledger.record(LedgerRecordRequest.builder().eventType(LedgerEventType.API_RESPONSE).component("api")
                .performanceMetrics(Map.of("response_time_ms", 100.0)).build());
        ledger.record(LedgerRecordRequest.builder().eventType(LedgerEventType.API_RESPONSE).component("api")
                .performanceMetrics(Map.of("response_time_ms", 300)).build());
        ledger.record(LedgerRecordRequest.builder().eventType(LedgerEventType.VALIDATION_ERROR).component("validation")
                .data(Map.of("error_type", "invalid_field", "field", "action")).build());
        ledger.record(LedgerRecordRequest.builder().eventType(LedgerEventType.ATONEMENT).component("atonement")
                .data(Map.of("success", true)).build());
        ledger.record(LedgerRecordRequest.builder().eventType(LedgerEventType.ATONEMENT).component("atonement")
                .data(Map.of("success", false)).build());
        ledger.record(karmaAction("u1", "cheat"));

        LedgerMetricsSnapshot metrics = ledger.getMetrics();

        assertEquals(2, metrics.getApiResponses());
        assertEquals(200.0, metrics.getAverageResponseTimeMs(), 1e-9);
        assertEquals(1, metrics.getValidationErrors());
        assertEquals(Map.of("invalid_field:action", 1L), metrics.getErrorBreakdown());
        assertEquals(1, metrics.getAtonementCompletions());
        assertEquals(1, metrics.getKarmaActions());
        assertEquals(6, metrics.getTotalAuditEntries());
        assertEquals(0.0, metrics.getUptimeHours(), 1e-9);
    }

    @Test
    void concurrentWritersGetContiguousIndexes() throws Exception {
        LedgerLogger ledger = ledger(10_000);
        int threads = 8;
        int perThread = 250;
        Set<Long> indexes = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String user = "user-" + t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        ledger.record(karmaAction(user, "act")).ifPresent(e -> indexes.add(e.getLedgerIndex()));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdown();
        }

        Set<Long> expected = LongStream.range(0, threads * perThread).boxed().collect(Collectors.toSet());
        assertEquals(expected, indexes);
        assertTrue(ledger.verifyTrail().isValid());
        assertEquals(threads * perThread, sink.lines(LedgerChannel.AUDIT).size());
    }

    @Test
    void invalidLimitsFailFast() {
        assertThrows(IllegalStateException.class,
                () -> new LedgerLogger(sink, hashChain, new AuditTrailExporter(hashChain, objectMapper),
                        objectMapper, 0, 2, CLOCK));
        assertThrows(IllegalStateException.class,
                () -> new LedgerLogger(sink, hashChain, new AuditTrailExporter(hashChain, objectMapper),
                        objectMapper, 10, 0, CLOCK));
    }

    private LedgerLogger ledger(int maxTrailEntries) {
        return new LedgerLogger(sink, hashChain, new AuditTrailExporter(hashChain, objectMapper),
                objectMapper, maxTrailEntries, 2, CLOCK);
    }

    private static LedgerRecordRequest karmaAction(String userId, String action) {
        return LedgerRecordRequest.builder()
                .eventType(LedgerEventType.KARMA_ACTION)
                .component("karma_engine")
                .userId(userId)
                .message("Karma action: " + action)
                .data(Map.of("action", action))
                .build();
    }
}
