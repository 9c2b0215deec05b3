package com.gurukul.karmaLedger.ledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gurukul.karmaLedger.ledger.model.ChainVerificationReport;
import com.gurukul.karmaLedger.ledger.model.LedgerChannel;
import com.gurukul.karmaLedger.ledger.model.LedgerEntry;
import com.gurukul.karmaLedger.ledger.model.LedgerEventType;
import com.gurukul.karmaLedger.ledger.model.LedgerLevel;
import com.gurukul.karmaLedger.ledger.model.LedgerMetricsSnapshot;
import com.gurukul.karmaLedger.ledger.model.LedgerRecordRequest;
import com.gurukul.karmaLedger.ledger.sink.LedgerSink;
import com.gurukul.karmaLedger.util.UserIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-chained event ledger.
 *
 * Responsibilities:
 * - Assign each entry a monotonic ledger index and chain it to its predecessor by SHA-256
 * - Write every sealed entry to the durable sink, one channel per component
 * - Keep the most recent entries in a bounded in-memory trail for dashboards and export
 * - Maintain event counters
 *
 * Workflow:
 * COUNT -> DRAFT -> [LOCK: ASSIGN INDEX -> HASH -> SINK WRITE -> ADVANCE POINTER -> PUSH TRAIL] -> ECHO
 *
 * The index and previous-hash pointer only advance after the sink confirms the write,
 * so a failed write leaves no gap in the chain. Nothing thrown by the sink escapes
 * {@link #record}: the entry is retried, then dropped and counted.
 */
@Slf4j
@Service
public class LedgerLogger {

    public static final int DEFAULT_AUDIT_TRAIL_LIMIT = 100;

    private final LedgerSink sink;
    private final HashChain hashChain;
    private final AuditTrailExporter exporter;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxTrailEntries;
    private final int maxAttempts;
    private final LedgerMetrics metrics;

    private final ReentrantLock chainLock = new ReentrantLock();
    private final Deque<LedgerEntry> trail = new ArrayDeque<>();
    private long nextIndex = 0;
    private String previousHash = HashChain.GENESIS_HASH;

    @Autowired
    public LedgerLogger(LedgerSink sink,
                        HashChain hashChain,
                        AuditTrailExporter exporter,
                        ObjectMapper objectMapper,
                        @Value("${karma.ledger.max-trail-entries:10000}") int maxTrailEntries,
                        @Value("${karma.ledger.sink.max-attempts:2}") int maxAttempts) {
        this(sink, hashChain, exporter, objectMapper, maxTrailEntries, maxAttempts, Clock.systemUTC());
    }

    public LedgerLogger(LedgerSink sink,
                        HashChain hashChain,
                        AuditTrailExporter exporter,
                        ObjectMapper objectMapper,
                        int maxTrailEntries,
                        int maxAttempts,
                        Clock clock) {
        if (maxTrailEntries < 1) {
            throw new IllegalStateException("karma.ledger.max-trail-entries must be at least 1, got " + maxTrailEntries);
        }
        if (maxAttempts < 1) {
            throw new IllegalStateException("karma.ledger.sink.max-attempts must be at least 1, got " + maxAttempts);
        }
        this.sink = sink;
        this.hashChain = hashChain;
        this.exporter = exporter;
        this.objectMapper = objectMapper;
        this.maxTrailEntries = maxTrailEntries;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
        this.metrics = new LedgerMetrics(clock);
        log.info("Ledger initialized - maxTrailEntries: {}, sinkMaxAttempts: {}", maxTrailEntries, maxAttempts);
    }

    /**
     * Records one event.
     *
     * @param request entry content; level defaults from the event type, request id is
     *                generated when absent
     * @return the sealed entry, or empty when the entry could not be written
     */
    public Optional<LedgerEntry> record(LedgerRecordRequest request) {
        if (request == null || request.getEventType() == null) {
            log.warn("Ledger record rejected - missing event type");
            metrics.onDropped();
            return Optional.empty();
        }

        LedgerEntry draft;
        try {
            draft = draft(request);
        } catch (IllegalArgumentException e) {
            log.warn("Ledger entry dropped - eventType: {}, reason: {}", request.getEventType().value(), e.getMessage());
            metrics.onDropped();
            return Optional.empty();
        }

        LedgerEntry sealed;
        chainLock.lock();
        try {
            long index = nextIndex;
            String line;
            try {
                sealed = hashChain.seal(draft, index, previousHash);
                line = objectMapper.writeValueAsString(sealed);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Ledger entry dropped - index: {}, eventType: {}, reason: {}",
                        index, draft.getEventType().value(), e.getMessage());
                metrics.onDropped();
                return Optional.empty();
            }

            LedgerChannel channel = LedgerChannel.forEntry(sealed.getComponent(), sealed.getLevel());
            if (!write(channel, line, index)) {
                log.warn("Ledger entry dropped after {} attempt(s) - index: {}, eventType: {}, channel: {}",
                        maxAttempts, index, sealed.getEventType().value(), channel);
                metrics.onDropped();
                return Optional.empty();
            }

            nextIndex = index + 1;
            previousHash = sealed.getEntryHash();
            trail.addLast(sealed);
            while (trail.size() > maxTrailEntries) {
                trail.removeFirst();
            }
            metrics.onEvent(request);
        } finally {
            chainLock.unlock();
        }

        echo(sealed);
        return Optional.of(sealed);
    }

    public List<LedgerEntry> getAuditTrail() {
        return getAuditTrail(null, null, DEFAULT_AUDIT_TRAIL_LIMIT);
    }

    /**
     * Most recent matching entries from the in-memory trail, oldest first.
     *
     * @param userId only entries for this user; null for all
     * @param eventType only entries of this type; null for all
     * @param limit maximum number of entries returned
     */
    public List<LedgerEntry> getAuditTrail(String userId, LedgerEventType eventType, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<LedgerEntry> matches = new ArrayList<>();
        for (LedgerEntry entry : snapshotTrail()) {
            if (userId != null && !userId.equals(entry.getUserId())) {
                continue;
            }
            if (eventType != null && eventType != entry.getEventType()) {
                continue;
            }
            matches.add(entry);
        }
        int from = Math.max(0, matches.size() - limit);
        return List.copyOf(matches.subList(from, matches.size()));
    }

    public LedgerMetricsSnapshot getMetrics() {
        int trailSize;
        long index;
        String head;
        chainLock.lock();
        try {
            trailSize = trail.size();
            index = nextIndex;
            head = previousHash;
        } finally {
            chainLock.unlock();
        }
        return metrics.snapshot(trailSize, index, head);
    }

    /**
     * Recomputes the hash chain over the retained trail.
     */
    public ChainVerificationReport verifyTrail() {
        return hashChain.verify(snapshotTrail());
    }

    /**
     * Writes every retained entry, with index and hash, plus a verification report to
     * {@code destination} as pretty-printed JSON.
     *
     * @throws java.io.UncheckedIOException when the file cannot be written
     */
    public ChainVerificationReport exportAuditTrail(Path destination) {
        return exporter.export(snapshotTrail(), destination);
    }

    private List<LedgerEntry> snapshotTrail() {
        chainLock.lock();
        try {
            return new ArrayList<>(trail);
        } finally {
            chainLock.unlock();
        }
    }

    private LedgerEntry draft(LedgerRecordRequest request) {
        LedgerLevel level = request.getLevel() != null ? request.getLevel() : request.getEventType().defaultLevel();
        return LedgerEntry.builder()
                .timestamp(clock.instant().toString())
                .level(level)
                .eventType(request.getEventType())
                .component(request.getComponent() != null ? request.getComponent() : "unknown")
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .requestId(request.getRequestId() != null ? request.getRequestId() : UUID.randomUUID().toString())
                .message(request.getMessage() != null ? request.getMessage() : "")
                .data(hashChain.toPlainPayload(request.getData() != null ? request.getData() : Map.of()))
                .errorDetails(hashChain.toPlainPayload(request.getErrorDetails()))
                .performanceMetrics(hashChain.toPlainPayload(request.getPerformanceMetrics()))
                .build();
    }

    private boolean write(LedgerChannel channel, String line, long index) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                sink.append(channel, line);
                return true;
            } catch (IOException | RuntimeException e) {
                log.warn("Ledger sink write failed - attempt: {}/{}, index: {}, channel: {}, error: {}",
                        attempt, maxAttempts, index, channel, e.getMessage());
            }
        }
        return false;
    }

    private void echo(LedgerEntry entry) {
        String format = "Ledger entry - index: {}, eventType: {}, userId: {}, message: {}";
        Object[] args = {
                entry.getLedgerIndex(),
                entry.getEventType().value(),
                entry.getUserId() == null ? "-" : UserIdMasker.mask(entry.getUserId()),
                entry.getMessage()
        };
        switch (entry.getComponent()) {
            case "validation", "security" -> log.warn(format, args);
            case "system" -> log.error(format, args);
            default -> log.info(format, args);
        }
    }
}
