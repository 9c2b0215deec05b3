package com.gurukul.karmaLedger.ledger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gurukul.karmaLedger.ledger.model.AuditTrailExport;
import com.gurukul.karmaLedger.ledger.model.ChainVerificationReport;
import com.gurukul.karmaLedger.ledger.model.LedgerEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Writes audit trail exports and reads them back for offline verification.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditTrailExporter {

    private final HashChain hashChain;
    private final ObjectMapper objectMapper;

    /**
     * Verifies the given entries and writes them, with the report, to {@code destination}.
     *
     * @return the verification report embedded in the export
     * @throws UncheckedIOException when the file cannot be written
     */
    public ChainVerificationReport export(List<LedgerEntry> entries, Path destination) {
        ChainVerificationReport report = hashChain.verify(entries);
        AuditTrailExport export = AuditTrailExport.builder()
                .exportedAt(Instant.now().toString())
                .genesisHash(HashChain.GENESIS_HASH)
                .entryCount(entries.size())
                .verification(report)
                .entries(List.copyOf(entries))
                .build();
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(destination.toFile(), export);
        } catch (IOException e) {
            log.error("Audit trail export failed - destination: {}", destination, e);
            throw new UncheckedIOException("Failed to export audit trail to " + destination, e);
        }
        log.info("Audit trail exported - destination: {}, entries: {}, valid: {}",
                destination, entries.size(), report.isValid());
        return report;
    }

    /**
     * @throws UncheckedIOException when the file cannot be read or parsed
     */
    public AuditTrailExport read(Path source) {
        try {
            return objectMapper.readValue(source.toFile(), AuditTrailExport.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit trail export " + source, e);
        }
    }

    /**
     * Re-verifies the entries of an export file, ignoring the report stored in it.
     */
    public ChainVerificationReport verifyExport(Path source) {
        AuditTrailExport export = read(source);
        List<LedgerEntry> entries = export.getEntries() == null ? List.of() : export.getEntries();
        return hashChain.verify(entries);
    }
}
