package com.gurukul.karmaLedger.ledger.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * File format for an exported audit trail: every retained entry with its index and
 * hash, plus the verification result at export time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditTrailExport {

    private String exportedAt;
    private String genesisHash;
    private int entryCount;
    private ChainVerificationReport verification;
    private List<LedgerEntry> entries;
}
