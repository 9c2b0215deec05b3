package com.gurukul.karmaLedger.ledger.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of recomputing the hash chain over a sequence of entries.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChainVerificationReport {

    private boolean valid;
    private int entriesChecked;

    /**
     * Ledger index of the first and last entry checked; -1 when nothing was checked.
     */
    private long firstIndex;
    private long lastIndex;

    /**
     * Stored hash of the last entry checked.
     */
    private String headHash;

    /**
     * Indices whose stored hash or linkage does not match the recomputed chain.
     */
    private List<Long> tamperedIndices;

    /**
     * One human-readable line per problem found.
     */
    private List<String> issues;
}
