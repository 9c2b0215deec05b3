package com.gurukul.karmaLedger.ledger.sink;

import com.gurukul.karmaLedger.ledger.model.LedgerChannel;

import java.io.IOException;

/**
 * Durable destination for sealed ledger entries.
 *
 * {@link #append} returns only once the line is durably written; any failure must be
 * reported as an exception so the ledger can keep its chain pointer where it was.
 */
public interface LedgerSink {

    /**
     * Appends one serialized entry to a channel.
     *
     * @param channel destination channel
     * @param line one JSON document, without a trailing newline
     * @throws IOException when the write could not be completed
     */
    void append(LedgerChannel channel, String line) throws IOException;
}
