package com.gurukul.karmaLedger.ledger.model;

/**
 * Durable channels an entry can be written to, one file each.
 */
public enum LedgerChannel {
    API("api.jsonl"),
    AUDIT("audit.jsonl"),
    ERRORS("errors.jsonl");

    private final String fileName;

    LedgerChannel(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }

    /**
     * Picks the channel for an entry: "api" traffic goes to the API channel, the
     * "system" component and anything at ERROR or above go to the error channel,
     * everything else to the audit channel.
     */
    public static LedgerChannel forEntry(String component, LedgerLevel level) {
        if ("api".equals(component)) {
            return API;
        }
        if ("system".equals(component) || (level != null && level.isErrorOrWorse())) {
            return ERRORS;
        }
        return AUDIT;
    }
}
