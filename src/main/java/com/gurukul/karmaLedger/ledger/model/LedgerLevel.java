package com.gurukul.karmaLedger.ledger.model;

public enum LedgerLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isErrorOrWorse() {
        return this == ERROR || this == CRITICAL;
    }
}
