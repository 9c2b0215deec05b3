package com.gurukul.karmaLedger.karma.model;

import lombok.Value;

/**
 * One canonical Rnanubandhan (karmic debt) record.
 * Amount is always a non-negative magnitude; severity is a free label resolved
 * against the multiplier table at scoring time.
 */
@Value
public class DebtRecord {

    String severity;
    double amount;

    public static DebtRecord of(String severity, double amount) {
        return new DebtRecord(severity, Math.abs(amount));
    }
}
