package com.gurukul.karmaLedger.karma.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Urgency of a corrective recommendation. The rank is the secondary sort key.
 */
public enum Urgency {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;

    Urgency(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
