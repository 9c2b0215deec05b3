package com.gurukul.karmaLedger.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of events recorded in the ledger.
 */
public enum LedgerEventType {
    API_REQUEST("api_request", LedgerLevel.INFO),
    API_RESPONSE("api_response", LedgerLevel.INFO),
    VALIDATION_ERROR("validation_error", LedgerLevel.WARNING),
    KARMA_ACTION("karma_action", LedgerLevel.INFO),
    ATONEMENT("atonement", LedgerLevel.INFO),
    SYSTEM_ERROR("system_error", LedgerLevel.ERROR),
    SECURITY_EVENT("security_event", LedgerLevel.WARNING),
    PERFORMANCE_METRIC("performance_metric", LedgerLevel.INFO);

    private final String value;
    private final LedgerLevel defaultLevel;

    LedgerEventType(String value, LedgerLevel defaultLevel) {
        this.value = value;
        this.defaultLevel = defaultLevel;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Level used when the caller does not pick one.
     */
    public LedgerLevel defaultLevel() {
        return defaultLevel;
    }

    /**
     * Resolves a wire value such as "karma_action" (or the enum name).
     *
     * @return the event type, or null when the value is unknown
     */
    @JsonCreator
    public static LedgerEventType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (LedgerEventType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
