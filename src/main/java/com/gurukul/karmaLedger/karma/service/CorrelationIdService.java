package com.gurukul.karmaLedger.karma.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Generates request ids that tie ledger entries of one HTTP call together.
 */
@Service
public class CorrelationIdService {

    /**
     * Returns the caller's request id when present, otherwise a new UUID.
     */
    public String resolve(String requestId) {
        if (requestId != null && !requestId.isBlank()) {
            return requestId.trim();
        }
        return UUID.randomUUID().toString();
    }
}
