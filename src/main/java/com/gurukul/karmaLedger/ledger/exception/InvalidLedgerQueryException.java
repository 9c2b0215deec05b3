package com.gurukul.karmaLedger.ledger.exception;

/**
 * Exception thrown when an audit trail query names an unknown filter value.
 */
public class InvalidLedgerQueryException extends RuntimeException {

    public InvalidLedgerQueryException(String message) {
        super(message);
    }
}
