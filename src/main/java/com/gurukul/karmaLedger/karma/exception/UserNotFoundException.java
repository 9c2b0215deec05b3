package com.gurukul.karmaLedger.karma.exception;

/**
 * Exception thrown when no user document exists for the requested id.
 */
public class UserNotFoundException extends RuntimeException {

    public UserNotFoundException(String message) {
        super(message);
    }
}
