package com.contact.resolution.search;

/**
 * Raised when a targeted contact name search could not be answered, as
 * opposed to answered with no match. Permission denials are not reported
 * through this exception; they resolve to "no match".
 */
public class ContactSearchException extends RuntimeException {

    private final boolean timeout;

    public ContactSearchException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    /**
     * Whether the identity source gave up because it ran out of time.
     */
    public boolean isTimeout() {
        return timeout;
    }
}
