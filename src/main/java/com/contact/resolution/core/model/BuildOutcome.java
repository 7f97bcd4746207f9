package com.contact.resolution.core.model;

/**
 * How the most recent contact index build ended.
 */
public enum BuildOutcome {
    /** The identity source answered; the index holds its contacts. */
    LOADED,
    /** The identity source refused access; the index is empty until the TTL elapses. */
    PERMISSION_DENIED,
    /** Any other source failure; the index is empty until the TTL elapses. */
    FAILED
}
