package com.contact.resolution.core.model;

/**
 * Classification of a raw handle string before normalization.
 * {@link #UNKNOWN} covers input that is neither email-shaped nor long enough
 * to be a phone number; such handles are never looked up.
 */
public enum HandleKind {
    PHONE,
    EMAIL,
    UNKNOWN
}
