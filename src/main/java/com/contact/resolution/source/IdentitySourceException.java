package com.contact.resolution.source;

import java.util.regex.Pattern;

/**
 * Failure reported by an {@link IdentitySource}.
 */
public class IdentitySourceException extends RuntimeException {

    private static final Pattern TIMEOUT_SIGNATURE = Pattern.compile("timed?\\s*out", Pattern.CASE_INSENSITIVE);

    private final boolean permissionError;

    public IdentitySourceException(String message, boolean permissionError) {
        super(message);
        this.permissionError = permissionError;
    }

    public IdentitySourceException(String message, boolean permissionError, Throwable cause) {
        super(message, cause);
        this.permissionError = permissionError;
    }

    public static IdentitySourceException permissionDenied(String message) {
        return new IdentitySourceException(message, true);
    }

    public boolean isPermissionError() {
        return permissionError;
    }

    /**
     * Whether the failure message carries the source's timeout signature
     * ("timed out", "timeout", "time out").
     */
    public boolean isTimeout() {
        return looksLikeTimeout(getMessage());
    }

    public static boolean looksLikeTimeout(String message) {
        return message != null && TIMEOUT_SIGNATURE.matcher(message).find();
    }
}
