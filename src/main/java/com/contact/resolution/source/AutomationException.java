package com.contact.resolution.source;

/**
 * Failure raised by the OS automation layer. Carries the target app and the
 * raw diagnostic output so callers can tell "permission denied" and "app did
 * not respond" apart from other failures.
 */
public class AutomationException extends RuntimeException {

    private final String app;
    private final boolean permissionError;
    private final String stderr;

    public AutomationException(String message, String app, boolean permissionError) {
        this(message, app, permissionError, null);
    }

    public AutomationException(String message, String app, boolean permissionError, String stderr) {
        super(message);
        this.app = app;
        this.permissionError = permissionError;
        this.stderr = stderr;
    }

    public String getApp() {
        return app;
    }

    public boolean isPermissionError() {
        return permissionError;
    }

    public String getStderr() {
        return stderr;
    }
}
