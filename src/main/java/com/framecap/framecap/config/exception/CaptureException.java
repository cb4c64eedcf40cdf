package com.framecap.framecap.config.exception;

/**
 * Session-level failure reported to the caller of a control operation
 */
public class CaptureException extends RuntimeException {

    private final ErrorKind kind;

    public CaptureException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CaptureException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static CaptureException resourceBusy(String message) {
        return new CaptureException(ErrorKind.RESOURCE_BUSY, message);
    }

    public static CaptureException wrongState(String message) {
        return new CaptureException(ErrorKind.WRONG_STATE, message);
    }

    public static CaptureException configuration(String message) {
        return new CaptureException(ErrorKind.CONFIGURATION_ERROR, message);
    }
}
