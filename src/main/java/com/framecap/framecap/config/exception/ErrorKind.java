package com.framecap.framecap.config.exception;

import org.springframework.http.HttpStatus;

/**
 * Error classes surfaced by the capture pipeline, with the HTTP status the REST layer reports
 */
public enum ErrorKind {
    RESOURCE_BUSY(HttpStatus.CONFLICT),
    WRONG_STATE(HttpStatus.CONFLICT),
    DEVICE_ERROR(HttpStatus.BAD_GATEWAY),
    CONFIGURATION_ERROR(HttpStatus.BAD_REQUEST),
    RESOURCE_EXHAUSTED(HttpStatus.INSUFFICIENT_STORAGE);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
