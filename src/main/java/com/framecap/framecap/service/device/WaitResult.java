package com.framecap.framecap.service.device;

import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameStatus;

import lombok.Getter;

/**
 * Outcome of a bounded completion wait: completed, timed out, or failed
 */
@Getter
public final class WaitResult {

    public enum Kind {
        COMPLETED,
        TIMEOUT,
        ERROR
    }

    private static final WaitResult TIMEOUT = new WaitResult(Kind.TIMEOUT, null, null, 0L, null);

    private final Kind kind;
    private final FrameBuffer buffer;
    private final FrameStatus status;
    private final long deviceTimestamp;
    private final String errorMessage;

    private WaitResult(Kind kind, FrameBuffer buffer, FrameStatus status, long deviceTimestamp, String errorMessage) {
        this.kind = kind;
        this.buffer = buffer;
        this.status = status;
        this.deviceTimestamp = deviceTimestamp;
        this.errorMessage = errorMessage;
    }

    public static WaitResult completed(FrameBuffer buffer, FrameStatus status, long deviceTimestamp) {
        return new WaitResult(Kind.COMPLETED, buffer, status, deviceTimestamp, null);
    }

    public static WaitResult timeout() {
        return TIMEOUT;
    }

    public static WaitResult error(String errorMessage) {
        return new WaitResult(Kind.ERROR, null, null, 0L, errorMessage);
    }

    public boolean isCompleted() {
        return kind == Kind.COMPLETED;
    }

    public boolean isTimeout() {
        return kind == Kind.TIMEOUT;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }
}
