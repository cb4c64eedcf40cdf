package com.framecap.framecap.model.event;

import org.springframework.context.ApplicationEvent;

import com.framecap.framecap.config.exception.CaptureException;

/**
 * Published when a running capture session is aborted
 */
public class CaptureErrorEvent extends ApplicationEvent {

    private final long deviceId;
    private final CaptureException error;

    public CaptureErrorEvent(Object source, long deviceId, CaptureException error) {
        super(source);
        this.deviceId = deviceId;
        this.error = error;
    }

    public long getDeviceId() {
        return deviceId;
    }

    public CaptureException getError() {
        return error;
    }
}
