package com.framecap.framecap.service.capture;

import com.framecap.framecap.config.exception.CaptureException;
import com.framecap.framecap.model.FrameInfo;

/**
 * Notifications emitted by the capture loop. All callbacks run on the capture thread
 * and must return quickly.
 */
public interface CaptureListener {

    /**
     * A buffer has been moved to the completed queue
     */
    default void onFrameReady(FrameInfo frameInfo) {
    }

    /**
     * Nothing is left with the device because consumers still hold every buffer
     */
    default void onStarvation() {
    }

    /**
     * The running session was aborted; buffers are already recovered
     */
    default void onCaptureError(CaptureException error) {
    }

    default void onStarted() {
    }

    default void onStopped() {
    }
}
