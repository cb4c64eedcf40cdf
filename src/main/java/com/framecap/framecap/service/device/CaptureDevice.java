package com.framecap.framecap.service.device;

import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameDimensions;

/**
 * Capture hardware as seen by the capture loop.
 *
 * Buffers handed to {@link #submit} belong to the device until they come back
 * from {@link #waitCompletion} or are dropped by {@link #cancelAll}. Completions
 * are delivered in submission order.
 */
public interface CaptureDevice {

    DeviceHandle open(long deviceId) throws DeviceException;

    void close(DeviceHandle handle);

    FrameDimensions maxFrameDimensions(DeviceHandle handle) throws DeviceException;

    void submit(DeviceHandle handle, FrameBuffer buffer) throws DeviceException;

    /**
     * Wait at most {@code timeoutMs} for the oldest submitted buffer
     */
    WaitResult waitCompletion(DeviceHandle handle, long timeoutMs);

    /**
     * Abort every outstanding buffer; they are marked cancelled and no longer owned by the device
     */
    void cancelAll(DeviceHandle handle) throws DeviceException;

    void startAcquisition(DeviceHandle handle) throws DeviceException;

    void stopAcquisition(DeviceHandle handle) throws DeviceException;

    /**
     * Human readable description of the opened device
     */
    default String describe(DeviceHandle handle) {
        return String.valueOf(handle);
    }
}
