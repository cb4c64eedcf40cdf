package com.framecap.framecap.service.device;

import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.framecap.framecap.config.CaptureProperties;
import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameDimensions;
import com.framecap.framecap.model.FrameStatus;

/**
 * Software camera producing a moving gradient at a fixed frame rate.
 *
 * Behaves like a queued hardware device: buffers are filled strictly in the order
 * they were submitted, only while acquisition is running, and a wait returns
 * TIMEOUT when no frame is due within the timeout.
 */
@Component
public class SimulatedCaptureDevice implements CaptureDevice {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedCaptureDevice.class);

    private final CaptureProperties properties;
    private final Object lock = new Object();
    private final Deque<FrameBuffer> pending = new ArrayDeque<>();

    private DeviceHandle openHandle;
    private boolean acquiring;
    private long nextFrameDueNanos;
    private long frameCount;
    private long startNanos;

    public SimulatedCaptureDevice(CaptureProperties properties) {
        this.properties = properties;
    }

    @Override
    public DeviceHandle open(long deviceId) throws DeviceException {
        synchronized (lock) {
            if (openHandle != null) {
                throw new DeviceException("Device already open: " + openHandle.getName());
            }
            openHandle = new DeviceHandle(deviceId, "simulator-" + deviceId);
            frameCount = 0;
            startNanos = System.nanoTime();
            logger.info("Opened simulated camera {}", openHandle.getName());
            return openHandle;
        }
    }

    @Override
    public void close(DeviceHandle handle) {
        synchronized (lock) {
            if (openHandle == null || !openHandle.equals(handle)) {
                return;
            }
            pending.clear();
            acquiring = false;
            openHandle = null;
            logger.info("Closed simulated camera {}", handle.getName());
        }
    }

    @Override
    public FrameDimensions maxFrameDimensions(DeviceHandle handle) throws DeviceException {
        synchronized (lock) {
            checkHandle(handle);
            return new FrameDimensions(
                    properties.getSimulatorWidth(),
                    properties.getSimulatorHeight(),
                    properties.getSimulatorBitsPerPixel());
        }
    }

    @Override
    public void submit(DeviceHandle handle, FrameBuffer buffer) throws DeviceException {
        synchronized (lock) {
            checkHandle(handle);
            pending.addLast(buffer);
            lock.notifyAll();
        }
    }

    @Override
    public WaitResult waitCompletion(DeviceHandle handle, long timeoutMs) {
        long deadline = System.nanoTime() + timeoutMs * 1_000_000L;

        synchronized (lock) {
            try {
                while (true) {
                    if (openHandle == null || !openHandle.equals(handle)) {
                        return WaitResult.error("Device is not open");
                    }

                    long now = System.nanoTime();
                    if (acquiring && !pending.isEmpty() && now >= nextFrameDueNanos) {
                        FrameBuffer buffer = pending.pollFirst();
                        fillTestPattern(buffer);
                        nextFrameDueNanos = Math.max(nextFrameDueNanos + framePeriodNanos(), now);
                        return WaitResult.completed(buffer, FrameStatus.OK, now - startNanos);
                    }

                    long remaining = deadline - now;
                    if (remaining <= 0) {
                        return WaitResult.timeout();
                    }

                    long sleepNanos = remaining;
                    if (acquiring && !pending.isEmpty()) {
                        sleepNanos = Math.min(remaining, nextFrameDueNanos - now);
                    }
                    long millis = Math.max(1, sleepNanos / 1_000_000L);
                    lock.wait(millis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return WaitResult.error("Interrupted while waiting for frame");
            }
        }
    }

    @Override
    public void cancelAll(DeviceHandle handle) throws DeviceException {
        synchronized (lock) {
            checkHandle(handle);
            for (FrameBuffer buffer : pending) {
                buffer.setStatus(FrameStatus.CANCELLED);
            }
            pending.clear();
            lock.notifyAll();
        }
    }

    @Override
    public void startAcquisition(DeviceHandle handle) throws DeviceException {
        synchronized (lock) {
            checkHandle(handle);
            acquiring = true;
            nextFrameDueNanos = System.nanoTime();
            lock.notifyAll();
        }
    }

    @Override
    public void stopAcquisition(DeviceHandle handle) throws DeviceException {
        synchronized (lock) {
            checkHandle(handle);
            acquiring = false;
            lock.notifyAll();
        }
    }

    @Override
    public String describe(DeviceHandle handle) {
        return "Camera infos:"
                + "\n    UniqueId .......... " + handle.getDeviceId()
                + "\n    CameraName ........ " + handle.getName()
                + "\n    ModelName ......... software test pattern"
                + "\n    Sensor ............ " + properties.getSimulatorWidth() + "x"
                + properties.getSimulatorHeight() + "@" + properties.getSimulatorBitsPerPixel();
    }

    private void checkHandle(DeviceHandle handle) throws DeviceException {
        if (openHandle == null || !openHandle.equals(handle)) {
            throw new DeviceException("Device is not open");
        }
    }

    private long framePeriodNanos() {
        double fps = properties.getSimulatorFrameRate();
        if (fps <= 0) {
            fps = 10.0;
        }
        return (long) (1_000_000_000L / fps);
    }

    /**
     * Diagonal gradient that shifts by one pixel per frame.
     * Pixels wider than 8 bits are stored as little-endian 16 bit words.
     */
    private void fillTestPattern(FrameBuffer buffer) {
        int width = properties.getSimulatorWidth();
        int height = properties.getSimulatorHeight();
        int bits = properties.getSimulatorBitsPerPixel();
        int maxValue = (1 << Math.min(bits, 16)) - 1;
        byte[] data = buffer.getData();
        long shift = frameCount++;

        buffer.setWidth(width);
        buffer.setHeight(height);
        buffer.setBitsPerPixel(bits);
        buffer.setStatus(FrameStatus.OK);

        if (bits <= 8) {
            for (int y = 0; y < height; y++) {
                int row = y * width;
                for (int x = 0; x < width; x++) {
                    data[row + x] = (byte) ((x + y + shift) & maxValue);
                }
            }
        } else {
            int scale = Math.max(1, maxValue / (width + height));
            for (int y = 0; y < height; y++) {
                int row = y * width * 2;
                for (int x = 0; x < width; x++) {
                    int value = (int) (((x + y + shift) * scale) & maxValue);
                    data[row + 2 * x] = (byte) value;
                    data[row + 2 * x + 1] = (byte) (value >>> 8);
                }
            }
        }
    }
}
