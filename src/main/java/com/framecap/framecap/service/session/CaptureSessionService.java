package com.framecap.framecap.service.session;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.framecap.framecap.config.CaptureProperties;
import com.framecap.framecap.config.exception.CaptureException;
import com.framecap.framecap.config.exception.ErrorKind;
import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameDimensions;
import com.framecap.framecap.model.FrameInfo;
import com.framecap.framecap.model.SessionState;
import com.framecap.framecap.model.StreamingFrame;
import com.framecap.framecap.model.event.CaptureErrorEvent;
import com.framecap.framecap.model.event.FrameFinishedEvent;
import com.framecap.framecap.service.capture.CaptureController;
import com.framecap.framecap.service.capture.CaptureListener;
import com.framecap.framecap.service.consumer.ConsumerPipeline;
import com.framecap.framecap.service.consumer.ImageStreamerStage;
import com.framecap.framecap.service.consumer.ImageWriterStage;
import com.framecap.framecap.service.device.CaptureDevice;
import com.framecap.framecap.service.device.DeviceException;
import com.framecap.framecap.service.device.DeviceHandle;
import com.framecap.framecap.service.pool.FrameBufferPool;

import jakarta.annotation.PreDestroy;

/**
 * Control layer for one camera: open, start, stop, close.
 *
 * Listener callbacks arrive on the capture thread and only read volatile fields,
 * never the session lock, so a close can join the capture thread while holding it.
 */
@Service
public class CaptureSessionService implements CaptureListener {

    private static final Logger logger = LoggerFactory.getLogger(CaptureSessionService.class);

    private final CaptureDevice device;
    private final CaptureProperties properties;
    private final ImageStreamerStage streamer;
    private final ImageWriterStage writer;
    private final ApplicationEventPublisher eventPublisher;

    private final Object sessionLock = new Object();
    private volatile int bufferCount;

    private volatile DeviceHandle handle;
    private volatile FrameBufferPool pool;
    private volatile ConsumerPipeline pipeline;
    private volatile CaptureController controller;
    private volatile long framesAtStart;

    public CaptureSessionService(CaptureDevice device, CaptureProperties properties,
                                 ImageStreamerStage streamer, ImageWriterStage writer,
                                 ApplicationEventPublisher eventPublisher) {
        this.device = device;
        this.properties = properties;
        this.streamer = streamer;
        this.writer = writer;
        this.eventPublisher = eventPublisher;
        this.bufferCount = properties.getNumBuffers();
    }

    /**
     * Open the device and allocate the frame buffers for its largest frame
     *
     * @return description of the opened device
     */
    public String openSession(long deviceId) {
        synchronized (sessionLock) {
            if (handle != null) {
                throw CaptureException.wrongState("Camera " + handle.getName() + " is already open");
            }

            DeviceHandle opened;
            try {
                opened = device.open(deviceId);
            } catch (DeviceException e) {
                throw new CaptureException(ErrorKind.DEVICE_ERROR,
                        "Cannot open camera " + deviceId + ": " + e.getMessage(), e);
            }

            FrameBufferPool newPool;
            try {
                newPool = FrameBufferPool.allocate(bufferCount, bufferSizeFor(opened));
            } catch (CaptureException e) {
                device.close(opened);
                throw e;
            }

            pool = newPool;
            pipeline = new ConsumerPipeline(newPool, List.of(streamer, writer));
            controller = new CaptureController(device, opened, newPool, this, properties);
            handle = opened;

            String description = device.describe(opened);
            logger.info("Camera {} opened with {} buffers\n{}", opened.getName(), bufferCount, description);
            return description;
        }
    }

    public void startCapture() {
        synchronized (sessionLock) {
            requireOpen().start();
        }
    }

    /**
     * Stop capturing and wait for the capture thread. No-op when not capturing.
     */
    public void stopCapture() {
        synchronized (sessionLock) {
            CaptureController current = controller;
            if (current != null) {
                current.stop();
            }
        }
    }

    /**
     * Stop, drain the consumers, release the buffers and close the device. No-op when closed.
     *
     * @throws CaptureException RESOURCE_BUSY if a consumer does not give its buffers back;
     *                          the session then stays open
     */
    public void closeSession() {
        synchronized (sessionLock) {
            if (handle == null) {
                return;
            }
            controller.stop();

            if (!pipeline.awaitIdle(properties.getStopTimeoutMs())) {
                logger.warn("Consumers still busy while closing, {} buffers held", pipeline.heldCount());
            }
            FrameBuffer left;
            while ((left = pool.completed().pop()) != null) {
                logger.debug("Recycling unconsumed frame {}", left.getSequenceId());
                pool.recycle(left);
            }

            pool.release();
            device.close(handle);
            logger.info("Camera {} closed", handle.getName());

            handle = null;
            controller = null;
            pipeline = null;
            pool = null;
        }
    }

    /**
     * Number of buffers used by the next session
     */
    public void setBufferCount(int count) {
        if (count < 1) {
            throw CaptureException.configuration("Buffer count must be at least 1, got " + count);
        }
        synchronized (sessionLock) {
            if (handle != null) {
                throw CaptureException.resourceBusy("Cannot change buffer count while the camera is open");
            }
            bufferCount = count;
            logger.info("Buffer count set to {}", count);
        }
    }

    public int getBufferCount() {
        return bufferCount;
    }

    public SessionState getState() {
        CaptureController current = controller;
        if (handle == null || current == null) {
            return SessionState.CLOSED;
        }
        return current.isRunning() ? SessionState.CAPTURING : SessionState.OPEN;
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("state", getState().getLabel());
        stats.put("bufferCount", getBufferCount());

        CaptureController current = controller;
        FrameBufferPool currentPool = pool;
        DeviceHandle currentHandle = handle;
        if (current == null || currentPool == null || currentHandle == null) {
            return stats;
        }

        stats.put("camera", currentHandle.getName());
        stats.put("framesCompleted", current.getFramesCompleted());
        stats.put("framesFailed", current.getFramesFailed());
        stats.put("framesPerSecond", framesPerSecond(current));
        stats.put("starvationCount", current.getStarvationCount());
        stats.put("pool", currentPool.snapshot());
        stats.put("bufferSize", currentPool.getBufferSize());
        stats.put("archive", Map.of("requested", writer.getRequested(), "written", writer.getWritten()));

        CaptureException lastError = current.getLastError();
        if (lastError != null) {
            stats.put("lastError", lastError.getMessage());
        }
        return stats;
    }

    /**
     * Arm the archive stage to persist the next {@code count} frames, one every {@code stepping}
     */
    public void writeNextFrames(int count, int stepping) {
        if (count < 0) {
            throw CaptureException.configuration("Frame count cannot be negative, got " + count);
        }
        if (stepping < 1) {
            throw CaptureException.configuration("Stepping must be at least 1, got " + stepping);
        }
        writer.writeNextFrames(count, stepping);
    }

    public StreamingFrame getLatestFrame() {
        return streamer.getLatestFrame();
    }

    @PreDestroy
    public void shutdown() {
        try {
            closeSession();
        } catch (CaptureException e) {
            logger.error("Cannot close camera on shutdown: {}", e.getMessage());
        }
    }

    // Capture thread callbacks

    @Override
    public void onFrameReady(FrameInfo frameInfo) {
        ConsumerPipeline current = pipeline;
        if (current != null) {
            current.frameReady();
        }
        eventPublisher.publishEvent(new FrameFinishedEvent(this, frameInfo));
    }

    @Override
    public void onStarvation() {
        logger.debug("Capture starved, waiting for consumers to release buffers");
    }

    @Override
    public void onCaptureError(CaptureException error) {
        DeviceHandle current = handle;
        eventPublisher.publishEvent(new CaptureErrorEvent(this, current != null ? current.getDeviceId() : -1, error));
    }

    @Override
    public void onStarted() {
        CaptureController current = controller;
        framesAtStart = current != null ? current.getFramesCompleted() : 0;
    }

    private CaptureController requireOpen() {
        CaptureController current = controller;
        if (current == null) {
            throw CaptureException.wrongState("Camera is not open");
        }
        return current;
    }

    private int bufferSizeFor(DeviceHandle opened) {
        try {
            FrameDimensions dimensions = device.maxFrameDimensions(opened);
            return FrameBufferPool.bufferSizeFor(dimensions);
        } catch (DeviceException e) {
            throw new CaptureException(ErrorKind.CONFIGURATION_ERROR,
                    "Cannot get maximum frame size: " + e.getMessage(), e);
        }
    }

    private double framesPerSecond(CaptureController current) {
        if (!current.isRunning()) {
            return 0.0;
        }
        long elapsed = System.currentTimeMillis() - current.getStartedAtMillis();
        if (elapsed <= 0) {
            return 0.0;
        }
        return (current.getFramesCompleted() - framesAtStart) * 1000.0 / elapsed;
    }
}
