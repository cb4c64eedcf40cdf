package com.framecap.framecap.service.capture;

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.framecap.framecap.config.CaptureProperties;
import com.framecap.framecap.config.exception.CaptureException;
import com.framecap.framecap.config.exception.ErrorKind;
import com.framecap.framecap.model.CaptureState;
import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameInfo;
import com.framecap.framecap.model.FrameStatus;
import com.framecap.framecap.service.device.CaptureDevice;
import com.framecap.framecap.service.device.DeviceException;
import com.framecap.framecap.service.device.DeviceHandle;
import com.framecap.framecap.service.device.WaitResult;
import com.framecap.framecap.service.pool.FrameBufferPool;

/**
 * Owns the capture thread and drives buffers between the device and the pool queues.
 *
 * Loop body, see {@link #step()}:
 * 1. Submit every recycled buffer to the device
 * 2. Wait (bounded) for the oldest in-flight buffer
 * 3. On completion stamp a FrameInfo, move it to the completed queue, notify
 *
 * A device error aborts the session; stop is checked once per iteration. Both paths
 * hand every in-flight buffer back to the recycled queue before returning to IDLE.
 */
public class CaptureController {

    private static final Logger logger = LoggerFactory.getLogger(CaptureController.class);

    private final CaptureDevice device;
    private final DeviceHandle handle;
    private final FrameBufferPool pool;
    private final CaptureListener listener;

    private final long pollTimeoutMs;
    private final long loopPauseMs;
    private final long stopTimeoutMs;
    private final int watchdogTimeouts;

    private final AtomicReference<CaptureState> state = new AtomicReference<>(CaptureState.IDLE);
    private final ReentrantLock sessionLock = new ReentrantLock();
    private volatile boolean stopRequested = false;
    private volatile Thread captureThread;

    // Guarded by sessionLock
    private long lastSequenceId = 0;
    private int consecutiveTimeouts = 0;
    private boolean starving = false;

    private final AtomicLong framesCompleted = new AtomicLong();
    private final AtomicLong framesFailed = new AtomicLong();
    private final AtomicLong starvationCount = new AtomicLong();
    private volatile CaptureException lastError;
    private volatile long startedAtMillis;

    public CaptureController(CaptureDevice device, DeviceHandle handle, FrameBufferPool pool,
                             CaptureListener listener, CaptureProperties properties) {
        this.device = device;
        this.handle = handle;
        this.pool = pool;
        this.listener = listener;
        this.pollTimeoutMs = properties.getPollTimeoutMs();
        this.loopPauseMs = properties.getLoopPauseMs();
        this.stopTimeoutMs = properties.getStopTimeoutMs();
        this.watchdogTimeouts = properties.getWatchdogTimeouts();
    }

    /**
     * Submit the whole pool to the device, start acquisition and launch the capture thread.
     *
     * @throws CaptureException WRONG_STATE unless idle, DEVICE_ERROR if the device refuses;
     *                          in that case every buffer is back in the recycled queue
     */
    public void start() {
        beginCapture();

        Thread t = new Thread(this::runLoop);
        t.setName("capture-" + handle.getDeviceId());
        captureThread = t;
        t.start();
    }

    /**
     * Everything {@link #start()} does except launching the thread
     */
    void beginCapture() {
        sessionLock.lock();
        try {
            if (state.get() != CaptureState.IDLE) {
                throw CaptureException.wrongState("Cannot start capturing while " + state.get());
            }
            // cleared before leaving IDLE so a stop() issued during STARTING is kept
            stopRequested = false;
            state.set(CaptureState.STARTING);
            consecutiveTimeouts = 0;
            starving = false;
            captureThread = null;

            List<FrameBuffer> toSubmit = pool.recycled().drain();
            try {
                Iterator<FrameBuffer> it = toSubmit.iterator();
                while (it.hasNext()) {
                    FrameBuffer buffer = it.next();
                    it.remove();
                    submit(buffer);
                }
                device.startAcquisition(handle);
            } catch (DeviceException e) {
                logger.error("Cannot start capturing on {}: {}", handle.getName(), e.getMessage());
                for (FrameBuffer buffer : toSubmit) {
                    pool.recycled().push(buffer);
                }
                cancelOutstanding();
                state.set(CaptureState.IDLE);
                throw new CaptureException(ErrorKind.DEVICE_ERROR,
                        "Cannot start capturing: " + e.getMessage(), e);
            }

            startedAtMillis = System.currentTimeMillis();
            state.set(CaptureState.RUNNING);
        } finally {
            sessionLock.unlock();
        }

        logger.info("Capturing started on {} with {} buffers", handle.getName(), pool.capacity());
        notifySafely(listener::onStarted);
    }

    /**
     * Request the loop to stop and wait until it has recovered all buffers.
     * No-op when already idle; safe to call from any thread.
     */
    public void stop() {
        if (state.get() == CaptureState.IDLE) {
            return;
        }
        requestStop();

        Thread t = captureThread;
        if (t == null) {
            // Driven without a thread (or still starting): unwind here
            step();
            return;
        }
        if (t == Thread.currentThread()) {
            return;
        }

        try {
            t.join(stopTimeoutMs);
            if (t.isAlive()) {
                logger.warn("Capture thread {} did not stop within {} ms, interrupting", t.getName(), stopTimeoutMs);
                t.interrupt();
                t.join(stopTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void requestStop() {
        stopRequested = true;
    }

    /**
     * One iteration of the capture loop.
     *
     * @return false once the loop should end (stopped or aborted)
     */
    boolean step() {
        sessionLock.lock();
        try {
            if (state.get() != CaptureState.RUNNING) {
                return false;
            }
            if (stopRequested) {
                finishStop();
                return false;
            }

            try {
                submitRecycled();

                if (pool.inFlight().isEmpty()) {
                    reportStarvation();
                    return true;
                }

                WaitResult result = device.waitCompletion(handle, pollTimeoutMs);
                if (result.isTimeout()) {
                    onTimeout();
                } else if (result.isError() && stopRequested) {
                    // wait cut short by stop(), not a device failure
                    logger.debug("Wait for frame ended by stop: {}", result.getErrorMessage());
                    finishStop();
                    return false;
                } else if (result.isError()) {
                    throw new DeviceException("Failed to wait for frame: " + result.getErrorMessage());
                } else {
                    completeFrame(result);
                }
                return true;

            } catch (DeviceException e) {
                abort(e);
                return false;
            }
        } finally {
            sessionLock.unlock();
        }
    }

    private void runLoop() {
        logger.debug("Capture loop running on {}", Thread.currentThread().getName());
        try {
            while (step()) {
                pause();
            }
        } catch (RuntimeException e) {
            logger.error("Capture loop failed: {}", e.getMessage(), e);
            abort(new DeviceException("Capture loop failed: " + e.getMessage(), e));
        }
        logger.debug("Capture loop finished on {}", Thread.currentThread().getName());
    }

    private void pause() {
        if (loopPauseMs <= 0) {
            Thread.yield();
            return;
        }
        try {
            Thread.sleep(loopPauseMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
    }

    private void submitRecycled() throws DeviceException {
        FrameBuffer buffer;
        while ((buffer = pool.recycled().pop()) != null) {
            submit(buffer);
        }
    }

    private void submit(FrameBuffer buffer) throws DeviceException {
        buffer.setSubmittedAtNanos(System.nanoTime());
        pool.inFlight().push(buffer);
        device.submit(handle, buffer);
        starving = false;
    }

    private void reportStarvation() {
        if (starving) {
            return;
        }
        starving = true;
        starvationCount.incrementAndGet();
        logger.warn("Capture queue is empty, all {} buffers are held by consumers", pool.capacity());
        notifySafely(listener::onStarvation);
    }

    private void onTimeout() throws DeviceException {
        consecutiveTimeouts++;
        if (watchdogTimeouts > 0 && consecutiveTimeouts >= watchdogTimeouts) {
            throw new DeviceException("Device unresponsive: no frame after "
                    + consecutiveTimeouts + " waits of " + pollTimeoutMs + " ms");
        }
        logger.trace("Wait for frame timed out ({} in a row)", consecutiveTimeouts);
    }

    private void completeFrame(WaitResult result) throws DeviceException {
        FrameBuffer oldest = pool.inFlight().peek();
        if (result.getBuffer() != oldest) {
            throw new DeviceException("Device completed " + result.getBuffer()
                    + " out of order, expected " + oldest);
        }

        FrameBuffer buffer = pool.inFlight().pop();
        long hostTimestamp = System.currentTimeMillis();
        FrameStatus status = result.getStatus() != null ? result.getStatus() : FrameStatus.OK;

        FrameInfo info = FrameInfo.builder()
                .sequenceId(++lastSequenceId)
                .status(status)
                .deviceTimestamp(result.getDeviceTimestamp())
                .hostTimestamp(hostTimestamp)
                .readoutLatency(System.nanoTime() - buffer.getSubmittedAtNanos())
                .build();

        buffer.setSequenceId(info.getSequenceId());
        buffer.setStatus(status);
        buffer.setCaptureTimestamp(hostTimestamp);
        buffer.setFrameInfo(info);
        pool.completed().push(buffer);

        consecutiveTimeouts = 0;
        framesCompleted.incrementAndGet();
        if (status != FrameStatus.OK) {
            framesFailed.incrementAndGet();
        }

        notifySafely(() -> listener.onFrameReady(info));
    }

    /**
     * Session-fatal unwind: runs at most once per running session
     */
    private void abort(DeviceException cause) {
        CaptureException error;
        sessionLock.lock();
        try {
            if (!state.compareAndSet(CaptureState.RUNNING, CaptureState.STOPPING)) {
                return;
            }
            logger.error("Capturing aborted on {}: {}", handle.getName(), cause.getMessage());
            shutdownDevice();
            error = new CaptureException(ErrorKind.DEVICE_ERROR, cause.getMessage(), cause);
            lastError = error;
            state.set(CaptureState.IDLE);
        } finally {
            sessionLock.unlock();
        }

        notifySafely(() -> listener.onCaptureError(error));
        notifySafely(listener::onStopped);
    }

    private void finishStop() {
        state.set(CaptureState.STOPPING);
        shutdownDevice();
        state.set(CaptureState.IDLE);
        logger.info("Capturing stopped on {} after {} frames", handle.getName(), framesCompleted.get());
        notifySafely(listener::onStopped);
    }

    private void shutdownDevice() {
        try {
            device.stopAcquisition(handle);
        } catch (DeviceException e) {
            logger.warn("Cannot stop image acquisition: {}", e.getMessage());
        }
        cancelOutstanding();
    }

    /**
     * Cancel everything on the device and move it back to the recycled queue
     */
    private void cancelOutstanding() {
        try {
            device.cancelAll(handle);
        } catch (DeviceException e) {
            logger.warn("Cannot clear frame queue: {}", e.getMessage());
        }

        List<FrameBuffer> outstanding = pool.inFlight().drain();
        for (FrameBuffer buffer : outstanding) {
            buffer.setStatus(FrameStatus.CANCELLED);
            pool.recycled().push(buffer);
        }
        if (!outstanding.isEmpty()) {
            logger.debug("Recovered {} cancelled buffers", outstanding.size());
        }
    }

    private void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            logger.warn("Capture listener failed: {}", e.getMessage(), e);
        }
    }

    public CaptureState getState() {
        return state.get();
    }

    public boolean isRunning() {
        CaptureState current = state.get();
        return current == CaptureState.RUNNING || current == CaptureState.STARTING;
    }

    public long getFramesCompleted() {
        return framesCompleted.get();
    }

    public long getFramesFailed() {
        return framesFailed.get();
    }

    public long getStarvationCount() {
        return starvationCount.get();
    }

    public CaptureException getLastError() {
        return lastError;
    }

    public long getStartedAtMillis() {
        return startedAtMillis;
    }
}
