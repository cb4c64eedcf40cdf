package com.framecap.framecap.service.pool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.framecap.framecap.config.exception.CaptureException;
import com.framecap.framecap.config.exception.ErrorKind;
import com.framecap.framecap.model.BufferLocation;
import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameDimensions;
import com.framecap.framecap.model.PoolStats;

/**
 * Fixed set of preallocated frame buffers and the three queues they circulate through.
 *
 * Buffers are never freed one by one; the pool is released as a unit once every
 * buffer is back in the recycled queue.
 */
public class FrameBufferPool {

    private static final Logger logger = LoggerFactory.getLogger(FrameBufferPool.class);

    private final List<FrameBuffer> buffers;
    private final int bufferSize;
    private final FrameQueue recycled;
    private final FrameQueue inFlight;
    private final FrameQueue completed;
    private volatile boolean released = false;

    private FrameBufferPool(List<FrameBuffer> buffers, int bufferSize) {
        this.buffers = Collections.unmodifiableList(buffers);
        this.bufferSize = bufferSize;
        this.recycled = new FrameQueue(BufferLocation.RECYCLED, buffers.size());
        this.inFlight = new FrameQueue(BufferLocation.IN_FLIGHT, buffers.size());
        this.completed = new FrameQueue(BufferLocation.COMPLETED, buffers.size());
        for (FrameBuffer buffer : buffers) {
            recycled.push(buffer);
        }
    }

    /**
     * Allocate {@code count} buffers of {@code bufferSize} bytes, all recycled
     */
    public static FrameBufferPool allocate(int count, int bufferSize) {
        if (count < 1) {
            throw CaptureException.configuration("Buffer count must be at least 1, got " + count);
        }
        if (bufferSize < 1) {
            throw CaptureException.configuration("Buffer size must be positive, got " + bufferSize);
        }

        List<FrameBuffer> buffers = new ArrayList<>(count);
        try {
            for (int i = 0; i < count; i++) {
                buffers.add(new FrameBuffer(i, bufferSize));
            }
        } catch (OutOfMemoryError e) {
            buffers.clear();
            throw new CaptureException(ErrorKind.RESOURCE_EXHAUSTED,
                    "Cannot allocate " + count + " buffers of " + bufferSize + " bytes", e);
        }

        logger.info("Allocated {} frame buffers of {} bytes", count, bufferSize);
        return new FrameBufferPool(buffers, bufferSize);
    }

    /**
     * Bytes needed for the largest frame the device can produce
     */
    public static int bufferSizeFor(FrameDimensions dimensions) {
        if (dimensions.getWidth() <= 0 || dimensions.getHeight() <= 0 || dimensions.getBitsPerPixel() <= 0) {
            throw CaptureException.configuration("Invalid maximum frame dimensions: " + dimensions);
        }
        long size = (long) dimensions.getWidth() * dimensions.getHeight() * dimensions.bytesPerPixel();
        if (size > Integer.MAX_VALUE) {
            throw CaptureException.configuration("Frame of " + dimensions + " does not fit in one buffer");
        }
        return (int) size;
    }

    /**
     * Consumer release: return a held buffer to the recycled queue
     */
    public void recycle(FrameBuffer buffer) {
        if (!buffers.contains(buffer)) {
            throw new IllegalArgumentException("Buffer " + buffer + " does not belong to this pool");
        }
        recycled.push(buffer);
    }

    /**
     * Free the pool. Only allowed while no buffer is with the device or a consumer.
     */
    public void release() {
        if (released) {
            return;
        }
        PoolStats stats = snapshot();
        if (stats.getRecycled() != stats.getCapacity()) {
            throw CaptureException.resourceBusy("Cannot release pool, buffers still in use: " + stats);
        }
        released = true;
        logger.info("Released frame buffer pool ({} buffers)", buffers.size());
    }

    public PoolStats snapshot() {
        int recycledCount = 0;
        int inFlightCount = 0;
        int completedCount = 0;
        int heldCount = 0;
        for (FrameBuffer buffer : buffers) {
            switch (buffer.getLocation()) {
                case RECYCLED:
                    recycledCount++;
                    break;
                case IN_FLIGHT:
                    inFlightCount++;
                    break;
                case COMPLETED:
                    completedCount++;
                    break;
                default:
                    heldCount++;
            }
        }
        return new PoolStats(buffers.size(), recycledCount, inFlightCount, completedCount, heldCount);
    }

    public FrameQueue recycled() {
        return recycled;
    }

    public FrameQueue inFlight() {
        return inFlight;
    }

    public FrameQueue completed() {
        return completed;
    }

    public List<FrameBuffer> buffers() {
        return buffers;
    }

    public int capacity() {
        return buffers.size();
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public boolean isReleased() {
        return released;
    }
}
