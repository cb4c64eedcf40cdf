package com.framecap.framecap.model;

import java.util.concurrent.atomic.AtomicReference;

import lombok.Getter;
import lombok.Setter;

/**
 * Fixed-capacity frame memory plus the metadata of the frame it currently holds.
 *
 * The byte region is allocated once and never replaced. Ownership is tracked by
 * {@link #getLocation()}; every hand-over goes through {@link #transfer} so that a
 * buffer can never be in two places at once.
 */
@Getter
public class FrameBuffer {

    private final int index;
    private final byte[] data;
    private final AtomicReference<BufferLocation> location = new AtomicReference<>(BufferLocation.HELD);

    @Setter
    private volatile int width;
    @Setter
    private volatile int height;
    @Setter
    private volatile int bitsPerPixel;
    @Setter
    private volatile long sequenceId;
    @Setter
    private volatile FrameStatus status = FrameStatus.OK;
    @Setter
    private volatile long captureTimestamp;
    @Setter
    private volatile long submittedAtNanos;
    @Setter
    private volatile FrameInfo frameInfo;

    public FrameBuffer(int index, int capacity) {
        this.index = index;
        this.data = new byte[capacity];
    }

    public int capacity() {
        return data.length;
    }

    public BufferLocation getLocation() {
        return location.get();
    }

    /**
     * Move ownership from {@code expected} to {@code next}.
     *
     * @throws IllegalStateException if the buffer is not where the caller thinks it is
     */
    public void transfer(BufferLocation expected, BufferLocation next) {
        if (!location.compareAndSet(expected, next)) {
            throw new IllegalStateException("Buffer " + index + " is " + location.get()
                    + ", expected " + expected + " (moving to " + next + ")");
        }
    }

    /**
     * Number of payload bytes of the current frame
     */
    public int frameSize() {
        return width * height * ((bitsPerPixel + 7) / 8);
    }

    @Override
    public String toString() {
        return "FrameBuffer[" + index + ", " + location.get() + ", seq=" + sequenceId + ", " + status + "]";
    }
}
