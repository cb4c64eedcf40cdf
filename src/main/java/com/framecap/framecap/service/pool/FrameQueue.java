package com.framecap.framecap.service.pool;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import com.framecap.framecap.model.BufferLocation;
import com.framecap.framecap.model.FrameBuffer;

/**
 * Bounded FIFO of frame buffers guarded by its own lock.
 *
 * {@link #push} takes ownership of a HELD buffer, {@link #pop} hands ownership back
 * as HELD. The location change and the structural change happen under the same
 * lock, and no method ever takes a second queue's lock.
 */
public class FrameQueue {

    private final BufferLocation location;
    private final int capacity;
    private final ArrayDeque<FrameBuffer> buffers;
    private final ReentrantLock lock = new ReentrantLock();

    public FrameQueue(BufferLocation location, int capacity) {
        if (location == BufferLocation.HELD) {
            throw new IllegalArgumentException("HELD is not a queue");
        }
        this.location = location;
        this.capacity = capacity;
        this.buffers = new ArrayDeque<>(capacity);
    }

    public BufferLocation getLocation() {
        return location;
    }

    public void push(FrameBuffer buffer) {
        lock.lock();
        try {
            if (buffers.size() >= capacity) {
                throw new IllegalStateException(location + " queue is full (" + capacity + ")");
            }
            buffer.transfer(BufferLocation.HELD, location);
            buffers.addLast(buffer);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the oldest buffer, now HELD by the caller, or null if empty
     */
    public FrameBuffer pop() {
        lock.lock();
        try {
            FrameBuffer buffer = buffers.pollFirst();
            if (buffer != null) {
                buffer.transfer(location, BufferLocation.HELD);
            }
            return buffer;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Oldest buffer without taking ownership
     */
    public FrameBuffer peek() {
        lock.lock();
        try {
            return buffers.peekFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pop every buffer currently queued
     */
    public List<FrameBuffer> drain() {
        lock.lock();
        try {
            List<FrameBuffer> drained = new ArrayList<>(buffers.size());
            FrameBuffer buffer;
            while ((buffer = buffers.pollFirst()) != null) {
                buffer.transfer(location, BufferLocation.HELD);
                drained.add(buffer);
            }
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffers.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean contains(FrameBuffer buffer) {
        lock.lock();
        try {
            return buffers.contains(buffer);
        } finally {
            lock.unlock();
        }
    }
}
