package com.framecap.framecap.service.consumer;

import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.service.pool.FrameQueue;

/**
 * A consumer running on its own thread.
 *
 * Every accepted buffer must eventually be released to the downstream sink, which is
 * either the next stage or the pool's recycled queue.
 */
public interface ConsumerStage extends FrameSink {

    String getName();

    /**
     * Where buffers go once this stage is done with them
     */
    void setDownstream(FrameSink downstream);

    /**
     * Hand a finished buffer on to the downstream sink
     */
    void release(FrameBuffer buffer);

    /**
     * Take the oldest completed buffer on this stage's thread and process it
     */
    void pullFrom(FrameQueue completed);

    /**
     * Number of buffers accepted but not yet released
     */
    int heldCount();

    /**
     * Wait until all work queued so far has been handled
     *
     * @return false on timeout
     */
    boolean awaitIdle(long timeoutMs);
}
