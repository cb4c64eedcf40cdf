package com.framecap.framecap.service.consumer;

import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameInfo;

/**
 * Receiver of a completed buffer. Whoever accepts a buffer owns it until it hands
 * it on to its own downstream sink.
 */
@FunctionalInterface
public interface FrameSink {

    void accept(FrameBuffer buffer, FrameInfo frameInfo);
}
