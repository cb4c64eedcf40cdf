package com.framecap.framecap.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Latest rendered preview handed out to streaming clients
 */
@Getter
@AllArgsConstructor
public class StreamingFrame {
    private final long sequenceId;
    private final int width;
    private final int height;
    private final int depth;
    private final byte[] jpeg;
}
