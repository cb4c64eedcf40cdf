package com.framecap.framecap.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Completion record produced once per completed buffer.
 * Carries metadata only, never the buffer itself.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class FrameInfo {
    private final long sequenceId;
    private final FrameStatus status;
    private final long deviceTimestamp; // device clock ticks
    private final long hostTimestamp;   // epoch millis
    private final long readoutLatency;  // nanos between submit and completion
}
