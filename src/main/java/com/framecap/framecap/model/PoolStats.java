package com.framecap.framecap.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Point-in-time count of buffers per location
 */
@Getter
@AllArgsConstructor
@ToString
public class PoolStats {
    private final int capacity;
    private final int recycled;
    private final int inFlight;
    private final int completed;
    private final int held;

    public int total() {
        return recycled + inFlight + completed + held;
    }
}
