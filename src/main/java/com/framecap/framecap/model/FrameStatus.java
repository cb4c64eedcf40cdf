package com.framecap.framecap.model;

/**
 * Completion status of a captured frame
 */
public enum FrameStatus {
    OK('.'),
    DEVICE_ERROR('?'),
    CANCELLED('C'),
    DATA_MISSING('M');

    private final char symbol;

    FrameStatus(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Single character used in the verbose frame trace
     */
    public char symbol() {
        return symbol;
    }
}
