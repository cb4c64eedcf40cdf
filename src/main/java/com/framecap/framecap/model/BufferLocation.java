package com.framecap.framecap.model;

/**
 * The one place a frame buffer lives at any instant.
 * HELD = taken out of a queue by exactly one thread (consumer stage or capture thread).
 */
public enum BufferLocation {
    RECYCLED,
    IN_FLIGHT,
    COMPLETED,
    HELD
}
