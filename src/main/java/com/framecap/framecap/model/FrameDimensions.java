package com.framecap.framecap.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Largest frame a device can report
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class FrameDimensions {
    private final int width;
    private final int height;
    private final int bitsPerPixel;

    public int bytesPerPixel() {
        return (bitsPerPixel + 7) / 8;
    }
}
