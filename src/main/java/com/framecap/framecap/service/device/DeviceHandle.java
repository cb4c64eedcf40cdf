package com.framecap.framecap.service.device;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Opaque binding to an opened device
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class DeviceHandle {
    private final long deviceId;
    private final String name;
}
