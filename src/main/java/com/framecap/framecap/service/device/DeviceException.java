package com.framecap.framecap.service.device;

/**
 * Non-success status returned by the capture device
 */
public class DeviceException extends Exception {

    public DeviceException(String message) {
        super(message);
    }

    public DeviceException(String message, Throwable cause) {
        super(message, cause);
    }
}
