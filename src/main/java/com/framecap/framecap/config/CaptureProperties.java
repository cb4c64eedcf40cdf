package com.framecap.framecap.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import lombok.Getter;
import lombok.Setter;

/**
 * Capture settings from application.properties (capture.*).
 * Field initializers mirror the property defaults so the class can be used directly in tests.
 */
@Component
@Getter
@Setter
public class CaptureProperties {

    @Value("${capture.device-id:0}")
    private long deviceId = 0;

    // Number of frame buffers allocated when a session is opened
    @Value("${capture.num-buffers:10}")
    private int numBuffers = 10;

    @Value("${capture.poll-timeout-ms:100}")
    private long pollTimeoutMs = 100;

    // Pause between loop iterations, 0 = Thread.yield()
    @Value("${capture.loop-pause-ms:1}")
    private long loopPauseMs = 1;

    @Value("${capture.stop-timeout-ms:5000}")
    private long stopTimeoutMs = 5000;

    // Consecutive poll timeouts before the device is declared unresponsive, 0 = never
    @Value("${capture.watchdog-timeouts:0}")
    private int watchdogTimeouts = 0;

    @Value("${capture.auto-open:false}")
    private boolean autoOpen = false;

    @Value("${capture.auto-start:false}")
    private boolean autoStart = false;

    // Render one preview out of every N frames
    @Value("${capture.stream.every-nth:1}")
    private int streamEveryNth = 1;

    @Value("${capture.archive.directory:archive}")
    private String archiveDirectory = "archive";

    @Value("${capture.archive.file-prefix:frame}")
    private String archiveFilePrefix = "frame";

    @Value("${capture.archive.device-name:framecap}")
    private String archiveDeviceName = "framecap";

    @Value("${capture.simulator.width:640}")
    private int simulatorWidth = 640;

    @Value("${capture.simulator.height:480}")
    private int simulatorHeight = 480;

    @Value("${capture.simulator.bits-per-pixel:12}")
    private int simulatorBitsPerPixel = 12;

    @Value("${capture.simulator.frame-rate:10}")
    private double simulatorFrameRate = 10;
}
