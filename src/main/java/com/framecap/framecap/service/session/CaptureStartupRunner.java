package com.framecap.framecap.service.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.framecap.framecap.config.CaptureProperties;
import com.framecap.framecap.config.exception.CaptureException;
import com.framecap.framecap.service.consumer.ArchiveDirectoryManager;

/**
 * Boot-time housekeeping: clean the archive directory, then open and start
 * the configured camera when capture.auto-open / capture.auto-start are set.
 */
@Component
public class CaptureStartupRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(CaptureStartupRunner.class);

    private final CaptureSessionService sessionService;
    private final ArchiveDirectoryManager archiveDirectoryManager;
    private final CaptureProperties properties;

    public CaptureStartupRunner(CaptureSessionService sessionService,
                                ArchiveDirectoryManager archiveDirectoryManager,
                                CaptureProperties properties) {
        this.sessionService = sessionService;
        this.archiveDirectoryManager = archiveDirectoryManager;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        archiveDirectoryManager.cleanupStaleTempFiles();

        if (!properties.isAutoOpen()) {
            return;
        }
        try {
            sessionService.openSession(properties.getDeviceId());
            if (properties.isAutoStart()) {
                sessionService.startCapture();
            }
        } catch (CaptureException e) {
            // keep the service up, the camera can still be opened over REST
            logger.error("Cannot bring up camera {} at startup ({}): {}",
                    properties.getDeviceId(), e.getKind(), e.getMessage());
        }
    }
}
