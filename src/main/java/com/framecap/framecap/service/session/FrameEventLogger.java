package com.framecap.framecap.service.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.framecap.framecap.model.FrameInfo;
import com.framecap.framecap.model.event.CaptureErrorEvent;
import com.framecap.framecap.model.event.FrameFinishedEvent;

/**
 * Logs frame completions and capture errors.
 *
 * Per-frame lines use the status character ('.' ok, 'C' cancelled, 'M' data missing,
 * '?' device error) and are only emitted at debug level.
 */
@Component
public class FrameEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(FrameEventLogger.class);

    @EventListener
    public void onFrameFinished(FrameFinishedEvent event) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        FrameInfo info = event.getFrameInfo();
        logger.debug("{} frame {} latency={}us", info.getStatus().symbol(), info.getSequenceId(),
                info.getReadoutLatency() / 1000);
    }

    @EventListener
    public void onCaptureError(CaptureErrorEvent event) {
        logger.error("Capture error on camera {} ({}): {}", event.getDeviceId(),
                event.getError().getKind(), event.getError().getMessage());
    }
}
