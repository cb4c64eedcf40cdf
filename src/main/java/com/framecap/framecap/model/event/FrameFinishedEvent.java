package com.framecap.framecap.model.event;

import org.springframework.context.ApplicationEvent;

import com.framecap.framecap.model.FrameInfo;

/**
 * Published once per completed frame. Carries metadata only; the buffer stays in the pipeline.
 */
public class FrameFinishedEvent extends ApplicationEvent {

    private final FrameInfo frameInfo;

    public FrameFinishedEvent(Object source, FrameInfo frameInfo) {
        super(source);
        this.frameInfo = frameInfo;
    }

    public FrameInfo getFrameInfo() {
        return frameInfo;
    }
}
