package com.framecap.framecap.model;

public enum CaptureState {
    IDLE,
    STARTING,
    RUNNING,
    STOPPING
}
