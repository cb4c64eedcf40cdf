package com.framecap.framecap.controller;

import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.framecap.framecap.service.session.CaptureSessionService;

@RestController
@RequestMapping("/capturing")
@CrossOrigin(origins = "*")
public class CapturingController {

    @Autowired
    private CaptureSessionService sessionService;

    @PostMapping("/start")
    public Map<String, Object> start() {
        sessionService.startCapture();
        return Map.of(
                "message", "Capturing started",
                "state", sessionService.getState().getLabel());
    }

    // Idempotent: stopping a camera that is not capturing succeeds
    @PostMapping("/stop")
    public Map<String, Object> stop() {
        sessionService.stopCapture();
        return Map.of(
                "message", "Capturing stopped",
                "state", sessionService.getState().getLabel());
    }
}
