package com.framecap.framecap.controller;

import java.util.HashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.framecap.framecap.config.CaptureProperties;
import com.framecap.framecap.model.dto.BufferCountRequest;
import com.framecap.framecap.model.dto.OpenCameraRequest;
import com.framecap.framecap.service.session.CaptureSessionService;

/**
 * Camera session endpoints
 *
 * - POST /camera/open     {"deviceId": 0}
 * - POST /camera/close
 * - GET  /camera/state    closed | opened | capturing
 * - PUT  /camera/buffers  {"count": 10}
 * - GET  /camera/statistics
 */
@RestController
@RequestMapping("/camera")
@CrossOrigin(origins = "*")
public class CameraController {

    @Autowired
    private CaptureSessionService sessionService;

    @Autowired
    private CaptureProperties properties;

    @PostMapping("/open")
    public Map<String, Object> open(@RequestBody(required = false) OpenCameraRequest request) {
        long deviceId = (request != null && request.getDeviceId() != null)
                ? request.getDeviceId()
                : properties.getDeviceId();

        String description = sessionService.openSession(deviceId);

        Map<String, Object> response = new HashMap<>();
        response.put("message", "Camera opened: " + deviceId);
        response.put("deviceId", deviceId);
        response.put("info", description);
        response.put("state", sessionService.getState().getLabel());
        return response;
    }

    @PostMapping("/close")
    public Map<String, Object> close() {
        sessionService.closeSession();
        return Map.of(
                "message", "Camera closed",
                "state", sessionService.getState().getLabel());
    }

    @GetMapping("/state")
    public Map<String, Object> state() {
        return Map.of("state", sessionService.getState().getLabel());
    }

    @PutMapping("/buffers")
    public Map<String, Object> setBuffers(@RequestBody BufferCountRequest request) {
        sessionService.setBufferCount(request.getCount());
        return Map.of(
                "message", "Buffer count set",
                "count", sessionService.getBufferCount());
    }

    @GetMapping("/statistics")
    public Map<String, Object> statistics() {
        return sessionService.getStatistics();
    }
}
