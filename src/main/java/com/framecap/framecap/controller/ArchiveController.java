package com.framecap.framecap.controller;

import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.framecap.framecap.model.dto.WriteFramesRequest;
import com.framecap.framecap.service.session.CaptureSessionService;

/**
 * POST /archive/write {"count": 5, "stepping": 2}
 * writes the next 5 good frames, skipping one frame between each
 */
@RestController
@RequestMapping("/archive")
@CrossOrigin(origins = "*")
public class ArchiveController {

    @Autowired
    private CaptureSessionService sessionService;

    @PostMapping("/write")
    public Map<String, Object> write(@RequestBody WriteFramesRequest request) {
        sessionService.writeNextFrames(request.getCount(), request.getStepping());
        return Map.of(
                "message", "Writing next " + request.getCount() + " frames",
                "count", request.getCount(),
                "stepping", request.getStepping());
    }
}
