package com.framecap.framecap.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.framecap.framecap.model.StreamingFrame;
import com.framecap.framecap.service.session.CaptureSessionService;

@RestController
@RequestMapping("/stream")
@CrossOrigin(origins = "*")
public class StreamController {

    @Autowired
    private CaptureSessionService sessionService;

    /**
     * Latest JPEG preview; 204 until the first frame has been rendered
     */
    @GetMapping("/frame")
    public ResponseEntity<byte[]> latestFrame() {
        StreamingFrame frame = sessionService.getLatestFrame();
        if (frame == null) {
            return ResponseEntity.noContent().build();
        }

        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_JPEG)
                .cacheControl(CacheControl.noStore())
                .header("X-Frame-Sequence", String.valueOf(frame.getSequenceId()))
                .header("X-Frame-Width", String.valueOf(frame.getWidth()))
                .header("X-Frame-Height", String.valueOf(frame.getHeight()))
                .header("X-Frame-Depth", String.valueOf(frame.getDepth()))
                .body(frame.getJpeg());
    }
}
