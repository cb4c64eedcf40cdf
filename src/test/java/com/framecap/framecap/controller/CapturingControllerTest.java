package com.framecap.framecap.controller;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.framecap.framecap.config.exception.CaptureException;
import com.framecap.framecap.config.exception.ErrorKind;
import com.framecap.framecap.model.SessionState;
import com.framecap.framecap.service.session.CaptureSessionService;

@WebMvcTest({CapturingController.class, ArchiveController.class})
class CapturingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CaptureSessionService sessionService;

    @Test
    void start_ReportsCapturing() throws Exception {
        when(sessionService.getState()).thenReturn(SessionState.CAPTURING);

        mockMvc.perform(post("/capturing/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("capturing"));

        verify(sessionService).startCapture();
    }

    @Test
    void start_DeviceRefuses_IsBadGateway() throws Exception {
        doThrow(new CaptureException(ErrorKind.DEVICE_ERROR, "Cannot start capturing: AcquisitionStart failed"))
                .when(sessionService).startCapture();

        mockMvc.perform(post("/capturing/start"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.statusCode").value(502))
                .andExpect(jsonPath("$.error").value("DEVICE_ERROR"));
    }

    @Test
    void start_CameraClosed_IsConflict() throws Exception {
        doThrow(CaptureException.wrongState("Camera is not open")).when(sessionService).startCapture();

        mockMvc.perform(post("/capturing/start"))
                .andExpect(status().isConflict());
    }

    @Test
    void stop_AlwaysSucceeds() throws Exception {
        when(sessionService.getState()).thenReturn(SessionState.OPEN);

        mockMvc.perform(post("/capturing/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("opened"));

        verify(sessionService).stopCapture();
    }

    @Test
    void archiveWrite_ForwardsCountAndStepping() throws Exception {
        mockMvc.perform(post("/archive/write")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\": 5, \"stepping\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(5))
                .andExpect(jsonPath("$.stepping").value(2));

        verify(sessionService).writeNextFrames(5, 2);
    }

    @Test
    void archiveWrite_DefaultsSteppingToOne() throws Exception {
        mockMvc.perform(post("/archive/write")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\": 3}"))
                .andExpect(status().isOk());

        verify(sessionService).writeNextFrames(3, 1);
    }
}
