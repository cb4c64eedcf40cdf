package com.framecap.framecap.service.device;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.framecap.framecap.config.CaptureProperties;
import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameDimensions;
import com.framecap.framecap.model.FrameStatus;

class SimulatedCaptureDeviceTest {

    private CaptureProperties properties;
    private SimulatedCaptureDevice device;
    private DeviceHandle handle;

    @BeforeEach
    void setUp() throws Exception {
        properties = new CaptureProperties();
        properties.setSimulatorWidth(16);
        properties.setSimulatorHeight(8);
        properties.setSimulatorBitsPerPixel(8);
        properties.setSimulatorFrameRate(1000);
        device = new SimulatedCaptureDevice(properties);
        handle = device.open(1);
    }

    @AfterEach
    void tearDown() {
        device.close(handle);
    }

    private FrameBuffer newBuffer(int index) {
        return new FrameBuffer(index, 16 * 8 * 2);
    }

    @Test
    void open_Twice_Fails() {
        assertThatThrownBy(() -> device.open(2)).isInstanceOf(DeviceException.class);
    }

    @Test
    void maxFrameDimensions_ComeFromProperties() throws Exception {
        assertThat(device.maxFrameDimensions(handle)).isEqualTo(new FrameDimensions(16, 8, 8));
    }

    @Test
    void waitCompletion_WithoutAcquisition_TimesOut() throws Exception {
        device.submit(handle, newBuffer(0));

        WaitResult result = device.waitCompletion(handle, 20);

        assertThat(result.isTimeout()).isTrue();
    }

    @Test
    void waitCompletion_FillsBuffersInSubmissionOrder() throws Exception {
        FrameBuffer first = newBuffer(0);
        FrameBuffer second = newBuffer(1);
        device.submit(handle, first);
        device.submit(handle, second);
        device.startAcquisition(handle);

        WaitResult a = device.waitCompletion(handle, 1000);
        WaitResult b = device.waitCompletion(handle, 1000);

        assertThat(a.isCompleted()).isTrue();
        assertThat(a.getBuffer()).isSameAs(first);
        assertThat(a.getStatus()).isEqualTo(FrameStatus.OK);
        assertThat(b.getBuffer()).isSameAs(second);
        assertThat(b.getDeviceTimestamp()).isGreaterThanOrEqualTo(a.getDeviceTimestamp());
        assertThat(first.getWidth()).isEqualTo(16);
        assertThat(first.getHeight()).isEqualTo(8);
        // diagonal gradient, shifted by one per frame
        assertThat(first.getData()[3 * 16 + 2]).isEqualTo((byte) 5);
        assertThat(second.getData()[3 * 16 + 2]).isEqualTo((byte) 6);
    }

    @Test
    void cancelAll_DropsPendingBuffers() throws Exception {
        FrameBuffer buffer = newBuffer(0);
        device.submit(handle, buffer);
        device.startAcquisition(handle);
        device.cancelAll(handle);

        assertThat(buffer.getStatus()).isEqualTo(FrameStatus.CANCELLED);
        assertThat(device.waitCompletion(handle, 20).isTimeout()).isTrue();
    }

    @Test
    void stopAcquisition_StopsDeliveringFrames() throws Exception {
        device.submit(handle, newBuffer(0));
        device.startAcquisition(handle);
        device.stopAcquisition(handle);

        assertThat(device.waitCompletion(handle, 20).isTimeout()).isTrue();
    }

    @Test
    void closedDevice_ReportsErrors() throws Exception {
        device.close(handle);

        assertThat(device.waitCompletion(handle, 10).isError()).isTrue();
        assertThatThrownBy(() -> device.submit(handle, newBuffer(0))).isInstanceOf(DeviceException.class);
    }

    @Test
    void interruptedWait_IsAnError() {
        Thread.currentThread().interrupt();

        WaitResult result = device.waitCompletion(handle, 1000);

        assertThat(result.isError()).isTrue();
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void describe_ListsCameraInfos() {
        assertThat(device.describe(handle)).startsWith("Camera infos:").contains("simulator-1").contains("16x8@8");
    }
}
