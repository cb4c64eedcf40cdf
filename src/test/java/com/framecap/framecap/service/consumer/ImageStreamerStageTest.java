package com.framecap.framecap.service.consumer;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.framecap.framecap.config.CaptureProperties;
import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameInfo;
import com.framecap.framecap.model.FrameStatus;
import com.framecap.framecap.model.StreamingFrame;

class ImageStreamerStageTest {

    private CaptureProperties properties;
    private ImageStreamerStage stage;
    private final List<FrameBuffer> released = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new CaptureProperties();
    }

    @AfterEach
    void tearDown() {
        if (stage != null) {
            stage.shutdown();
        }
    }

    private ImageStreamerStage newStage() {
        stage = new ImageStreamerStage(properties);
        stage.setDownstream((buffer, info) -> released.add(buffer));
        return stage;
    }

    private static FrameBuffer frame(long sequenceId, int width, int height, int bits, int value, FrameStatus status) {
        int bytesPerPixel = (bits + 7) / 8;
        FrameBuffer buffer = new FrameBuffer(0, width * height * bytesPerPixel);
        buffer.setWidth(width);
        buffer.setHeight(height);
        buffer.setBitsPerPixel(bits);
        buffer.setSequenceId(sequenceId);
        buffer.setStatus(status);
        buffer.setFrameInfo(FrameInfo.builder().sequenceId(sequenceId).status(status).build());
        byte[] data = buffer.getData();
        for (int i = 0; i < width * height; i++) {
            if (bytesPerPixel == 1) {
                data[i] = (byte) value;
            } else {
                data[2 * i] = (byte) value;
                data[2 * i + 1] = (byte) (value >>> 8);
            }
        }
        return buffer;
    }

    private void feed(FrameBuffer buffer) {
        stage.accept(buffer, buffer.getFrameInfo());
    }

    private static BufferedImage decode(StreamingFrame frame) throws Exception {
        return ImageIO.read(new ByteArrayInputStream(frame.getJpeg()));
    }

    @Test
    void noFrameBeforeFirstRender() {
        assertThat(newStage().getLatestFrame()).isNull();
    }

    @Test
    void eightBitFrame_RendersJpegOfSameSize() throws Exception {
        newStage();
        feed(frame(1, 16, 8, 8, 200, FrameStatus.OK));

        assertThat(stage.awaitIdle(5000)).isTrue();
        StreamingFrame latest = stage.getLatestFrame();
        assertThat(latest).isNotNull();
        assertThat(latest.getSequenceId()).isEqualTo(1);
        assertThat(latest.getDepth()).isEqualTo(8);

        BufferedImage image = decode(latest);
        assertThat(image.getWidth()).isEqualTo(16);
        assertThat(image.getHeight()).isEqualTo(8);
        assertThat(image.getRaster().getSample(3, 3, 0)).isBetween(196, 204);
        assertThat(released).hasSize(1);
    }

    @Test
    void twelveBitFrame_KeepsMostSignificantBits() throws Exception {
        newStage();
        feed(frame(1, 8, 8, 12, 0x800, FrameStatus.OK));

        assertThat(stage.awaitIdle(5000)).isTrue();
        BufferedImage image = decode(stage.getLatestFrame());
        assertThat(image.getRaster().getSample(4, 4, 0)).isBetween(124, 132);
    }

    @Test
    void failedFrames_AreReleasedWithoutRendering() {
        newStage();
        feed(frame(1, 8, 8, 8, 10, FrameStatus.CANCELLED));
        feed(frame(2, 8, 8, 8, 10, FrameStatus.DEVICE_ERROR));

        assertThat(stage.awaitIdle(5000)).isTrue();
        assertThat(stage.getLatestFrame()).isNull();
        assertThat(released).hasSize(2);
    }

    @Test
    void everyNth_RendersOneOutOfN() {
        properties.setStreamEveryNth(2);
        newStage();

        feed(frame(1, 8, 8, 8, 10, FrameStatus.OK));
        feed(frame(2, 8, 8, 8, 10, FrameStatus.OK));
        assertThat(stage.awaitIdle(5000)).isTrue();
        assertThat(stage.getLatestFrame().getSequenceId()).isEqualTo(1);

        feed(frame(3, 8, 8, 8, 10, FrameStatus.OK));
        assertThat(stage.awaitIdle(5000)).isTrue();
        assertThat(stage.getLatestFrame().getSequenceId()).isEqualTo(3);
        assertThat(released).hasSize(3);
    }

    @Test
    void unsupportedDepth_IsSkipped() {
        newStage();
        FrameBuffer wide = frame(1, 4, 4, 8, 0, FrameStatus.OK);
        wide.setBitsPerPixel(24);

        feed(wide);

        assertThat(stage.awaitIdle(5000)).isTrue();
        assertThat(stage.getLatestFrame()).isNull();
        assertThat(released).containsExactly(wide);
    }
}
