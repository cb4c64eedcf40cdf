package com.framecap.framecap.service.consumer;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.framecap.framecap.config.CaptureProperties;
import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameInfo;
import com.framecap.framecap.model.FrameStatus;
import com.framecap.framecap.model.StreamingFrame;

/**
 * Distribution stage: turns frames into a grayscale JPEG preview for streaming clients.
 *
 * Only one out of every {@code capture.stream.every-nth} good frames is encoded;
 * the newest preview replaces the previous one.
 */
@Component
public class ImageStreamerStage extends AbstractConsumerStage {

    private static final Logger logger = LoggerFactory.getLogger(ImageStreamerStage.class);

    private final int everyNth;
    private final AtomicReference<StreamingFrame> latestFrame = new AtomicReference<>();

    // Stage thread only
    private BufferedImage image;
    private long frameCounter = 0;

    public ImageStreamerStage(CaptureProperties properties) {
        super("streamer");
        this.everyNth = Math.max(1, properties.getStreamEveryNth());
    }

    @Override
    protected void process(FrameBuffer buffer, FrameInfo frameInfo) {
        if (frameInfo.getStatus() != FrameStatus.OK) {
            return;
        }
        if (frameCounter++ % everyNth != 0) {
            return;
        }

        byte[] jpeg = renderImage(buffer);
        if (jpeg != null) {
            latestFrame.set(new StreamingFrame(frameInfo.getSequenceId(),
                    buffer.getWidth(), buffer.getHeight(), buffer.getBitsPerPixel(), jpeg));
            logger.trace("Rendered frame {} ({} bytes)", frameInfo.getSequenceId(), jpeg.length);
        }
    }

    /**
     * Latest rendered preview, or null before the first one
     */
    public StreamingFrame getLatestFrame() {
        return latestFrame.get();
    }

    private byte[] renderImage(FrameBuffer buffer) {
        final int width = buffer.getWidth();
        final int height = buffer.getHeight();
        final int bitDepth = buffer.getBitsPerPixel();

        if (width <= 0 || height <= 0) {
            return null;
        }
        if (bitDepth < 1 || bitDepth > 16) {
            logger.error("Cannot render image, unsupported bit depth {}", bitDepth);
            return null;
        }

        if (image == null || image.getWidth() != width || image.getHeight() != height) {
            image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        }
        byte[] pixels = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        byte[] data = buffer.getData();

        if (bitDepth <= 8) {
            System.arraycopy(data, 0, pixels, 0, width * height);
        } else {
            // 16 bit little-endian words, keep the 8 most significant bits
            int shift = bitDepth - 8;
            for (int i = 0; i < width * height; i++) {
                int value = (data[2 * i] & 0xFF) | ((data[2 * i + 1] & 0xFF) << 8);
                pixels[i] = (byte) (value >>> shift);
            }
        }

        try {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            ImageIO.write(image, "jpg", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            logger.error("Cannot encode preview for frame {}: {}", buffer.getSequenceId(), e.getMessage());
            return null;
        }
    }
}
