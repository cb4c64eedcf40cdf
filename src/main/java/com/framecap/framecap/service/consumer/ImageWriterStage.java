package com.framecap.framecap.service.consumer;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.framecap.framecap.config.CaptureProperties;
import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameInfo;
import com.framecap.framecap.model.FrameStatus;

/**
 * Archive stage: persists selected frames.
 *
 * Idle until armed with {@link #writeNextFrames(int, int)}; then writes {@code count}
 * good frames, one every {@code stepping} frames. Each frame becomes a raw pixel file
 * plus a JSON header, both written to a temporary name and renamed when complete.
 */
@Component
public class ImageWriterStage extends AbstractConsumerStage {

    private static final Logger logger = LoggerFactory.getLogger(ImageWriterStage.class);
    private static final DateTimeFormatter FILE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmssSSS");

    private final ArchiveDirectoryManager directoryManager;
    private final ObjectMapper objectMapper;
    private final String fileNamePrefix;
    private final String deviceName;

    // Stage thread only
    private int count = 0;
    private int stepping = 1;
    private long index = 0;
    private long frameLimit = 0;

    private volatile int requested = 0;
    private volatile int written = 0;
    private volatile String lastFileName;

    public ImageWriterStage(CaptureProperties properties, ArchiveDirectoryManager directoryManager,
                            ObjectMapper objectMapper) {
        super("writer");
        this.directoryManager = directoryManager;
        this.objectMapper = objectMapper;
        this.fileNamePrefix = properties.getArchiveFilePrefix();
        this.deviceName = properties.getArchiveDeviceName();
    }

    /**
     * Arm the writer. Replaces any request still in progress once the frames
     * already queued on the stage have been handled.
     *
     * @param count    frames to write, 0 cancels
     * @param stepping write one frame out of every {@code stepping}
     */
    public void writeNextFrames(int count, int stepping) {
        final int newCount = Math.max(0, count);
        final int newStepping = Math.max(1, stepping);

        executeOnStage(() -> {
            this.count = newCount;
            this.stepping = newStepping;
            this.index = 0;
            this.frameLimit = (long) newCount * newStepping;
            requested = newCount;
            written = 0;
            logger.info("Writing next {} frames (every {} frame)", newCount, newStepping);
        });
    }

    @Override
    protected void process(FrameBuffer buffer, FrameInfo frameInfo) {
        if (frameInfo.getStatus() != FrameStatus.OK) {
            return;
        }
        if (index >= frameLimit) {
            return;
        }

        if (index % stepping == 0 && writeFrame(buffer, frameInfo)) {
            int n = (int) (index / stepping + 1);
            written = n;
            logger.info("Frame written ({}/{}): {}", n, count, lastFileName);
        }
        index++;
    }

    public int getRequested() {
        return requested;
    }

    public int getWritten() {
        return written;
    }

    public String getLastFileName() {
        return lastFileName;
    }

    private boolean writeFrame(FrameBuffer buffer, FrameInfo frameInfo) {
        ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);
        String baseName = fileNamePrefix + "_" + now.format(FILE_TIME) + "_" + frameInfo.getSequenceId();
        String dataName = baseName + ".raw";
        String headerName = baseName + ".json";

        try {
            Path directory = directoryManager.ensureDirectory();

            Path dataTemp = directory.resolve(dataName + ArchiveDirectoryManager.TEMP_SUFFIX);
            try (OutputStream out = Files.newOutputStream(dataTemp)) {
                out.write(buffer.getData(), 0, Math.min(buffer.frameSize(), buffer.capacity()));
            }

            Path headerTemp = directory.resolve(headerName + ArchiveDirectoryManager.TEMP_SUFFIX);
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(headerTemp.toFile(), header(buffer, frameInfo, dataName, now));

            moveIntoPlace(dataTemp, directory.resolve(dataName));
            moveIntoPlace(headerTemp, directory.resolve(headerName));
            lastFileName = dataName;
            return true;

        } catch (IOException e) {
            logger.error("Cannot write frame {} to {}: {}", frameInfo.getSequenceId(), dataName, e.getMessage());
            return false;
        }
    }

    private Map<String, Object> header(FrameBuffer buffer, FrameInfo frameInfo, String fileName, ZonedDateTime now) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("creator", "framecap");
        header.put("date", now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        header.put("filename", fileName);
        header.put("status", "raw");
        header.put("instrument", deviceName);
        header.put("sequenceId", frameInfo.getSequenceId());
        header.put("deviceTimestamp", frameInfo.getDeviceTimestamp());
        header.put("hostTimestamp", frameInfo.getHostTimestamp());
        header.put("readoutLatencyNanos", frameInfo.getReadoutLatency());
        header.put("width", buffer.getWidth());
        header.put("height", buffer.getHeight());
        header.put("bitsPerPixel", buffer.getBitsPerPixel());
        header.put("byteOrder", "little-endian");
        return header;
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
