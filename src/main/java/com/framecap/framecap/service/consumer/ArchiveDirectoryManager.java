package com.framecap.framecap.service.consumer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.framecap.framecap.config.CaptureProperties;

/**
 * Manages the archive directory the image writer persists frames to
 */
@Component
public class ArchiveDirectoryManager {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveDirectoryManager.class);
    static final String TEMP_SUFFIX = ".tmp";

    private final Path archiveRoot;

    public ArchiveDirectoryManager(CaptureProperties properties) {
        this.archiveRoot = Paths.get(properties.getArchiveDirectory());
    }

    /**
     * Create the archive directory if needed
     *
     * @throws IOException if it cannot be created or is not a directory
     */
    public Path ensureDirectory() throws IOException {
        if (Files.exists(archiveRoot) && !Files.isDirectory(archiveRoot)) {
            throw new IOException("Archive path exists but is not a directory: " + archiveRoot);
        }
        return Files.createDirectories(archiveRoot);
    }

    /**
     * Remove half-written files left over from a previous run (crash or Ctrl+C)
     *
     * @return number of files deleted
     */
    public int cleanupStaleTempFiles() {
        if (!Files.isDirectory(archiveRoot)) {
            logger.debug("Archive directory does not exist, nothing to clean up: {}", archiveRoot);
            return 0;
        }

        int deleted = 0;
        try (Stream<Path> files = Files.list(archiveRoot)) {
            for (Path path : (Iterable<Path>) files::iterator) {
                if (!path.getFileName().toString().endsWith(TEMP_SUFFIX)) {
                    continue;
                }
                try {
                    if (Files.deleteIfExists(path)) {
                        deleted++;
                        logger.trace("Deleted: {}", path);
                    }
                } catch (IOException e) {
                    logger.error("Failed to delete: {} - {}", path, e.getMessage());
                }
            }
        } catch (IOException e) {
            logger.error("Error listing archive directory: {}", archiveRoot, e);
        }

        if (deleted > 0) {
            logger.info("Removed {} stale temporary files from {}", deleted, archiveRoot);
        }
        return deleted;
    }
}
