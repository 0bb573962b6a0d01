package com.mlops_lifecycle.util;

import com.mlops_lifecycle.exception.FileProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Slf4j
public class ArtifactFileUtil {

    private ArtifactFileUtil() {
    }

    /**
     * Copies {@code source} over {@code target} so that readers of {@code target} see either the old
     * file or the complete new one. Bytes go to a temp file in the target directory first, which is
     * then renamed over the target. The target is left as it was on any failure.
     */
    public static void copyAtomically(Path source, Path target) {
        if (!Files.isRegularFile(source)) {
            throw new FileProcessingException("Source artifact not found: " + source);
        }

        Path targetDir = target.toAbsolutePath().getParent();
        Path tempFile = null;
        long size;
        try {
            Files.createDirectories(targetDir);
            tempFile = Files.createTempFile(targetDir, "." + target.getFileName() + "-", ".tmp");
            Files.copy(source, tempFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            size = Files.size(tempFile);
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            throw new FileProcessingException("Filesystem of " + targetDir + " does not support atomic rename", e);
        } catch (IOException e) {
            throw new FileProcessingException("Failed to copy " + source + " to " + target + ": " + e.getMessage(), e);
        } finally {
            if (tempFile != null) {
                FileUtils.deleteQuietly(tempFile.toFile());
            }
        }
        log.info("✅ Copied {} -> {} ({} bytes)", source, target, size);
    }

    public static Path lockFileFor(Path artifact) {
        return artifact.toAbsolutePath().resolveSibling(artifact.getFileName() + ".lock");
    }
}
