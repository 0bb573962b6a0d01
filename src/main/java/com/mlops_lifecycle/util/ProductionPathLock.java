package com.mlops_lifecycle.util;

import com.mlops_lifecycle.exception.FileProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes promotions onto one production path. The OS file lock excludes other processes,
 * the in-process lock excludes other threads (file locks are held per JVM, not per thread).
 */
@Slf4j
@Component
public class ProductionPathLock {

    private final ReentrantLock jvmLock = new ReentrantLock();

    public <T> T withLock(Path productionPath, Supplier<T> action) {
        Path lockFile = ArtifactFileUtil.lockFileFor(productionPath);
        jvmLock.lock();
        try {
            Files.createDirectories(lockFile.getParent());
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                log.debug("🔒 Acquired promotion lock {}", lockFile);
                return action.get();
            }
        } catch (IOException e) {
            throw new FileProcessingException("Could not acquire promotion lock " + lockFile + ": " + e.getMessage(), e);
        } finally {
            jvmLock.unlock();
        }
    }
}
