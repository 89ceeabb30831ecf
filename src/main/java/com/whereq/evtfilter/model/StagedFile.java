package com.whereq.evtfilter.model;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A source file staged under a private temporary directory.
 * Closing removes the directory and everything written into it.
 */
@Slf4j
@Getter
public class StagedFile implements AutoCloseable {

    private final Path path;

    private final Path directory;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public StagedFile(Path path, Path directory) {
        this.path = path;
        this.directory = directory;
    }

    /**
     * Resolve a sibling file inside the staging directory
     */
    public Path resolve(String name) {
        return directory.resolve(name);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(directory);
        } catch (IOException e) {
            log.warn("Failed to remove staging directory {}: {}", directory, e.getMessage());
        }
    }
}
