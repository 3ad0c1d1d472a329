package com.gridmodel.glm.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local file system storage with automatic directory creation.
 */
public class FileModelStorage implements ModelStorage {
    private static final Logger log = LoggerFactory.getLogger(FileModelStorage.class);

    @Override
    public String read(Path path) throws IOException {
        log.debug("Reading model from {}", path);
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    @Override
    public void write(Path path, String text) throws IOException {
        Path parentDir = path.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(path, text, StandardCharsets.UTF_8);
        log.debug("Wrote {} characters to {}", text.length(), path);
    }
}
