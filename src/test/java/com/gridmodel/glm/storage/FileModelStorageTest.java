package com.gridmodel.glm.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FileModelStorageTest {

    @TempDir
    Path tempDir;

    private final FileModelStorage storage = new FileModelStorage();

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path target = tempDir.resolve("out/run/model.glm");

        storage.write(target, "clock {\n}\n");

        assertThat(target).exists();
        assertThat(storage.read(target)).isEqualTo("clock {\n}\n");
    }

    @Test
    void testWriteOverwrites() throws IOException {
        Path target = tempDir.resolve("model.glm");
        Files.writeString(target, "old");

        storage.write(target, "new");

        assertThat(Files.readString(target)).isEqualTo("new");
    }

    @Test
    void testReadMissingFileFails() {
        assertThatThrownBy(() -> storage.read(tempDir.resolve("missing.glm")))
                .isInstanceOf(NoSuchFileException.class);
    }
}
