package com.gridmodel.glm.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads and writes model text. The model manager never touches files itself.
 */
public interface ModelStorage {

    String read(Path path) throws IOException;

    void write(Path path, String text) throws IOException;
}
