package com.dcgraph.index;

import java.io.IOException;
import java.nio.file.Path;

public class CorruptIndexException extends IOException {
    private final Path path;

    public CorruptIndexException(Path path, String reason) {
        super("Corrupt index file " + path + ": " + reason);
        this.path = path;
    }

    public CorruptIndexException(Path path, String reason, Throwable cause) {
        super("Corrupt index file " + path + ": " + reason, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
