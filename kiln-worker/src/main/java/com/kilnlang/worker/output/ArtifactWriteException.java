package com.kilnlang.worker.output;

import java.nio.file.Path;

/**
 * 输出文件编码或写入失败
 */
public class ArtifactWriteException extends Exception {
    private final Path path;

    public ArtifactWriteException(Path path, Throwable cause) {
        super("Couldn't write output file " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
