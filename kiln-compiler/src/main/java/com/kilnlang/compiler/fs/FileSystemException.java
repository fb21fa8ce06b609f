package com.kilnlang.compiler.fs;

import java.io.IOException;
import java.net.URI;

/**
 * 读取文件失败（不存在、不支持的 scheme、I/O 错误）
 */
public class FileSystemException extends IOException {
    private final URI uri;

    public FileSystemException(URI uri, String message) {
        super(message);
        this.uri = uri;
    }

    public FileSystemException(URI uri, String message, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }

    public URI getUri() {
        return uri;
    }
}
