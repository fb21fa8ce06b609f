package com.kilnlang.compiler.fs;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * 文件系统中的一个（可能不存在的）文件
 */
public interface FileSystemEntity {

    /** 请求时使用的 URI（虚拟文件系统中为逻辑 URI） */
    URI getUri();

    boolean exists();

    byte[] readAsBytes() throws IOException;

    default String readAsString() throws IOException {
        return new String(readAsBytes(), StandardCharsets.UTF_8);
    }
}
