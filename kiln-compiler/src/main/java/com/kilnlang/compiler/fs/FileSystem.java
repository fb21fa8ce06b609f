package com.kilnlang.compiler.fs;

import java.net.URI;

/**
 * 编译器读取源码和摘要所用的只读文件系统抽象。
 */
public interface FileSystem {

    /**
     * 获取 URI 对应的实体。不做任何 I/O，是否存在由 {@link FileSystemEntity#exists()} 判断。
     */
    FileSystemEntity entityForUri(URI uri);
}
