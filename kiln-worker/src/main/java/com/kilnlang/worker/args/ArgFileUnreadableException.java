package com.kilnlang.worker.args;

/**
 * 参数文件（{@code @file}）无法读取
 */
public class ArgFileUnreadableException extends Exception {
    private final String path;

    public ArgFileUnreadableException(String path, Throwable cause) {
        super("Couldn't read argument file '" + path + "': " + cause.getMessage(), cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
