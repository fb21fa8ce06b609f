package com.kilnlang.worker.args;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 参数文件展开。
 *
 * <p>最后一个参数以 {@code @} 开头时，把它替换为所指文件的各行；否则原样返回。
 * 只看最后一个参数，构建工具总是把参数文件放在末尾。</p>
 */
public final class ArgumentExpander {

    private ArgumentExpander() {
    }

    public static List<String> expand(List<String> args) throws ArgFileUnreadableException {
        List<String> result = new ArrayList<>(args);
        if (result.isEmpty()) {
            return result;
        }
        String last = result.get(result.size() - 1);
        if (!last.startsWith("@")) {
            return result;
        }

        String path = last.substring(1);
        List<String> lines;
        try {
            lines = Files.readAllLines(Paths.get(path), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException e) {
            throw new ArgFileUnreadableException(path, e);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        result.remove(result.size() - 1);
        result.addAll(lines);
        return result;
    }
}
