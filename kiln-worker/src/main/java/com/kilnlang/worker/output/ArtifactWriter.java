package com.kilnlang.worker.output;

import com.kilnlang.ir.codec.ModuleGraphCodec;
import com.kilnlang.ir.graph.ModuleGraph;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Logger;

/**
 * 把模块图写为 IR 文件。
 *
 * <p>先写同目录下的临时文件再移动到目标位置，失败时原有输出保持不变。</p>
 */
public final class ArtifactWriter {
    private static final Logger LOG = Logger.getLogger(ArtifactWriter.class.getName());

    private ArtifactWriter() {
    }

    /**
     * @return 写入的字节数
     */
    public static long write(ModuleGraph graph, Path output) throws ArtifactWriteException {
        Path target = output.toAbsolutePath();
        Path parent = target.getParent();
        if (parent == null || target.getFileName() == null) {
            throw new ArtifactWriteException(target, new IOException("Not a file path: " + target));
        }
        byte[] bytes;
        try {
            bytes = ModuleGraphCodec.encode(graph);
        } catch (IOException e) {
            throw new ArtifactWriteException(target, e);
        }

        Path temp = null;
        try {
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            Files.write(temp, bytes);
            move(temp, target);
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new ArtifactWriteException(target, e);
        }
        LOG.fine("已写入 " + target + "（" + bytes.length + " 字节）");
        return bytes.length;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
