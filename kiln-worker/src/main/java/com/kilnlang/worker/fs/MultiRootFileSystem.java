package com.kilnlang.worker.fs;

import com.kilnlang.compiler.fs.FileSystem;
import com.kilnlang.compiler.fs.FileSystemEntity;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 多根文件系统。
 *
 * <p>{@code scheme:///path} 依次在各个根下查找 {@code path}，第一个存在的根胜出；
 * 都不存在时落到第一个根上，由编译器报告文件缺失。其他 scheme 直接交给底层文件系统。</p>
 */
public class MultiRootFileSystem implements FileSystem {
    private static final Logger LOG = Logger.getLogger(MultiRootFileSystem.class.getName());

    private final String scheme;
    private final List<URI> roots;
    private final FileSystem delegate;

    /**
     * @param roots 为空时使用当前工作目录
     */
    public MultiRootFileSystem(String scheme, List<URI> roots, FileSystem delegate) {
        this.scheme = scheme;
        this.delegate = delegate;
        List<URI> normalized = new ArrayList<>();
        for (URI root : roots) {
            normalized.add(asDirectory(root));
        }
        if (normalized.isEmpty()) {
            normalized.add(asDirectory(Paths.get("").toAbsolutePath().toUri()));
        }
        this.roots = Collections.unmodifiableList(normalized);
    }

    public String getScheme() {
        return scheme;
    }

    public List<URI> getRoots() {
        return roots;
    }

    @Override
    public FileSystemEntity entityForUri(URI uri) {
        if (!scheme.equals(uri.getScheme())) {
            return delegate.entityForUri(uri);
        }
        return new MultiRootEntity(uri, delegate.entityForUri(resolveRoot(uri)));
    }

    /**
     * 把逻辑 URI 映射到物理 URI
     */
    public URI resolveRoot(URI uri) {
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        // 保持转义；"./" 前缀防止首段中的 ':' 被当作 scheme
        URI relative = URI.create("./" + path);

        for (URI root : roots) {
            URI candidate = root.resolve(relative);
            if (delegate.entityForUri(candidate).exists()) {
                return candidate;
            }
        }
        URI fallback = roots.get(0).resolve(relative);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(uri + " 在所有根下都不存在，使用 " + fallback);
        }
        return fallback;
    }

    private static URI asDirectory(URI root) {
        String s = root.toString();
        return s.endsWith("/") ? root : URI.create(s + "/");
    }

    /** 对外保留逻辑 URI，读取委托给物理实体 */
    private static final class MultiRootEntity implements FileSystemEntity {
        private final URI uri;
        private final FileSystemEntity physical;

        MultiRootEntity(URI uri, FileSystemEntity physical) {
            this.uri = uri;
            this.physical = physical;
        }

        @Override
        public URI getUri() {
            return uri;
        }

        @Override
        public boolean exists() {
            return physical.exists();
        }

        @Override
        public byte[] readAsBytes() throws IOException {
            return physical.readAsBytes();
        }
    }
}
