package com.kilnlang.compiler.fs;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 基于本地磁盘的文件系统，只支持 {@code file:} URI。
 */
public final class StandardFileSystem implements FileSystem {

    public static final StandardFileSystem INSTANCE = new StandardFileSystem();

    private StandardFileSystem() {
    }

    @Override
    public FileSystemEntity entityForUri(URI uri) {
        return new DiskEntity(uri);
    }

    private static final class DiskEntity implements FileSystemEntity {
        private final URI uri;

        DiskEntity(URI uri) {
            this.uri = uri;
        }

        @Override
        public URI getUri() {
            return uri;
        }

        @Override
        public boolean exists() {
            Path path = toPath();
            return path != null && Files.isRegularFile(path);
        }

        @Override
        public byte[] readAsBytes() throws IOException {
            Path path = toPath();
            if (path == null) {
                throw new FileSystemException(uri, "Unsupported URI scheme: " + uri);
            }
            try {
                return Files.readAllBytes(path);
            } catch (NoSuchFileException e) {
                throw new FileSystemException(uri, "File not found: " + path, e);
            } catch (IOException e) {
                throw new FileSystemException(uri, "Cannot read " + path + ": " + e.getMessage(), e);
            }
        }

        private Path toPath() {
            if (!"file".equals(uri.getScheme())) {
                return null;
            }
            try {
                return Paths.get(uri);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
    }
}
