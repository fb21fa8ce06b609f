package com.kilnlang.worker.fs;

import com.kilnlang.compiler.fs.FileSystemEntity;
import com.kilnlang.compiler.fs.FileSystemException;
import com.kilnlang.compiler.fs.StandardFileSystem;
import com.kilnlang.worker.WorkerFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MultiRootFileSystem 测试")
class MultiRootFileSystemTest {

    private static final String SCHEME = "org-kiln-multi-root";

    @TempDir
    Path tempDir;

    private Path first;
    private Path second;
    private MultiRootFileSystem fs;

    @BeforeEach
    void setUp() throws Exception {
        first = tempDir.resolve("first");
        second = tempDir.resolve("second");
        WorkerFixtures.writeSource(first.resolve("lib/shared.kn"), "val a: Int = 1;\n");
        WorkerFixtures.writeSource(second.resolve("lib/shared.kn"), "val a: Int = 2;\n");
        WorkerFixtures.writeSource(second.resolve("app/main.kn"), "val b: Int = 3;\n");
        fs = new MultiRootFileSystem(SCHEME, Arrays.asList(first.toUri(), second.toUri()),
                StandardFileSystem.INSTANCE);
    }

    @Test
    @DisplayName("第一个包含该路径的根胜出")
    void testFirstExistingRootWins() {
        URI shared = URI.create(SCHEME + ":///lib/shared.kn");
        URI main = URI.create(SCHEME + ":///app/main.kn");

        assertThat(Paths.get(fs.resolveRoot(shared))).isEqualTo(first.resolve("lib/shared.kn"));
        assertThat(Paths.get(fs.resolveRoot(main))).isEqualTo(second.resolve("app/main.kn"));
    }

    @Test
    @DisplayName("所有根下都不存在时落到第一个根")
    void testFallsBackToFirstRoot() {
        URI missing = URI.create(SCHEME + ":///nowhere/missing.kn");

        assertThat(Paths.get(fs.resolveRoot(missing))).isEqualTo(first.resolve("nowhere/missing.kn"));
        FileSystemEntity entity = fs.entityForUri(missing);
        assertThat(entity.exists()).isFalse();
        assertThatThrownBy(entity::readAsBytes).isInstanceOf(FileSystemException.class);
    }

    @Test
    @DisplayName("首段含冒号或转义字符的路径仍在根下查找")
    void testColonAndEscapedSegments() throws Exception {
        WorkerFixtures.writeSource(first.resolve("dir:x/a.kn"), "val c: Int = 4;\n");
        WorkerFixtures.writeSource(second.resolve("my lib/b.kn"), "val d: Int = 5;\n");
        URI colon = URI.create(SCHEME + ":///dir:x/a.kn");
        URI escaped = URI.create(SCHEME + ":///my%20lib/b.kn");

        assertThat(Paths.get(fs.resolveRoot(colon))).isEqualTo(first.resolve("dir:x/a.kn"));
        assertThat(fs.entityForUri(colon).readAsString()).isEqualTo("val c: Int = 4;\n");
        assertThat(Paths.get(fs.resolveRoot(escaped))).isEqualTo(second.resolve("my lib/b.kn"));
        assertThat(fs.entityForUri(escaped).exists()).isTrue();
    }

    @Test
    @DisplayName("实体保留逻辑 URI，内容来自物理文件")
    void testEntityKeepsLogicalUri() throws Exception {
        URI main = URI.create(SCHEME + ":///app/main.kn");

        FileSystemEntity entity = fs.entityForUri(main);

        assertThat(entity.getUri()).isEqualTo(main);
        assertThat(entity.exists()).isTrue();
        assertThat(entity.readAsString()).isEqualTo("val b: Int = 3;\n");
    }

    @Test
    @DisplayName("其他 scheme 直接交给底层文件系统")
    void testPassThrough() throws Exception {
        URI physical = second.resolve("app/main.kn").toUri();

        FileSystemEntity entity = fs.entityForUri(physical);

        assertThat(entity.getUri()).isEqualTo(physical);
        assertThat(entity.readAsString()).isEqualTo("val b: Int = 3;\n");
        assertThat(fs.entityForUri(URI.create("other-scheme:///app/main.kn")).exists()).isFalse();
    }

    @Test
    @DisplayName("根不以 / 结尾时补齐；没有根时使用工作目录")
    void testRootNormalization() {
        URI withoutSlash = URI.create(first.toUri().toString().replaceAll("/$", ""));
        MultiRootFileSystem single = new MultiRootFileSystem(SCHEME, Collections.singletonList(withoutSlash),
                StandardFileSystem.INSTANCE);

        assertThat(single.getRoots().get(0).toString()).endsWith("/");
        assertThat(Paths.get(single.resolveRoot(URI.create(SCHEME + ":///lib/shared.kn"))))
                .isEqualTo(first.resolve("lib/shared.kn"));

        MultiRootFileSystem defaulted = new MultiRootFileSystem(SCHEME, Collections.<URI>emptyList(),
                StandardFileSystem.INSTANCE);
        assertThat(Paths.get(defaulted.getRoots().get(0))).isEqualTo(Paths.get("").toAbsolutePath());
    }
}
