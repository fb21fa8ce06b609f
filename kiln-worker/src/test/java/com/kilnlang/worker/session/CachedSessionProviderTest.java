package com.kilnlang.worker.session;

import com.kilnlang.compiler.diagnostic.DiagnosticHandler;
import com.kilnlang.compiler.fs.FileSystem;
import com.kilnlang.compiler.fs.StandardFileSystem;
import com.kilnlang.compiler.service.CompilerService;
import com.kilnlang.compiler.service.CompilerState;
import com.kilnlang.compiler.service.KilnCompiler;
import com.kilnlang.ir.codec.ModuleGraphCodec;
import com.kilnlang.ir.graph.ModuleGraph;
import com.kilnlang.worker.WorkerFixtures;
import com.kilnlang.worker.options.OptionsParser;
import com.kilnlang.worker.options.WorkerOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("会话提供者测试")
class CachedSessionProviderTest {

    @TempDir
    Path tempDir;

    private Path platform;
    private RecordingCompiler compiler;
    private WorkerOptions options;

    /** 记录每次初始化收到的 previous 参数 */
    static class RecordingCompiler implements CompilerService {
        final KilnCompiler delegate = new KilnCompiler();
        final List<CompilerState> previousStates = new ArrayList<>();

        @Override
        public CompilerState initializeCompiler(CompilerState previous, URI platformSummary, URI packageMetadata,
                                                List<URI> inputSummaries, List<URI> inputLinked,
                                                FileSystem fileSystem) throws IOException {
            previousStates.add(previous);
            return delegate.initializeCompiler(previous, platformSummary, packageMetadata,
                    inputSummaries, inputLinked, fileSystem);
        }

        @Override
        public ModuleGraph compile(CompilerState state, List<URI> sources, boolean summaryOnly,
                                   DiagnosticHandler onDiagnostic) {
            return delegate.compile(state, sources, summaryOnly, onDiagnostic);
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        platform = WorkerFixtures.writePlatform(tempDir);
        compiler = new RecordingCompiler();
        options = new OptionsParser(tempDir).parse(Arrays.asList(
                "--platform-summary", "platform.kir", "--source", "main.kn", "--output", "out.kir"));
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(WorkerConfig.SESSION_CACHE_SIZE);
    }

    @Nested
    @DisplayName("CachedSessionProvider")
    class Cached {

        @Test
        @DisplayName("输入未变化时复用上一次的状态")
        void testReuse() throws Exception {
            CachedSessionProvider provider = new CachedSessionProvider(compiler, 2);

            CompilationSession first = provider.open(options, StandardFileSystem.INSTANCE);
            CompilationSession second = provider.open(options, StandardFileSystem.INSTANCE);

            assertThat(compiler.previousStates).hasSize(2);
            assertThat(compiler.previousStates.get(0)).isNull();
            assertThat(compiler.previousStates.get(1)).isSameAs(first.getState());
            assertThat(second.getState().getInputDigest()).isEqualTo(first.getState().getInputDigest());
            assertThat(second.getState().getPlatformModules()).isEqualTo(first.getState().getPlatformModules());
            assertThat(provider.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("输入内容变化时重新加载")
        void testReloadOnChange() throws Exception {
            CachedSessionProvider provider = new CachedSessionProvider(compiler, 2);
            CompilationSession first = provider.open(options, StandardFileSystem.INSTANCE);

            Files.write(platform, ModuleGraphCodec.encode(new ModuleGraph()));
            CompilationSession second = provider.open(options, StandardFileSystem.INSTANCE);

            assertThat(second.getState().getInputDigest()).isNotEqualTo(first.getState().getInputDigest());
            assertThat(second.getState().getPlatformModules()).isEmpty();
        }

        @Test
        @DisplayName("缓存大小必须为正")
        void testRejectsNonPositiveSize() {
            assertThatThrownBy(() -> new CachedSessionProvider(compiler, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("FreshSessionProvider 每次都从头初始化")
    void testFreshNeverReuses() throws Exception {
        FreshSessionProvider provider = new FreshSessionProvider(compiler);

        provider.open(options, StandardFileSystem.INSTANCE);
        provider.open(options, StandardFileSystem.INSTANCE);

        assertThat(compiler.previousStates).containsExactly(null, null);
    }

    @Test
    @DisplayName("会话编译收集诊断")
    void testSessionCollectsDiagnostics() throws Exception {
        WorkerFixtures.writeSource(tempDir.resolve("main.kn"), "val n: Int = missing;\n");
        CompilationSession session = new FreshSessionProvider(compiler).open(options, StandardFileSystem.INSTANCE);

        CompileOutcome outcome = session.compile(options.getSources(), true);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getGraph()).isNull();
        assertThat(outcome.getDiagnostics()).hasSize(1);
        assertThat(outcome.getDiagnostics().get(0).getMessage()).isEqualTo("Undefined name 'missing'");
    }

    @Nested
    @DisplayName("WorkerConfig")
    class Config {

        @Test
        @DisplayName("单次模式总是新建会话")
        void testSingleShot() {
            assertThat(WorkerConfig.sessionProvider(compiler, false)).isInstanceOf(FreshSessionProvider.class);
        }

        @Test
        @DisplayName("持久模式默认缓存，大小为 0 时关闭")
        void testPersistent() {
            assertThat(WorkerConfig.sessionCacheSize()).isEqualTo(WorkerConfig.DEFAULT_SESSION_CACHE_SIZE);
            assertThat(WorkerConfig.sessionProvider(compiler, true)).isInstanceOf(CachedSessionProvider.class);

            System.setProperty(WorkerConfig.SESSION_CACHE_SIZE, "0");
            assertThat(WorkerConfig.sessionProvider(compiler, true)).isInstanceOf(FreshSessionProvider.class);
        }
    }
}
