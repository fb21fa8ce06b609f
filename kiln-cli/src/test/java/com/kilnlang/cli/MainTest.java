package com.kilnlang.cli;

import com.kilnlang.ir.codec.ModuleGraphCodec;
import com.kilnlang.ir.graph.ModuleGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Main 测试")
class MainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String input, String... args) {
        InputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        return Main.run(args, in, new PrintStream(out, true), new PrintStream(err, true));
    }

    private String text(ByteArrayOutputStream stream) {
        return new String(stream.toByteArray(), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("单次模式")
    class SingleShot {

        @Test
        @DisplayName("成功编译写出输出文件，退出码 0")
        void testCompile() throws Exception {
            Path platform = tempDir.resolve("platform.kir");
            Files.write(platform, ModuleGraphCodec.encode(new ModuleGraph()));
            Path source = tempDir.resolve("main.kn");
            Files.write(source, "val greeting: String = \"hi\";\n".getBytes(StandardCharsets.UTF_8));
            Path output = tempDir.resolve("main.kir");

            int exit = run("", "--platform-summary", platform.toUri().toString(),
                    "--source", source.toUri().toString(),
                    "--exclude-non-sources", "--output", output.toString());

            assertThat(exit).isZero();
            assertThat(ModuleGraphCodec.decode(Files.readAllBytes(output)).getModuleIdentities())
                    .containsExactly(source.toUri());
            assertThat(text(err)).isEmpty();
        }

        @Test
        @DisplayName("编译错误写到 stderr，退出码 15")
        void testCompileError() throws Exception {
            Path platform = tempDir.resolve("platform.kir");
            Files.write(platform, ModuleGraphCodec.encode(new ModuleGraph()));
            Path source = tempDir.resolve("main.kn");
            Files.write(source, "val x: Int = y;\n".getBytes(StandardCharsets.UTF_8));

            int exit = run("", "--platform-summary", platform.toUri().toString(),
                    "--source", source.toUri().toString(), "--output", tempDir.resolve("main.kir").toString());

            assertThat(exit).isEqualTo(15);
            assertThat(text(err)).contains("Undefined name 'y'");
            assertThat(tempDir.resolve("main.kir")).doesNotExist();
        }

        @Test
        @DisplayName("损坏的平台摘要报告为诊断，退出码 15")
        void testCorruptSummary() throws Exception {
            Path platform = tempDir.resolve("platform.kir");
            Files.write(platform, ByteBuffer.allocate(12)
                    .putInt(ModuleGraphCodec.MAGIC).putInt(ModuleGraphCodec.VERSION).putInt(-5).array());
            Path source = tempDir.resolve("main.kn");
            Files.write(source, "val x: Int = 1;\n".getBytes(StandardCharsets.UTF_8));

            int exit = run("", "--platform-summary", platform.toUri().toString(),
                    "--source", source.toUri().toString(), "--output", tempDir.resolve("main.kir").toString());

            assertThat(exit).isEqualTo(15);
            assertThat(text(err)).contains("Invalid name count -5");
            assertThat(tempDir.resolve("main.kir")).doesNotExist();
        }

        @Test
        @DisplayName("--help 输出到 stdout")
        void testHelp() {
            assertThat(run("", "--help")).isZero();
            assertThat(text(out)).contains("--platform-summary");
            assertThat(text(err)).isEmpty();
        }

        @Test
        @DisplayName("缺少参数时报告选项错误")
        void testNoArguments() {
            assertThat(run("")).isEqualTo(15);
            assertThat(text(err)).contains("Error: Missing required option: '--platform-summary'");
        }
    }

    @Nested
    @DisplayName("持久模式")
    class Persistent {

        @Test
        @DisplayName("逐行处理请求直到输入结束")
        void testLoop() {
            String input = "{\"arguments\":[\"--help\"],\"requestId\":7}\n"
                    + "{\"arguments\":[\"--bogus\"],\"requestId\":8}\n";

            int exit = run(input, "--persistent_worker");

            assertThat(exit).isZero();
            String[] lines = text(out).split("\n");
            assertThat(lines).hasSize(2);
            assertThat(lines[0]).startsWith("{\"exitCode\":0,").endsWith("\"requestId\":7}");
            assertThat(lines[1]).startsWith("{\"exitCode\":15,").endsWith("\"requestId\":8}");
        }

        @Test
        @DisplayName("--persistent_worker 必须是唯一参数")
        void testPersistentFlagMustBeAlone() {
            assertThat(run("", "--persistent_worker", "--help")).isEqualTo(Main.EXIT_STARTUP_ERROR);
            assertThat(text(err)).contains("--persistent_worker");
            assertThat(text(out)).isEmpty();
        }
    }
}
