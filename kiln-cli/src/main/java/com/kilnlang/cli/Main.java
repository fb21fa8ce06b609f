package com.kilnlang.cli;

import com.kilnlang.compiler.diagnostic.Diagnostic;
import com.kilnlang.compiler.diagnostic.DiagnosticCode;
import com.kilnlang.compiler.fs.StandardFileSystem;
import com.kilnlang.compiler.service.CompilerService;
import com.kilnlang.compiler.service.KilnCompiler;
import com.kilnlang.worker.options.OptionsParser;
import com.kilnlang.worker.protocol.WorkerLoop;
import com.kilnlang.worker.protocol.WorkerTransport;
import com.kilnlang.worker.request.RequestResult;
import com.kilnlang.worker.request.RequestRunner;
import com.kilnlang.worker.session.WorkerConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Kiln summary worker 入口点
 *
 * <p>{@code --persistent_worker} 进入持久模式，从 stdin 逐行读取请求；
 * 其他参数按单次请求处理，诊断输出到 stderr，帮助文本输出到 stdout。</p>
 */
public final class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    static final String PERSISTENT_WORKER_FLAG = "--persistent_worker";
    /** 启动参数错误或协议流不可用 */
    static final int EXIT_STARTUP_ERROR = 2;

    private Main() {
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        List<String> arguments = Arrays.asList(args);
        CompilerService compiler = new KilnCompiler();
        OptionsParser parser = new OptionsParser(Paths.get(""));

        if (arguments.contains(PERSISTENT_WORKER_FLAG)) {
            if (arguments.size() != 1) {
                err.println("错误: " + PERSISTENT_WORKER_FLAG + " 必须是唯一的参数，其余参数由每个请求提供");
                return EXIT_STARTUP_ERROR;
            }
            RequestRunner runner = new RequestRunner(parser,
                    WorkerConfig.sessionProvider(compiler, true), StandardFileSystem.INSTANCE);
            try {
                new WorkerLoop(new WorkerTransport(in, out), runner).run();
                return RequestResult.EXIT_SUCCESS;
            } catch (IOException e) {
                LOG.log(Level.SEVERE, "协议流读写失败", e);
                err.println("错误: " + e.getMessage());
                return EXIT_STARTUP_ERROR;
            }
        }

        RequestRunner runner = new RequestRunner(parser,
                WorkerConfig.sessionProvider(compiler, false), StandardFileSystem.INSTANCE);
        RequestResult result;
        try {
            result = runner.run(arguments);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "处理请求时出错", e);
            err.println("错误: 内部错误 " + e);
            return WorkerLoop.EXIT_INTERNAL_ERROR;
        }
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            PrintStream target = diagnostic.getCode() == DiagnosticCode.USAGE ? out : err;
            target.println(diagnostic.format());
        }
        return result.exitCode();
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream config = Main.class.getResourceAsStream("/kiln-logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("警告: 无法加载日志配置: " + e.getMessage());
        }
    }
}
