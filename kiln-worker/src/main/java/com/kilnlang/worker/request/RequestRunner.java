package com.kilnlang.worker.request;

import com.kilnlang.compiler.diagnostic.Diagnostic;
import com.kilnlang.compiler.diagnostic.DiagnosticCode;
import com.kilnlang.compiler.fs.FileSystem;
import com.kilnlang.ir.graph.ModuleGraph;
import com.kilnlang.worker.args.ArgFileUnreadableException;
import com.kilnlang.worker.args.ArgumentExpander;
import com.kilnlang.worker.filter.FilterInvariantException;
import com.kilnlang.worker.filter.GraphFilter;
import com.kilnlang.worker.fs.MultiRootFileSystem;
import com.kilnlang.worker.options.OptionParseException;
import com.kilnlang.worker.options.OptionsParser;
import com.kilnlang.worker.options.WorkerOptions;
import com.kilnlang.worker.output.ArtifactWriteException;
import com.kilnlang.worker.output.ArtifactWriter;
import com.kilnlang.worker.session.CompilationSession;
import com.kilnlang.worker.session.CompileOutcome;
import com.kilnlang.worker.session.SessionProvider;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 处理单个编译请求：解析 → 初始化 → 编译 → 过滤 → 写出。
 *
 * <p>每类已知错误都转为诊断并结束请求，不向调用方抛出。单次模式和持久模式共用。</p>
 */
public class RequestRunner {
    private static final Logger LOG = Logger.getLogger(RequestRunner.class.getName());

    private final OptionsParser parser;
    private final SessionProvider sessions;
    private final FileSystem physical;

    public RequestRunner(OptionsParser parser, SessionProvider sessions, FileSystem physical) {
        this.parser = parser;
        this.sessions = sessions;
        this.physical = physical;
    }

    public RequestResult run(List<String> arguments) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        // PARSING
        WorkerOptions options;
        try {
            options = parser.parse(ArgumentExpander.expand(arguments));
        } catch (ArgFileUnreadableException e) {
            return fail(diagnostics, DiagnosticCode.ARG_FILE_UNREADABLE, e.getMessage(), RequestStage.PARSING);
        } catch (OptionParseException e) {
            return fail(diagnostics, DiagnosticCode.OPTION_PARSE_ERROR, e.getMessage(), RequestStage.PARSING);
        }
        if (options.isHelp()) {
            diagnostics.add(Diagnostic.info(DiagnosticCode.USAGE, OptionsParser.usage()));
            return RequestResult.success(diagnostics, -1, RequestStage.PARSING);
        }

        // RESOLVING
        MultiRootFileSystem fileSystem = new MultiRootFileSystem(
                options.getMultiRootScheme(), options.getMultiRoots(), physical);
        CompilationSession session;
        try {
            session = sessions.open(options, fileSystem);
        } catch (IOException e) {
            return fail(diagnostics, DiagnosticCode.RESOLUTION_ERROR, String.valueOf(e.getMessage()),
                    RequestStage.RESOLVING);
        }

        // COMPILING
        CompileOutcome outcome = session.compile(options.getSources(), options.isSummaryOnly());
        diagnostics.addAll(outcome.getDiagnostics());
        if (!outcome.isSuccess()) {
            LOG.fine("编译失败: " + options.getSources());
            return RequestResult.failure(diagnostics, RequestStage.COMPILING);
        }
        ModuleGraph graph = outcome.getGraph();

        // FILTERING
        if (options.isSummaryOnly() && options.isExcludeNonSources()) {
            try {
                GraphFilter.filter(graph, options.getSources());
            } catch (FilterInvariantException e) {
                return fail(diagnostics, DiagnosticCode.FILTER_INVARIANT_VIOLATION, e.getMessage(),
                        RequestStage.FILTERING);
            }
        }

        // WRITING
        long length;
        try {
            length = ArtifactWriter.write(graph, outputPath(options.getOutput()));
        } catch (ArtifactWriteException e) {
            return fail(diagnostics, DiagnosticCode.ARTIFACT_WRITE_FAILED, e.getMessage(), RequestStage.WRITING);
        }
        return RequestResult.success(diagnostics, length, RequestStage.DONE);
    }

    private Path outputPath(String output) {
        return Paths.get(parser.getWorkingDirectory()).resolve(output);
    }

    private static RequestResult fail(List<Diagnostic> diagnostics, DiagnosticCode code, String message,
                                      RequestStage stage) {
        diagnostics.add(Diagnostic.error(code, message));
        return RequestResult.failure(diagnostics, stage);
    }
}
