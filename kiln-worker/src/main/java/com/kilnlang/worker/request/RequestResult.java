package com.kilnlang.worker.request;

import com.kilnlang.compiler.diagnostic.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个请求的处理结果
 */
public final class RequestResult {

    public static final int EXIT_SUCCESS = 0;
    /** 构建工具约定的“已输出诊断”退出码 */
    public static final int EXIT_DIAGNOSTICS = 15;

    private final boolean success;
    private final List<Diagnostic> diagnostics;
    private final long artifactLength;
    private final RequestStage stage;

    private RequestResult(boolean success, List<Diagnostic> diagnostics, long artifactLength, RequestStage stage) {
        this.success = success;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.artifactLength = artifactLength;
        this.stage = stage;
    }

    public static RequestResult success(List<Diagnostic> diagnostics, long artifactLength, RequestStage stage) {
        return new RequestResult(true, diagnostics, artifactLength, stage);
    }

    public static RequestResult failure(List<Diagnostic> diagnostics, RequestStage stage) {
        return new RequestResult(false, diagnostics, -1, stage);
    }

    public boolean isSuccess() {
        return success;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** 输出文件字节数；未写出时为 -1 */
    public long getArtifactLength() {
        return artifactLength;
    }

    /** 成功时为 DONE（帮助请求为 PARSING），失败时为出错的阶段 */
    public RequestStage getStage() {
        return stage;
    }

    public int exitCode() {
        return success ? EXIT_SUCCESS : EXIT_DIAGNOSTICS;
    }

    /** 全部诊断的文本，每条一行 */
    public String formatOutput() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic diagnostic : diagnostics) {
            sb.append(diagnostic.format()).append('\n');
        }
        return sb.toString();
    }
}
