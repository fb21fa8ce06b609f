package com.kilnlang.worker.session;

import com.kilnlang.compiler.diagnostic.Diagnostic;
import com.kilnlang.ir.graph.ModuleGraph;

import java.util.Collections;
import java.util.List;

/**
 * 一次编译的结果：模块图（失败时为 null）和收集到的诊断
 */
public final class CompileOutcome {
    private final ModuleGraph graph;
    private final List<Diagnostic> diagnostics;

    public CompileOutcome(ModuleGraph graph, List<Diagnostic> diagnostics) {
        this.graph = graph;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public ModuleGraph getGraph() {
        return graph;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean isSuccess() {
        return graph != null;
    }
}
