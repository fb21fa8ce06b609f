package com.kilnlang.worker.session;

import com.kilnlang.compiler.diagnostic.Diagnostic;
import com.kilnlang.compiler.service.CompilerService;
import com.kilnlang.compiler.service.CompilerState;
import com.kilnlang.ir.graph.ModuleGraph;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * 已初始化的编译会话。状态只读，可以被多个请求先后使用。
 */
public final class CompilationSession {
    private final CompilerService service;
    private final CompilerState state;

    public CompilationSession(CompilerService service, CompilerState state) {
        this.service = service;
        this.state = state;
    }

    public CompilerState getState() {
        return state;
    }

    public CompileOutcome compile(List<URI> sources, boolean summaryOnly) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        ModuleGraph graph = service.compile(state, sources, summaryOnly, diagnostics::add);
        return new CompileOutcome(graph, diagnostics);
    }
}
