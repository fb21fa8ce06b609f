package com.kilnlang.worker.session;

import com.kilnlang.compiler.fs.FileSystem;
import com.kilnlang.compiler.service.CompilerService;
import com.kilnlang.compiler.service.CompilerState;
import com.kilnlang.worker.options.WorkerOptions;

import java.io.IOException;

/**
 * 每个请求新建会话，不做缓存（单次模式）
 */
public class FreshSessionProvider implements SessionProvider {
    private final CompilerService service;

    public FreshSessionProvider(CompilerService service) {
        this.service = service;
    }

    @Override
    public CompilationSession open(WorkerOptions options, FileSystem fileSystem) throws IOException {
        CompilerState state = service.initializeCompiler(null, options.getPlatformSummary(),
                options.getPackageMetadata(), options.getInputSummaries(), options.getInputLinked(), fileSystem);
        return new CompilationSession(service, state);
    }
}
