package com.kilnlang.worker.session;

import com.kilnlang.compiler.fs.FileSystem;
import com.kilnlang.worker.options.WorkerOptions;

import java.io.IOException;

/**
 * 为请求提供编译会话。实现可以每次新建，也可以跨请求复用已加载的输入。
 */
public interface SessionProvider {

    /**
     * @throws IOException 平台摘要、依赖摘要或包元数据无法读取或解码
     */
    CompilationSession open(WorkerOptions options, FileSystem fileSystem) throws IOException;
}
