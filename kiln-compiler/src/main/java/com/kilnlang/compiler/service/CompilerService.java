package com.kilnlang.compiler.service;

import com.kilnlang.compiler.diagnostic.DiagnosticHandler;
import com.kilnlang.compiler.fs.FileSystem;
import com.kilnlang.ir.graph.ModuleGraph;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * 编译器服务契约。
 *
 * <p>worker 只通过这两个操作与编译器交互，不依赖其内部实现。</p>
 */
public interface CompilerService {

    /**
     * 初始化编译状态。
     *
     * @param previous        上一次的状态（可为 null）；输入未变化时可复用其已解码的摘要
     * @param platformSummary 平台摘要
     * @param packageMetadata 包元数据（可为 null）
     * @param inputSummaries  依赖摘要：用于符号解析，不会重新编译
     * @param inputLinked     已链接的依赖图，视为不可变上下文
     * @param fileSystem      读取全部输入和源码所用的文件系统
     * @throws IOException 任一输入无法读取或解码
     */
    CompilerState initializeCompiler(CompilerState previous, URI platformSummary, URI packageMetadata,
                                     List<URI> inputSummaries, List<URI> inputLinked,
                                     FileSystem fileSystem) throws IOException;

    /**
     * 编译源模块。诊断逐条回调，不会因第一个错误停止。
     *
     * @param summaryOnly 只输出外形（不含常量）
     * @return 模块图；报告过任何错误时返回 null
     */
    ModuleGraph compile(CompilerState state, List<URI> sources, boolean summaryOnly,
                        DiagnosticHandler onDiagnostic);
}
