package com.kilnlang.compiler.service;

import com.kilnlang.compiler.fs.FileSystem;
import com.kilnlang.compiler.packages.PackageConfig;
import com.kilnlang.ir.graph.ModuleNode;

import java.net.URI;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 编译会话句柄：已加载的平台摘要、依赖摘要、包元数据和文件系统。
 *
 * <p>初始化后只读。除文件系统外的部分可以跨请求复用，编译过程从不修改它们。</p>
 */
public final class CompilerState {
    private final String inputDigest;
    private final PackageConfig packages;
    private final List<ModuleNode> platformModules;
    private final Map<URI, ModuleNode> externalModules;
    private final FileSystem fileSystem;

    CompilerState(String inputDigest, PackageConfig packages, List<ModuleNode> platformModules,
                  Map<URI, ModuleNode> externalModules, FileSystem fileSystem) {
        this.inputDigest = inputDigest;
        this.packages = packages;
        this.platformModules = Collections.unmodifiableList(platformModules);
        this.externalModules = Collections.unmodifiableMap(externalModules);
        this.fileSystem = fileSystem;
    }

    /** 复用已加载的输入，只替换文件系统 */
    CompilerState withFileSystem(FileSystem fs) {
        return new CompilerState(inputDigest, packages, platformModules, externalModules, fs);
    }

    /** 全部输入内容的 SHA-256 */
    public String getInputDigest() {
        return inputDigest;
    }

    public PackageConfig getPackages() {
        return packages;
    }

    /** 平台模块：所有源文件隐式可见 */
    public List<ModuleNode> getPlatformModules() {
        return platformModules;
    }

    public ModuleNode getExternalModule(URI identity) {
        return externalModules.get(identity);
    }

    public boolean isExternal(URI identity) {
        return externalModules.containsKey(identity);
    }

    public Collection<ModuleNode> getExternalModules() {
        return externalModules.values();
    }

    public FileSystem getFileSystem() {
        return fileSystem;
    }
}
