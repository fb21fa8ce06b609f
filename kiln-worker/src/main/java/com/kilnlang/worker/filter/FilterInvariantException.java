package com.kilnlang.worker.filter;

import com.kilnlang.ir.graph.Reference;

import java.net.URI;

/**
 * 过滤后保留的模块仍引用了没有规范名的目标，序列化结果将无法链接
 */
public class FilterInvariantException extends Exception {
    private final URI module;
    private final Reference reference;

    public FilterInvariantException(URI module, Reference reference) {
        super("Reference to '" + reference + "' from " + module + " has no canonical binding after filtering");
        this.module = module;
        this.reference = reference;
    }

    public URI getModule() {
        return module;
    }

    public Reference getReference() {
        return reference;
    }
}
